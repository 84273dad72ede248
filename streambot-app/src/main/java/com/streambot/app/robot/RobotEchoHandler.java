package com.streambot.app.robot;

import com.streambot.client.StreamException;
import com.streambot.client.dispatch.TopicListener;
import com.streambot.client.message.MessageTemplate;
import com.streambot.client.message.RobotMessage;
import com.streambot.client.message.RobotMessageSender;
import com.streambot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs every robot message; with echo enabled, answers text messages in the
 * same conversation.
 */
@Slf4j
public class RobotEchoHandler implements TopicListener<RobotMessage> {

    private final RobotMessageSender sender;
    private final boolean echo;

    public RobotEchoHandler(RobotMessageSender sender, boolean echo) {
        this.sender = sender;
        this.echo = echo;
    }

    @Override
    public void onMessage(RobotMessage message) {
        log.info("Robot message {} from {} in {} ({}): {}",
                message.getMsgId(), message.getSenderNick(), message.getConversationId(),
                message.getMsgtype(), message.textContent());
        if (!echo) {
            return;
        }
        String text = message.textContent();
        if (text == null || text.isEmpty()) {
            log.debug("Nothing to echo for {} message {}", message.getMsgtype(), message.getMsgId());
            return;
        }
        MessageTemplate reply = new MessageTemplate.SampleText(text);
        try {
            if (message.isGroupConversation()) {
                sender.sendToGroup(message.getConversationId(), reply);
            } else if (message.getSenderStaffId() != null) {
                sender.sendToUser(message.getSenderStaffId(), reply);
            } else {
                log.warn("Cannot echo message {}: sender has no staff id", message.getMsgId());
            }
        } catch (StreamException e) {
            log.warn("Echo for message {} failed: {}", message.getMsgId(), ErrorUtils.formatCauseChain(e));
        }
    }
}
