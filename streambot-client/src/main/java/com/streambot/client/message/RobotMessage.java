package com.streambot.client.message;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Message delivered to a robot on the {@code /v1.0/im/bot/messages/get}
 * callback topic.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RobotMessage {

    /** Single chat. */
    public static final String CONVERSATION_SINGLE = "1";
    /** Group chat. */
    public static final String CONVERSATION_GROUP = "2";

    private String msgId;
    private String msgtype;
    @JsonAlias("text")
    private MessageContent content;

    private String conversationId;
    private String conversationType;
    private String conversationTitle;

    private List<AtUser> atUsers;
    private Boolean isInAtList;

    private String chatbotCorpId;
    private String chatbotUserId;

    private String senderId;
    private String senderNick;
    private String senderCorpId;
    private String senderStaffId;

    private Long sessionWebhookExpiredTime;
    private String sessionWebhook;
    private Boolean isAdmin;
    private Long createAt;

    /** Trimmed text of a text message, or {@code null} for other types. */
    public String textContent() {
        if (content == null || content.getContent() == null) {
            return null;
        }
        return content.getContent().trim();
    }

    public boolean isGroupConversation() {
        return CONVERSATION_GROUP.equals(conversationType);
    }
}
