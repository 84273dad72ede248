package com.streambot.client.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streambot.client.StreamConstants;
import com.streambot.client.StreamException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends robot messages to group conversations and to users.
 */
@Slf4j
public class RobotMessageSender {

    private final OpenApiClient openApi;
    private final ObjectMapper objectMapper;
    private final String robotCode;

    public RobotMessageSender(OpenApiClient openApi, ObjectMapper objectMapper, String robotCode) {
        this.openApi = openApi;
        this.objectMapper = objectMapper;
        this.robotCode = robotCode;
    }

    /**
     * @return the server's process query key for the send
     */
    public String sendToGroup(String openConversationId, MessageTemplate template) throws StreamException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("robotCode", robotCode);
        body.put("openConversationId", openConversationId);
        body.put("msgKey", template.msgKey());
        body.put("msgParam", encodeParam(template));

        SendResponse response = openApi.post(StreamConstants.GROUP_SEND_PATH, body, SendResponse.class);
        log.debug("Sent {} to group {}", template.msgKey(), openConversationId);
        return response != null ? response.getProcessQueryKey() : null;
    }

    /**
     * @return the server's process query key for the batch
     */
    public String sendToUsers(List<String> userIds, MessageTemplate template) throws StreamException {
        if (userIds == null || userIds.isEmpty()) {
            throw new IllegalArgumentException("userIds must not be empty");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("robotCode", robotCode);
        body.put("userIds", userIds);
        body.put("msgKey", template.msgKey());
        body.put("msgParam", encodeParam(template));

        SendResponse response = openApi.post(StreamConstants.BATCH_SEND_PATH, body, SendResponse.class);
        if (response != null && response.getInvalidStaffIdList() != null
                && !response.getInvalidStaffIdList().isEmpty()) {
            log.warn("Robot message rejected for users {}", response.getInvalidStaffIdList());
        }
        return response != null ? response.getProcessQueryKey() : null;
    }

    public String sendToUser(String userId, MessageTemplate template) throws StreamException {
        return sendToUsers(List.of(userId), template);
    }

    private String encodeParam(MessageTemplate template) throws StreamException {
        try {
            return objectMapper.writeValueAsString(template);
        } catch (JsonProcessingException e) {
            throw new StreamException("cannot encode " + template.msgKey(), e);
        }
    }
}
