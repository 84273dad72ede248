package com.streambot.client.credential;

import com.streambot.common.logging.LogRedact;

/**
 * AppKey/AppSecret pair identifying the robot application.
 */
public record ClientIdentity(String clientId, String clientSecret) {

    public ClientIdentity {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("clientSecret is required");
        }
    }

    @Override
    public String toString() {
        return "ClientIdentity[clientId=" + clientId + ", clientSecret=" + LogRedact.maskToken(clientSecret) + "]";
    }
}
