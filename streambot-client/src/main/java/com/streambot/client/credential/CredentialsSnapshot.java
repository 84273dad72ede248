package com.streambot.client.credential;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.ToString;
import lombok.Value;

import java.util.List;

/**
 * Immutable copy of {@link Credentials}, serialised as the body of the
 * gateway {@code connections/open} call.
 */
@Value
public class CredentialsSnapshot {

    String clientId;
    @ToString.Exclude
    String clientSecret;

    @JsonProperty("ua")
    String userAgent;

    List<Subscription> subscriptions;

    public CredentialsSnapshot(String clientId, String clientSecret, String userAgent,
            List<Subscription> subscriptions) {
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.userAgent = userAgent;
        this.subscriptions = List.copyOf(subscriptions);
    }
}
