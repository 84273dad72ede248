package com.streambot.client.credential;

/**
 * One advertised subscription; equal by (type, topic).
 *
 * @param type  subscription kind
 * @param topic e.g. {@code "*"} or {@code "/v1.0/im/bot/messages/get"}
 */
public record Subscription(SubscriptionType type, String topic) {
}
