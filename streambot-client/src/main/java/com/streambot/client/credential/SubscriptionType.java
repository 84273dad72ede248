package com.streambot.client.credential;

/**
 * Kinds of pushes a connection can subscribe to.
 */
public enum SubscriptionType {
    EVENT,
    SYSTEM,
    CALLBACK
}
