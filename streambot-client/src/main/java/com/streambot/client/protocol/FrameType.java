package com.streambot.client.protocol;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Top-level classification of a downstream frame.
 */
public enum FrameType {
    /** Protocol housekeeping: ping, CONNECTED, REGISTERED, disconnect, KEEPALIVE. */
    SYSTEM,
    /** Platform event, answered by the single event listener. */
    EVENT,
    /** Business callback, fanned out to topic listeners. */
    CALLBACK,
    @JsonEnumDefaultValue
    UNKNOWN
}
