package com.streambot.client.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of the event listener, sent back as the {@code data} of an
 * {@link UpstreamAck}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventAck {

    public enum Status {
        /** Event consumed. */
        SUCCESS,
        /** Ask the server to redeliver later. */
        LATER
    }

    private Status status = Status.SUCCESS;
    private String message = "";

    public static EventAck success() {
        return new EventAck(Status.SUCCESS, "");
    }

    public static EventAck later(String message) {
        return new EventAck(Status.LATER, message != null ? message : "");
    }
}
