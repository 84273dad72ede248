package com.streambot.client.transport;

/**
 * One item of the receive-half of a {@link TransportSession}.
 *
 * @param kind  what arrived
 * @param text  frame text for {@link Kind#TEXT}, reason for
 *              {@link Kind#CLOSE}, description for {@link Kind#OTHER}
 * @param code  close status code, or -1
 * @param error cause for {@link Kind#ERROR}
 */
public record TransportEvent(Kind kind, String text, int code, Throwable error) {

    public enum Kind {
        TEXT,
        PONG,
        CLOSE,
        ERROR,
        OTHER
    }

    public static TransportEvent text(String text) {
        return new TransportEvent(Kind.TEXT, text, -1, null);
    }

    public static TransportEvent pong() {
        return new TransportEvent(Kind.PONG, null, -1, null);
    }

    public static TransportEvent close(int code, String reason) {
        return new TransportEvent(Kind.CLOSE, reason, code, null);
    }

    public static TransportEvent error(Throwable error) {
        return new TransportEvent(Kind.ERROR, null, -1, error);
    }

    public static TransportEvent other(String description) {
        return new TransportEvent(Kind.OTHER, description, -1, null);
    }
}
