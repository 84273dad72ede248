package com.streambot.common.infra;

/**
 * Error formatting utilities: extract readable messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Format the whole cause chain as {@code outer: inner: root}, skipping
     * causes whose message repeats the previous one.
     */
    public static String formatCauseChain(Throwable err) {
        if (err == null)
            return "Error";
        StringBuilder sb = new StringBuilder(formatErrorMessage(err));
        String last = sb.toString();
        Throwable cause = err.getCause();
        int depth = 0;
        while (cause != null && cause != err && depth < 8) {
            String msg = formatErrorMessage(cause);
            if (!last.contains(msg)) {
                sb.append(": ").append(msg);
                last = msg;
            }
            cause = cause.getCause();
            depth++;
        }
        return sb.toString();
    }
}
