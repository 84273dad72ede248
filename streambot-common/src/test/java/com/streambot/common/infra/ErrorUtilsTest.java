package com.streambot.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_usesMessage() {
        assertEquals("boom", ErrorUtils.formatErrorMessage(new IllegalStateException("boom")));
    }

    @Test
    void formatErrorMessage_fallsBackToClassName() {
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }

    @Test
    void formatCauseChain_joinsDistinctMessages() {
        Exception err = new Exception("get endpoint failed",
                new IOException("connection reset", new SocketTimeoutException("timeout")));
        assertEquals("get endpoint failed: connection reset: timeout", ErrorUtils.formatCauseChain(err));
    }

    @Test
    void formatCauseChain_skipsRepeatedMessage() {
        IOException root = new IOException("refused");
        Exception err = new Exception("refused", root);
        assertEquals("refused", ErrorUtils.formatCauseChain(err));
    }
}
