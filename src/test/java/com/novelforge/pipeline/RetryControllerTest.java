package com.novelforge.pipeline;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryControllerTest {

    private final List<Long> delays = new ArrayList<>();
    private final RetryController retry = new RetryController(delays::add);

    @Test
    void retriesTransientFailuresWithDoublingDelay() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = retry.execute("stream", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("Connection reset by peer");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(5L, 10L), delays);
    }

    @Test
    void givesUpAfterThreeAttempts() {
        AtomicInteger calls = new AtomicInteger();
        IOException error = assertThrows(IOException.class, () -> retry.execute("stream", () -> {
            calls.incrementAndGet();
            throw new IOException("Read timed out");
        }));

        assertEquals("Read timed out", error.getMessage());
        assertEquals(3, calls.get());
        assertEquals(List.of(5L, 10L), delays);
    }

    @Test
    void nonNetworkErrorsAreRaisedImmediately() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IOException.class, () -> retry.execute("stream", () -> {
            calls.incrementAndGet();
            throw new IOException("Chat request failed (401): invalid api key");
        }));

        assertEquals(1, calls.get());
        assertTrue(delays.isEmpty());
    }

    @Test
    void classifiesByMessageAndCause() {
        assertTrue(RetryController.isRetryable(new HttpTimeoutException("request")));
        assertTrue(RetryController.isRetryable(new IOException("wrapped", new IOException("Premature close"))));
        assertTrue(RetryController.isRetryable(new IllegalStateException("peer closed connection without sending complete message body: incomplete chunked read")));
        assertFalse(RetryController.isRetryable(new IOException("Chat request failed (400): bad request")));
        assertFalse(RetryController.isRetryable(new IllegalArgumentException()));
    }
}
