package com.novelforge.pipeline;

import com.novelforge.AppLogger;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Retries transient network failures with exponential backoff.
 * Anything that does not look like a dropped or timed-out connection is raised at once.
 */
public class RetryController {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_INITIAL_DELAY_SECONDS = 5;

    private static final List<String> TRANSIENT_MARKERS = List.of(
        "connection reset", "timeout", "timed out", "premature close", "peer closed",
        "incomplete", "eof reached"
    );

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws IOException, InterruptedException;
    }

    private final Sleeper sleeper;
    private final int maxAttempts;
    private final long initialDelaySeconds;
    private final AppLogger logger = AppLogger.get();

    public RetryController(Sleeper sleeper) {
        this(sleeper, DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY_SECONDS);
    }

    public RetryController(Sleeper sleeper, int maxAttempts, long initialDelaySeconds) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.sleeper = sleeper;
        this.maxAttempts = maxAttempts;
        this.initialDelaySeconds = initialDelaySeconds;
    }

    public <T> T execute(String label, Attempt<T> attempt) throws IOException, InterruptedException {
        long delay = initialDelaySeconds;
        for (int i = 1; ; i++) {
            try {
                return attempt.run();
            } catch (IOException | RuntimeException e) {
                if (i >= maxAttempts || !isRetryable(e)) {
                    if (i > 1) {
                        logger.error("[Retry] " + label + " failed after " + i + " attempts: " + e.getMessage());
                    }
                    throw e;
                }
                logger.warn("[Retry] " + label + " attempt " + i + "/" + maxAttempts + " failed: "
                    + e.getMessage() + " - retrying in " + delay + "s");
                sleeper.sleepSeconds(delay);
                delay *= 2;
            }
        }
    }

    public static boolean isRetryable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : TRANSIENT_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
