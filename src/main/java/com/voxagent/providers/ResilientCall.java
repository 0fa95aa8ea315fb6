package com.voxagent.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Retry loop with exponential backoff. Non-retryable provider errors fail at once;
 * rate limits honour the server's Retry-After hint up to a cap.
 */
public final class ResilientCall {

    private static final Logger log = LoggerFactory.getLogger(ResilientCall.class);

    static final int MAX_RETRIES = 2;
    static final long INITIAL_DELAY_MS = 500;
    private static final long MAX_BACKOFF_MS = 10_000;
    private static final long RETRY_AFTER_CAP_MS = 30_000;

    private ResilientCall() {}

    public static <T> T execute(Callable<T> action) {
        return execute(action, MAX_RETRIES, INITIAL_DELAY_MS);
    }

    public static <T> T execute(Callable<T> action, int maxRetries, long baseDelayMs) {
        Exception last = null;
        long delay = baseDelayMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                if (!isRetryable(e)) break;
                if (attempt < maxRetries) {
                    long wait = Math.max(delay, retryAfterMs(e));
                    log.debug("Attempt {} failed ({}), retrying in {} ms", attempt + 1, e.getMessage(), wait);
                    sleep(wait);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        if (last instanceof RuntimeException re && !isRetryable(last)) throw re;
        throw new RuntimeException("All retries exhausted", last);
    }

    static boolean isRetryable(Exception e) {
        if (e instanceof ProviderException pe) return pe.isRetryable();
        return !(e.getCause() instanceof InterruptedException);
    }

    static long retryAfterMs(Exception e) {
        if (e instanceof ProviderException pe && pe.statusCode() == 429) {
            return Math.min(Math.max(pe.retryAfterMs(), 0), RETRY_AFTER_CAP_MS);
        }
        return 0;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted during retry", ie);
        }
    }
}
