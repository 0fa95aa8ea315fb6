package com.voxagent.providers;

/**
 * Non-200 answer from a model endpoint. Carries the status code and any Retry-After
 * hint so the retry loop does not have to parse messages.
 */
public class ProviderException extends RuntimeException {

    private final int statusCode;
    private final long retryAfterMs;

    public ProviderException(int statusCode, String message) {
        this(statusCode, message, 0);
    }

    public ProviderException(int statusCode, String message, long retryAfterMs) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public int statusCode() { return statusCode; }

    public long retryAfterMs() { return retryAfterMs; }

    /** Client errors other than 408 and 429 will fail the same way on retry. */
    public boolean isRetryable() {
        return statusCode < 400 || statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }
}
