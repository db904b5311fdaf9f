package com.openforge.cortex.llm;

/**
 * Where a completion call is in its retry sequence.
 *
 * Attempt 0 is the first call. Every retry runs with {@code forceCpu} set, which
 * becomes {@code num_gpu: 0} on the wire.
 */
public record RetryState(int attempt, boolean forceCpu) {

    public static final int MAX_RETRIES  = 2;
    public static final int MAX_ATTEMPTS = MAX_RETRIES + 1;

    public RetryState {
        if (attempt < 0 || attempt > MAX_RETRIES) {
            throw new IllegalArgumentException("attempt out of range: " + attempt);
        }
    }

    public static RetryState initial() {
        return new RetryState(0, false);
    }

    public boolean canRetry() {
        return attempt < MAX_RETRIES;
    }

    public boolean isRetry() {
        return attempt > 0;
    }

    public RetryState next() {
        if (!canRetry()) {
            throw new IllegalStateException("Retry budget exhausted after attempt " + attempt);
        }
        return new RetryState(attempt + 1, true);
    }
}
