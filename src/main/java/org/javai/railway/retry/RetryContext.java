package org.javai.railway.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Context provided to retry policies for making decisions.
 *
 * @param attemptNumber The number of the attempt that just failed (1-based)
 * @param startedAt When the first attempt began
 */
public record RetryContext(int attemptNumber, Instant startedAt) {

    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    public static RetryContext first() {
        return new RetryContext(1, Instant.now());
    }

    public RetryContext next() {
        return new RetryContext(attemptNumber + 1, startedAt);
    }

    /**
     * Time elapsed since the first attempt began.
     */
    public Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }
}
