package org.javai.railway.retry;

import org.javai.railway.Failure;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retries up to {@code maxRetries} times, waiting {@code initialDelay} before the first retry
 * and multiplying the wait by {@code backoffMultiplier} before each one after that.
 *
 * @param id identifier used in logging
 * @param maxRetries retries after the first attempt (≥ 0)
 * @param initialDelay the wait before the first retry (not negative)
 * @param backoffMultiplier the growth factor between waits (finite, &gt; 0)
 * @param shouldRetry failures it rejects end the loop without further attempts
 */
public record ExponentialBackoffPolicy(
        String id,
        int maxRetries,
        Duration initialDelay,
        double backoffMultiplier,
        Predicate<Failure> shouldRetry
) implements RetryPolicy {

    public ExponentialBackoffPolicy {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(shouldRetry, "shouldRetry must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (!Double.isFinite(backoffMultiplier) || backoffMultiplier <= 0) {
            throw new IllegalArgumentException("backoffMultiplier must be finite and > 0, was: " + backoffMultiplier);
        }
    }

    @Override
    public RetryDecision decide(RetryContext context, Failure failure) {
        if (context.attemptNumber() > maxRetries) {
            return RetryDecision.GiveUp.because(RetryDecision.StopReason.EXHAUSTED);
        }
        if (!shouldRetry.test(failure)) {
            return RetryDecision.GiveUp.because(RetryDecision.StopReason.STOPPED_BY_POLICY);
        }
        return RetryDecision.Retry.after(delayBefore(context.attemptNumber()));
    }

    /**
     * The wait after the given failed attempt: initialDelay * multiplier^(attempt - 1).
     */
    Duration delayBefore(int failedAttempt) {
        double nanos = initialDelay.toNanos() * Math.pow(backoffMultiplier, failedAttempt - 1);
        if (nanos >= Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.round(nanos));
    }
}
