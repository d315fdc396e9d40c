package org.javai.railway.retry;

import org.javai.railway.ConfigResolver;
import org.javai.railway.Failure;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether and when to retry after a failure.
 */
public interface RetryPolicy {

    String MAX_RETRIES_PROPERTY = "railway.retry.maxRetries";
    String MAX_RETRIES_ENV = "RAILWAY_RETRY_MAX_RETRIES";
    String INITIAL_DELAY_PROPERTY = "railway.retry.initialDelayMs";
    String INITIAL_DELAY_ENV = "RAILWAY_RETRY_INITIAL_DELAY_MS";
    String BACKOFF_MULTIPLIER_PROPERTY = "railway.retry.backoffMultiplier";
    String BACKOFF_MULTIPLIER_ENV = "RAILWAY_RETRY_BACKOFF_MULTIPLIER";

    int DEFAULT_MAX_RETRIES = 3;
    Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    /**
     * A unique identifier for this policy, used in logging.
     */
    String id();

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param context The current retry context
     * @param failure The failure that occurred
     * @return Retry with a delay, or GiveUp with the reason
     */
    RetryDecision decide(RetryContext context, Failure failure);

    /**
     * Three retries, 100 ms initial delay, doubling each time, every failure retried.
     */
    static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return builder().id("no-retry").maxRetries(0).build();
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a policy from {@code railway.retry.*} system properties or
     * {@code RAILWAY_RETRY_*} environment variables, using the defaults for anything unset.
     *
     * @throws IllegalStateException if a configured value cannot be parsed
     * @throws IllegalArgumentException if a configured value is out of range
     */
    static RetryPolicy fromConfiguration() {
        return fromConfiguration(ConfigResolver.system());
    }

    static RetryPolicy fromConfiguration(ConfigResolver config) {
        Objects.requireNonNull(config, "config must not be null");
        return builder()
                .id("configured")
                .maxRetries(config.resolveInt(MAX_RETRIES_PROPERTY, MAX_RETRIES_ENV, DEFAULT_MAX_RETRIES))
                .initialDelay(Duration.ofMillis(config.resolveLong(
                        INITIAL_DELAY_PROPERTY, INITIAL_DELAY_ENV, DEFAULT_INITIAL_DELAY.toMillis())))
                .backoffMultiplier(config.resolveDouble(
                        BACKOFF_MULTIPLIER_PROPERTY, BACKOFF_MULTIPLIER_ENV, DEFAULT_BACKOFF_MULTIPLIER))
                .build();
    }

    /**
     * Builder for {@link ExponentialBackoffPolicy}.
     *
     * <p>Example usage:</p>
     * <pre>{@code
     * RetryPolicy policy = RetryPolicy.builder()
     *     .maxRetries(5)
     *     .initialDelay(Duration.ofMillis(250))
     *     .backoffMultiplier(1.5)
     *     .retryIf(failure -> failure instanceof Failure.ServiceUnavailable)
     *     .build();
     * }</pre>
     */
    final class Builder {
        private String id = "exponential-backoff";
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private Predicate<? super Failure> shouldRetry = failure -> true;

        private Builder() {}

        public Builder id(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
            return this;
        }

        /**
         * @param maxRetries retries after the first attempt; 0 means a single attempt
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        /**
         * Only failures accepted by the predicate are retried; the rest stop the loop at once.
         */
        public Builder retryIf(Predicate<? super Failure> shouldRetry) {
            this.shouldRetry = Objects.requireNonNull(shouldRetry, "shouldRetry must not be null");
            return this;
        }

        public ExponentialBackoffPolicy build() {
            return new ExponentialBackoffPolicy(id, maxRetries, initialDelay, backoffMultiplier, shouldRetry::test);
        }
    }
}
