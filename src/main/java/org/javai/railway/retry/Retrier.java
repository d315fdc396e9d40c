package org.javai.railway.retry;

import org.javai.railway.CancellationToken;
import org.javai.railway.Failure;
import org.javai.railway.Result;
import org.javai.railway.boundary.Boundary;
import org.javai.railway.boundary.ThrowingSupplier;
import org.javai.railway.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Executes operations with retry logic based on policies.
 * Operates entirely over Result values; failures are never turned into exceptions.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.builder().maxRetries(3).initialDelay(Duration.ofMillis(100)).build())
 *     .reporter(reporter)
 *     .build();
 *
 * Result<Response> result = retrier.execute(
 *     "FetchUser",
 *     () -> boundary.call("UserApi.fetch", () -> userApi.fetch(userId))
 * );
 * }</pre>
 */
public final class Retrier {

    private static final Logger LOG = LoggerFactory.getLogger(Retrier.class);

    private final RetryPolicy policy;
    private final OpReporter reporter;
    private final Sleeper sleeper;

    private Retrier(RetryPolicy policy, OpReporter reporter, Sleeper sleeper) {
        this.policy = policy;
        this.reporter = OpReporter.guarded(reporter);
        this.sleeper = sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Retries with {@link RetryPolicy#defaults()} and no reporting.
     *
     * @param attempt produces one attempt's result
     * @return the first success, or the last failure
     */
    public static <T> Result<T> retry(Supplier<Result<T>> attempt) {
        return builder().build().execute("retry", attempt);
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy = RetryPolicy.defaults();
        private OpReporter reporter = OpReporter.noOp();
        private Sleeper sleeper = (delay, token) -> token.awaitCancellation(delay);

        private Builder() {}

        /**
         * Sets the retry policy (optional, defaults to {@link RetryPolicy#defaults()}).
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public Retrier build() {
            return new Retrier(policy, reporter, sleeper);
        }
    }

    /**
     * Executes an operation with retry according to the configured policy.
     *
     * @param operation The operation name for reporting
     * @param attempt A supplier that returns a Result
     * @return The first success, or the last failure once the policy gives up
     */
    public <T> Result<T> execute(String operation, Supplier<Result<T>> attempt) {
        return execute(operation, CancellationToken.none(), attempt);
    }

    /**
     * Executes an operation with retry, stopping early when cancellation is requested.
     *
     * <p>Cancellation is checked before each retry and while waiting between attempts.
     * Once at least one attempt has run, cancelling returns the latest result as it is.
     *
     * @throws CancellationException if cancellation was requested before the first attempt
     */
    public <T> Result<T> execute(String operation, CancellationToken token, Supplier<Result<T>> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        token.throwIfCancellationRequested();

        RetryContext context = RetryContext.first();
        Result<T> result = invoke(attempt);

        while (result instanceof Result.Fail<T> fail) {
            Failure failure = fail.failure();
            RetryDecision decision = policy.decide(context, failure);

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                LOG.debug("Giving up on [{}] after {} attempts with policy [{}]: {}",
                        operation, context.attemptNumber(), policy.id(), giveUp.reason());
                reporter.reportRetryExhausted(operation, failure, context.attemptNumber(), giveUp.reason());
                break;
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            if (token.isCancellationRequested() || sleeper.sleep(delay, token)) {
                LOG.debug("Retry of [{}] cancelled after {} attempts", operation, context.attemptNumber());
                reporter.reportRetryCancelled(operation, result, context.attemptNumber());
                break;
            }
            reporter.reportRetryAttempt(operation, failure, context.attemptNumber(), delay);
            context = context.next();
            result = invoke(attempt);
        }

        reporter.record(operation, result);
        return result;
    }

    /**
     * Convenience method that wraps a throwing supplier with a Boundary before retrying.
     */
    public <T> Result<T> execute(
            String operation,
            Boundary boundary,
            ThrowingSupplier<T, ? extends Exception> work
    ) {
        Objects.requireNonNull(boundary, "boundary must not be null");
        return execute(operation, () -> boundary.call(operation, work));
    }

    private static <T> Result<T> invoke(Supplier<Result<T>> attempt) {
        return Objects.requireNonNull(attempt.get(), "attempt returned null");
    }

    /**
     * Waits between attempts. Returns true if cancellation was observed while waiting.
     */
    @FunctionalInterface
    interface Sleeper {
        boolean sleep(Duration delay, CancellationToken token);
    }
}
