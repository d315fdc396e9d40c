package org.javai.railway.async;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.javai.railway.CancellationToken;
import org.javai.railway.Failure;
import org.javai.railway.Result;
import org.javai.railway.ops.OpReporter;
import org.javai.railway.retry.RetryContext;
import org.javai.railway.retry.RetryDecision;
import org.javai.railway.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-blocking counterpart of {@link org.javai.railway.retry.Retrier}.
 *
 * <p>Attempts return a {@link CompletionStage}; waits between attempts are scheduled with
 * {@link CompletableFuture#delayedExecutor}, so no thread sleeps. The retry decisions are
 * the policy's, exactly as in the blocking retrier.
 *
 * <p>Cancellation is checked before the first attempt. A delay ends early once the token is
 * cancelled, and the latest result is returned without another attempt.
 * An attempt whose stage completes exceptionally is not retried; the exception propagates.
 */
public final class AsyncRetrier {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncRetrier.class);

    private final RetryPolicy policy;
    private final OpReporter reporter;
    private final Executor executor;

    private AsyncRetrier(RetryPolicy policy, OpReporter reporter, Executor executor) {
        this.policy = policy;
        this.reporter = OpReporter.guarded(reporter);
        this.executor = executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RetryPolicy policy = RetryPolicy.defaults();
        private OpReporter reporter = OpReporter.noOp();
        private Executor executor = ForkJoinPool.commonPool();

        private Builder() {}

        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the executor that resumes the pipeline after each delay.
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        public AsyncRetrier build() {
            return new AsyncRetrier(policy, reporter, executor);
        }
    }

    public <T> CompletableFuture<Result<T>> execute(String operation,
                                                    Supplier<? extends CompletionStage<Result<T>>> attempt) {
        return execute(operation, CancellationToken.none(), attempt);
    }

    /**
     * Executes an asynchronous operation with retry.
     *
     * @param operation The operation name for reporting
     * @param token checked before the first attempt and during every delay
     * @param attempt starts one attempt
     * @return the first success, the last failure, or the latest result when cancelled; the
     *         future completes with {@link CancellationException} if cancellation preceded
     *         the first attempt
     */
    public <T> CompletableFuture<Result<T>> execute(String operation,
                                                    CancellationToken token,
                                                    Supplier<? extends CompletionStage<Result<T>>> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        if (token.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("Cancellation requested"));
        }
        return run(operation, token, attempt, RetryContext.first())
                .toCompletableFuture()
                .thenApply(result -> {
                    reporter.record(operation, result);
                    return result;
                });
    }

    private <T> CompletionStage<Result<T>> run(String operation,
                                               CancellationToken token,
                                               Supplier<? extends CompletionStage<Result<T>>> attempt,
                                               RetryContext context) {
        CompletionStage<Result<T>> pending = Objects.requireNonNull(attempt.get(), "attempt returned null");
        return pending.thenCompose(result -> {
            if (result.isOk()) {
                return CompletableFuture.completedFuture(result);
            }
            Failure failure = result.failure();
            RetryDecision decision = policy.decide(context, failure);

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                LOG.debug("Giving up on [{}] after {} attempts with policy [{}]: {}",
                        operation, context.attemptNumber(), policy.id(), giveUp.reason());
                reporter.reportRetryExhausted(operation, failure, context.attemptNumber(), giveUp.reason());
                return CompletableFuture.completedFuture(result);
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            return after(delay, token).thenCompose(ignored -> {
                if (token.isCancellationRequested()) {
                    LOG.debug("Retry of [{}] cancelled after {} attempts", operation, context.attemptNumber());
                    reporter.reportRetryCancelled(operation, result, context.attemptNumber());
                    return CompletableFuture.completedFuture(result);
                }
                reporter.reportRetryAttempt(operation, failure, context.attemptNumber(), delay);
                return run(operation, token, attempt, context.next());
            });
        });
    }

    // Completes when the delay elapses or the token is cancelled, whichever comes first.
    private CompletableFuture<Void> after(Duration delay, CancellationToken token) {
        if (delay.isZero() || token.isCancellationRequested()) {
            return CompletableFuture.completedFuture(null);
        }
        Executor delayed = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor);
        return CompletableFuture.runAsync(() -> {}, delayed)
                .acceptEitherAsync(token.whenCancelled(), ignored -> {}, executor);
    }
}
