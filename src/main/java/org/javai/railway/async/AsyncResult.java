package org.javai.railway.async;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.javai.railway.CancellationToken;
import org.javai.railway.Failure;
import org.javai.railway.FailureHandlers;
import org.javai.railway.Pair;
import org.javai.railway.Result;

/**
 * A {@link Result} that is still being computed.
 *
 * <p>Every combinator of {@link Result} has a counterpart here that runs once the underlying
 * stage settles, with the same track semantics: functions meant for one track are never
 * invoked while the result is on the other. The {@code ...Async} variants take functions that
 * themselves return a {@link CompletionStage}, so an I/O-bound step suspends the pipeline
 * instead of blocking a thread.
 *
 * <p>A {@link CancellationToken} attached with {@link #withCancellation(CancellationToken)} is
 * checked before each continuation runs. A continuation that observes a requested
 * cancellation completes exceptionally with {@link CancellationException}; results already
 * produced are left as they are.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CompletableFuture<String> reply = AsyncResult.supplyAsync(() -> findUser(id), executor)
 *     .ensure(User::active, Failure.forbidden("User is deactivated"))
 *     .flatMapAsync(user -> orders.fetchLatest(user.id()))
 *     .tapOnFailure(failure -> log.info("lookup failed: {}", failure.message()))
 *     .match(order -> "Latest order " + order.id(), Failure::message)
 *     .toCompletableFuture();
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public final class AsyncResult<T> {

    private final CompletionStage<Result<T>> stage;
    private final CancellationToken token;

    private AsyncResult(CompletionStage<Result<T>> stage, CancellationToken token) {
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
    }

    // Creation

    public static <T> AsyncResult<T> of(CompletionStage<Result<T>> stage) {
        return new AsyncResult<>(stage, CancellationToken.none());
    }

    public static <T> AsyncResult<T> completed(Result<T> result) {
        Objects.requireNonNull(result, "result must not be null");
        return of(CompletableFuture.completedFuture(result));
    }

    /**
     * Runs the supplier on the executor.
     */
    public static <T> AsyncResult<T> supplyAsync(Supplier<Result<T>> supplier, Executor executor) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        return of(CompletableFuture.supplyAsync(supplier, executor));
    }

    /**
     * Returns a view of this pipeline whose continuations observe the given token.
     */
    public AsyncResult<T> withCancellation(CancellationToken token) {
        return new AsyncResult<>(stage, token);
    }

    // Transformations

    public <U> AsyncResult<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        return then(result -> result.map(mapper));
    }

    public <U> AsyncResult<U> flatMap(Function<? super T, ? extends Result<U>> mapper) {
        Objects.requireNonNull(mapper);
        return then(result -> result.flatMap(mapper));
    }

    /**
     * Chains an asynchronous operation that may fail. On a failure the mapper is never invoked.
     */
    public <U> AsyncResult<U> flatMapAsync(Function<? super T, ? extends CompletionStage<Result<U>>> mapper) {
        Objects.requireNonNull(mapper);
        return thenAsync(result -> {
            if (result instanceof Result.Fail<T> fail) {
                return CompletableFuture.completedFuture(Result.fail(fail.failure()));
            }
            return Objects.requireNonNull(mapper.apply(result.getOrThrow()), "mapper returned null");
        });
    }

    public AsyncResult<T> ensure(Predicate<? super T> predicate, Failure failure) {
        Objects.requireNonNull(predicate);
        Objects.requireNonNull(failure);
        return then(result -> result.ensure(predicate, failure));
    }

    /**
     * Like {@link #ensure(Predicate, Failure)} with a predicate that completes later.
     */
    public AsyncResult<T> ensureAsync(Function<? super T, ? extends CompletionStage<Boolean>> predicate,
                                      Failure failure) {
        Objects.requireNonNull(predicate);
        Objects.requireNonNull(failure);
        return thenAsync(result -> {
            if (result.isFail()) {
                return CompletableFuture.completedFuture(result);
            }
            return predicate.apply(result.getOrThrow())
                    .thenApply(holds -> Boolean.TRUE.equals(holds) ? result : Result.<T>fail(failure));
        });
    }

    // Recovery

    public AsyncResult<T> compensate(Supplier<? extends Result<T>> compensation) {
        Objects.requireNonNull(compensation);
        return then(result -> result.compensate(compensation));
    }

    public AsyncResult<T> compensate(Predicate<? super Failure> predicate, Supplier<? extends Result<T>> compensation) {
        Objects.requireNonNull(predicate);
        Objects.requireNonNull(compensation);
        return then(result -> result.compensate(predicate, compensation));
    }

    /**
     * Replaces a failure with the outcome of an asynchronous compensation.
     */
    public AsyncResult<T> compensateAsync(Supplier<? extends CompletionStage<Result<T>>> compensation) {
        Objects.requireNonNull(compensation);
        return thenAsync(result -> {
            if (result.isOk()) {
                return CompletableFuture.completedFuture(result);
            }
            return Objects.requireNonNull(compensation.get(), "compensation returned null");
        });
    }

    public AsyncResult<T> recover(Function<? super Failure, ? extends T> recovery) {
        Objects.requireNonNull(recovery);
        return then(result -> result.recover(recovery));
    }

    public AsyncResult<T> recoverWith(Function<? super Failure, ? extends Result<T>> recovery) {
        Objects.requireNonNull(recovery);
        return then(result -> result.recoverWith(recovery));
    }

    public AsyncResult<T> mapFailure(Function<? super Failure, ? extends Failure> mapper) {
        Objects.requireNonNull(mapper);
        return then(result -> result.mapFailure(mapper));
    }

    // Side effects

    public AsyncResult<T> tap(Consumer<? super T> action) {
        Objects.requireNonNull(action);
        return then(result -> result.tap(action));
    }

    /**
     * Runs an asynchronous action on a success and waits for it before passing the result on.
     * The action's own value is discarded.
     */
    public AsyncResult<T> tapAsync(Function<? super T, ? extends CompletionStage<?>> action) {
        Objects.requireNonNull(action);
        return thenAsync(result -> {
            if (result.isFail()) {
                return CompletableFuture.completedFuture(result);
            }
            return action.apply(result.getOrThrow()).thenApply(ignored -> result);
        });
    }

    public AsyncResult<T> tapOnFailure(Consumer<? super Failure> action) {
        Objects.requireNonNull(action);
        return then(result -> result.tapOnFailure(action));
    }

    // Accumulating combination

    /**
     * Pairs this result with another once both settle. Both stages may run concurrently;
     * failures are still combined with this one on the left.
     */
    public <U> AsyncResult<Pair<T, U>> combine(AsyncResult<U> other) {
        Objects.requireNonNull(other, "other must not be null");
        return new AsyncResult<>(stage.thenCombine(other.stage, (left, right) -> {
            token.throwIfCancellationRequested();
            return left.combine(right);
        }), token);
    }

    // Termination

    public <R> CompletionStage<R> match(Function<? super T, ? extends R> onOk,
                                        Function<? super Failure, ? extends R> onFail) {
        Objects.requireNonNull(onOk);
        Objects.requireNonNull(onFail);
        return stage.thenApply(result -> {
            token.throwIfCancellationRequested();
            return result.match(onOk, onFail);
        });
    }

    public <R> CompletionStage<R> matchFailure(Function<? super T, ? extends R> onOk, FailureHandlers<R> handlers) {
        Objects.requireNonNull(onOk);
        Objects.requireNonNull(handlers);
        return stage.thenApply(result -> {
            token.throwIfCancellationRequested();
            return result.matchFailure(onOk, handlers);
        });
    }

    public CompletionStage<Result<T>> toCompletionStage() {
        return stage;
    }

    public CompletableFuture<Result<T>> toCompletableFuture() {
        return stage.toCompletableFuture();
    }

    private <U> AsyncResult<U> then(Function<Result<T>, Result<U>> step) {
        return new AsyncResult<>(stage.thenApply(result -> {
            token.throwIfCancellationRequested();
            return step.apply(result);
        }), token);
    }

    private <U> AsyncResult<U> thenAsync(Function<Result<T>, CompletionStage<Result<U>>> step) {
        return new AsyncResult<>(stage.thenCompose(result -> {
            token.throwIfCancellationRequested();
            return step.apply(result);
        }), token);
    }
}
