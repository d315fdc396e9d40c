package org.javai.railway.async;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import org.javai.railway.CancellationToken;
import org.javai.railway.Result;
import org.javai.railway.Results;

/**
 * Asynchronous counterparts of {@link Results}.
 */
public final class AsyncResults {

    private AsyncResults() {
        // Utility class
    }

    /**
     * Waits for every stage, then combines the results by position exactly like
     * {@link Results#combine(Iterable)}. The stages may complete in any order; failures are
     * still folded in input order.
     *
     * <p>A stage that completes exceptionally is not a failed result; the combined stage
     * completes exceptionally too.
     *
     * @param stages the pending results, usually already running concurrently
     * @return the combined result
     */
    public static <T> AsyncResult<List<T>> combine(List<? extends CompletionStage<Result<T>>> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        List<CompletableFuture<Result<T>>> futures = new ArrayList<>(stages.size());
        for (CompletionStage<Result<T>> stage : stages) {
            futures.add(Objects.requireNonNull(stage, "stages must not contain null").toCompletableFuture());
        }
        CompletableFuture<Result<List<T>>> combined = CompletableFuture
                .allOf(futures.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<Result<T>> results = new ArrayList<>(futures.size());
                    for (CompletableFuture<Result<T>> future : futures) {
                        results.add(future.join());
                    }
                    return Results.combine(results);
                });
        return AsyncResult.of(combined);
    }

    /**
     * Transforms items strictly one at a time, in order, stopping at the first failure.
     * The transform for an item is not invoked until the previous item's stage has settled.
     */
    public static <I, O> AsyncResult<List<O>> traverse(Iterable<? extends I> items,
                                                       Function<? super I, ? extends CompletionStage<Result<O>>> transform) {
        return traverse(items, transform, CancellationToken.none());
    }

    /**
     * Like {@link #traverse(Iterable, Function)}, checking the token before each item.
     * If cancellation is observed the returned stage completes with {@link CancellationException}.
     */
    public static <I, O> AsyncResult<List<O>> traverse(Iterable<? extends I> items,
                                                       Function<? super I, ? extends CompletionStage<Result<O>>> transform,
                                                       CancellationToken token) {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(transform, "transform must not be null");
        Objects.requireNonNull(token, "token must not be null");
        return AsyncResult.of(next(items.iterator(), transform, token, new ArrayList<>())).withCancellation(token);
    }

    // Settled stages are consumed in a loop; only a pending stage defers the rest of the items.
    private static <I, O> CompletionStage<Result<List<O>>> next(Iterator<? extends I> items,
                                                                Function<? super I, ? extends CompletionStage<Result<O>>> transform,
                                                                CancellationToken token,
                                                                List<O> outputs) {
        while (items.hasNext()) {
            if (token.isCancellationRequested()) {
                return CompletableFuture.failedFuture(new CancellationException("Cancellation requested"));
            }
            CompletableFuture<Result<O>> pending = Objects.requireNonNull(transform.apply(items.next()),
                    "transform returned null").toCompletableFuture();
            if (!pending.isDone() || pending.isCompletedExceptionally()) {
                return pending.thenCompose(result -> {
                    if (result.isFail()) {
                        return CompletableFuture.completedFuture(Result.fail(result.failure()));
                    }
                    outputs.add(result.getOrThrow());
                    return next(items, transform, token, outputs);
                });
            }
            Result<O> result = pending.join();
            if (result.isFail()) {
                return CompletableFuture.completedFuture(Result.fail(result.failure()));
            }
            outputs.add(result.getOrThrow());
        }
        return CompletableFuture.completedFuture(Result.ok(Collections.unmodifiableList(outputs)));
    }
}
