package org.javai.railway;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Combinators over many results.
 *
 * <p>The two operations here sit on opposite tracks. {@link #combine(Iterable)} accumulates:
 * every input is inspected and every failure reported. {@link #traverse(Iterable, Function)}
 * short-circuits: it is {@link Result#flatMap} applied across a sequence and stops at the
 * first failing item.
 */
public final class Results {

    private Results() {
        // Utility class
    }

    /**
     * Combines results of any arity by position.
     *
     * @see #combine(Iterable)
     */
    @SafeVarargs
    public static <T> Result<List<T>> combine(Result<? extends T>... results) {
        Objects.requireNonNull(results, "results must not be null");
        return combine(Arrays.asList(results));
    }

    /**
     * Combines results by position. If all succeed, returns their values in input order.
     * Otherwise returns one failure built by folding every failure left to right with
     * {@link Failures#combine(Failure, Failure)}; the fold order is the input order, whatever
     * order the inputs were produced in.
     *
     * @param results the results to combine
     * @return a success listing every value, or a failure reporting every failed input
     */
    public static <T> Result<List<T>> combine(Iterable<? extends Result<? extends T>> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<T> values = new ArrayList<>();
        Failure accumulated = null;
        for (Result<? extends T> result : results) {
            Objects.requireNonNull(result, "results must not contain null");
            if (result instanceof Result.Fail<? extends T> fail) {
                accumulated = Failures.combine(accumulated, fail.failure());
            } else if (accumulated == null) {
                values.add(result.getOrThrow());
            }
        }
        if (accumulated != null) {
            return Result.fail(accumulated);
        }
        return Result.ok(Collections.unmodifiableList(values));
    }

    /**
     * Transforms items in order, stopping at the first failure.
     *
     * @param items the items to transform
     * @param transform the transformation, invoked at most once per item and never after a failure
     * @return the outputs in input order, or the first failure
     */
    public static <I, O> Result<List<O>> traverse(Iterable<? extends I> items,
                                                  Function<? super I, ? extends Result<? extends O>> transform) {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(transform, "transform must not be null");
        List<O> outputs = new ArrayList<>();
        for (I item : items) {
            Result<? extends O> result = Objects.requireNonNull(transform.apply(item), "transform returned null");
            if (result instanceof Result.Fail<? extends O> fail) {
                return Result.fail(fail.failure());
            }
            outputs.add(result.getOrThrow());
        }
        return Result.ok(Collections.unmodifiableList(outputs));
    }
}
