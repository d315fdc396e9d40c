package org.javai.railway;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.javai.railway.ops.OpReporter;

/**
 * Represents the result of an operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>The sequential combinators ({@link #flatMap}, {@link #map}, {@link #ensure},
 * {@link #compensate}, {@link #tap} and friends) short-circuit: a function meant for one
 * track is never invoked while the result is on the other. {@link #combine(Result)} is the
 * exception: it looks at both results and reports every failure.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Result<T> permits Result.Ok, Result.Fail {

    /**
     * A successful result containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Result<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public Failure failure() {
            throw new IllegalStateException("Result is a success and has no failure");
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, ? extends Result<U>> mapper) {
            Objects.requireNonNull(mapper);
            return Objects.requireNonNull(mapper.apply(value), "flatMap function returned null");
        }

        @Override
        public Result<T> ensure(Predicate<? super T> predicate, Failure failure) {
            Objects.requireNonNull(predicate);
            Objects.requireNonNull(failure, "failure must not be null");
            return predicate.test(value) ? this : new Fail<>(failure);
        }

        @Override
        public Result<T> ensure(Predicate<? super T> predicate, Function<? super T, ? extends Failure> failure) {
            Objects.requireNonNull(predicate);
            Objects.requireNonNull(failure);
            return predicate.test(value) ? this : new Fail<>(failure.apply(value));
        }

        @Override
        public Result<T> when(Predicate<? super T> condition, Function<? super T, ? extends Result<T>> operation) {
            Objects.requireNonNull(condition);
            Objects.requireNonNull(operation);
            return condition.test(value)
                    ? Objects.requireNonNull(operation.apply(value), "when operation returned null")
                    : this;
        }

        @Override
        public Result<T> compensate(Supplier<? extends Result<T>> compensation) {
            return this;
        }

        @Override
        public Result<T> compensate(Predicate<? super Failure> predicate, Supplier<? extends Result<T>> compensation) {
            return this;
        }

        @Override
        public Result<T> recover(Function<? super Failure, ? extends T> recovery) {
            return this;
        }

        @Override
        public Result<T> recoverWith(Function<? super Failure, ? extends Result<T>> recovery) {
            return this;
        }

        @Override
        public Result<T> recoverWith(Predicate<? super Failure> predicate,
                                     Function<? super Failure, ? extends Result<T>> recovery) {
            return this;
        }

        @Override
        public Result<T> tap(Consumer<? super T> action) {
            Objects.requireNonNull(action);
            action.accept(value);
            return this;
        }

        @Override
        public Result<T> tapOnFailure(Consumer<? super Failure> action) {
            return this;
        }

        @Override
        public Result<T> mapFailure(Function<? super Failure, ? extends Failure> mapper) {
            return this;
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
            Objects.requireNonNull(onOk);
            return onOk.apply(value);
        }
    }

    /**
     * A failed result containing failure details.
     *
     * @param failure the failure details
     */
    record Fail<T>(Failure failure) implements Result<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T getOrThrow() {
            throw new ResultFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, ? extends Result<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Result<T> ensure(Predicate<? super T> predicate, Failure failure) {
            return this;
        }

        @Override
        public Result<T> ensure(Predicate<? super T> predicate, Function<? super T, ? extends Failure> failure) {
            return this;
        }

        @Override
        public Result<T> when(Predicate<? super T> condition, Function<? super T, ? extends Result<T>> operation) {
            return this;
        }

        @Override
        public Result<T> compensate(Supplier<? extends Result<T>> compensation) {
            Objects.requireNonNull(compensation);
            return Objects.requireNonNull(compensation.get(), "compensation returned null");
        }

        @Override
        public Result<T> compensate(Predicate<? super Failure> predicate, Supplier<? extends Result<T>> compensation) {
            Objects.requireNonNull(predicate);
            Objects.requireNonNull(compensation);
            return predicate.test(failure)
                    ? Objects.requireNonNull(compensation.get(), "compensation returned null")
                    : this;
        }

        @Override
        public Result<T> recover(Function<? super Failure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }

        @Override
        public Result<T> recoverWith(Function<? super Failure, ? extends Result<T>> recovery) {
            Objects.requireNonNull(recovery);
            return Objects.requireNonNull(recovery.apply(failure), "recovery returned null");
        }

        @Override
        public Result<T> recoverWith(Predicate<? super Failure> predicate,
                                     Function<? super Failure, ? extends Result<T>> recovery) {
            Objects.requireNonNull(predicate);
            Objects.requireNonNull(recovery);
            return predicate.test(failure)
                    ? Objects.requireNonNull(recovery.apply(failure), "recovery returned null")
                    : this;
        }

        @Override
        public Result<T> tap(Consumer<? super T> action) {
            return this;
        }

        @Override
        public Result<T> tapOnFailure(Consumer<? super Failure> action) {
            Objects.requireNonNull(action);
            action.accept(failure);
            return this;
        }

        @Override
        public Result<T> mapFailure(Function<? super Failure, ? extends Failure> mapper) {
            Objects.requireNonNull(mapper);
            return new Fail<>(mapper.apply(failure));
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
            Objects.requireNonNull(onFail);
            return onFail.apply(failure);
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the failure of a failed result.
     *
     * @throws IllegalStateException if this result is a success
     */
    Failure failure();

    // Value extraction

    /**
     * Returns the value of a successful result.
     *
     * @throws ResultFailedException if this result is a failure
     */
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    /**
     * Returns the value, or empty for a failure or a null success value.
     */
    Optional<T> toOptional();

    // Transformations
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    /**
     * Chains an operation that may itself fail. On a failure the mapper is never invoked
     * and the failure is propagated unchanged.
     */
    <U> Result<U> flatMap(Function<? super T, ? extends Result<U>> mapper);

    /**
     * Turns a success into the given failure when the predicate does not hold.
     * The predicate is never evaluated on a failed result.
     */
    Result<T> ensure(Predicate<? super T> predicate, Failure failure);

    /**
     * Like {@link #ensure(Predicate, Failure)}, deriving the failure from the rejected value.
     */
    Result<T> ensure(Predicate<? super T> predicate, Function<? super T, ? extends Failure> failure);

    /**
     * Runs the operation on a success for which the condition holds; other successes
     * pass through untouched.
     */
    Result<T> when(Predicate<? super T> condition, Function<? super T, ? extends Result<T>> operation);

    default Result<T> unless(Predicate<? super T> condition, Function<? super T, ? extends Result<T>> operation) {
        Objects.requireNonNull(condition);
        return when(condition.negate(), operation);
    }

    // Recovery

    /**
     * Replaces a failure with the result of the compensation. Successes pass through.
     */
    Result<T> compensate(Supplier<? extends Result<T>> compensation);

    /**
     * Replaces a failure matching the predicate with the result of the compensation.
     * Non-matching failures pass through untouched.
     */
    Result<T> compensate(Predicate<? super Failure> predicate, Supplier<? extends Result<T>> compensation);

    Result<T> recover(Function<? super Failure, ? extends T> recovery);
    Result<T> recoverWith(Function<? super Failure, ? extends Result<T>> recovery);
    Result<T> recoverWith(Predicate<? super Failure> predicate, Function<? super Failure, ? extends Result<T>> recovery);

    // Side effects

    /**
     * Runs the action on a success and returns this result unchanged.
     */
    Result<T> tap(Consumer<? super T> action);

    /**
     * Runs the action on a failure and returns this result unchanged.
     */
    Result<T> tapOnFailure(Consumer<? super Failure> action);

    Result<T> mapFailure(Function<? super Failure, ? extends Failure> mapper);

    // Termination
    <R> R match(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail);

    /**
     * Terminates the pipeline with a handler chosen by the kind of failure.
     *
     * @throws UnhandledFailureException if the result failed and no handler, including the
     *         catch-all, accepts its failure
     */
    default <R> R matchFailure(Function<? super T, ? extends R> onOk, FailureHandlers<R> handlers) {
        Objects.requireNonNull(handlers);
        return match(onOk, handlers::apply);
    }

    // Accumulating combination

    /**
     * Pairs this result with another. Both are inspected: if both fail, the failures are
     * combined with this one on the left.
     *
     * <p>Chaining grows the tuple, {@code a.combine(b).combine(c)} giving a
     * {@code Result<Pair<Pair<A, B>, C>>} that still reports every failure.
     */
    default <U> Result<Pair<T, U>> combine(Result<? extends U> other) {
        return combine(other, Pair::of);
    }

    default <U, R> Result<R> combine(Result<? extends U> other,
                                     BiFunction<? super T, ? super U, ? extends R> combiner) {
        Objects.requireNonNull(other, "other must not be null");
        Objects.requireNonNull(combiner);
        Failure accumulated = null;
        if (this instanceof Fail<T> fail) {
            accumulated = fail.failure();
        }
        if (other instanceof Fail<? extends U> fail) {
            accumulated = Failures.combine(accumulated, fail.failure());
        }
        if (accumulated != null) {
            return new Fail<>(accumulated);
        }
        return new Ok<>(combiner.apply(getOrThrow(), other.getOrThrow()));
    }

    // Observation

    /**
     * Hands this result to the reporter and returns it unchanged. Exceptions thrown by the
     * reporter are logged and never reach the caller.
     *
     * @param reporter the reporter to notify
     * @param operation the operation this result belongs to
     * @return this result
     */
    default Result<T> observe(OpReporter reporter, String operation) {
        OpReporter.guarded(reporter).record(operation, this);
        return this;
    }

    // Static factories
    static Result<Void> ok() {
        return new Ok<>(null);
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> fail(Failure failure) {
        return new Fail<>(failure);
    }

    static <T> Result<T> okIf(boolean condition, T value, Failure failure) {
        return condition ? ok(value) : fail(failure);
    }

    static <T> Result<T> failIf(boolean condition, T value, Failure failure) {
        return okIf(!condition, value, failure);
    }

    /**
     * Creates a success from a present optional, or a failure from the supplier.
     */
    static <T> Result<T> fromOptional(Optional<T> optional, Supplier<? extends Failure> failure) {
        Objects.requireNonNull(optional);
        Objects.requireNonNull(failure);
        return optional.<Result<T>>map(Result::ok).orElseGet(() -> fail(failure.get()));
    }
}
