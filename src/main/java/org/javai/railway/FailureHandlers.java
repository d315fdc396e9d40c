package org.javai.railway;

import java.util.Objects;
import java.util.function.Function;

/**
 * Per-kind handlers for {@link Result#matchFailure(Function, FailureHandlers)}.
 *
 * <p>A failure is handed to the handler registered for its {@link FailureKind}. Kinds are
 * consulted in the fixed order Validation, NotFound, Conflict, BadRequest, Unauthorized,
 * Forbidden, Domain, RateLimit, ServiceUnavailable, Unexpected, then the catch-all set with
 * {@link Builder#otherwise(Function)}. Aggregates are only reachable through the catch-all.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * String message = findUser(id).matchFailure(
 *     user -> "Found: " + user.name(),
 *     FailureHandlers.<String>builder()
 *         .onNotFound(f -> "User not found")
 *         .onValidation(f -> "Invalid: " + f.message())
 *         .otherwise(f -> "An error occurred")
 *         .build());
 * }</pre>
 *
 * @param <R> the type every handler produces
 */
public final class FailureHandlers<R> {

    private final Function<Failure.Validation, ? extends R> onValidation;
    private final Function<Failure.NotFound, ? extends R> onNotFound;
    private final Function<Failure.Conflict, ? extends R> onConflict;
    private final Function<Failure.BadRequest, ? extends R> onBadRequest;
    private final Function<Failure.Unauthorized, ? extends R> onUnauthorized;
    private final Function<Failure.Forbidden, ? extends R> onForbidden;
    private final Function<Failure.Domain, ? extends R> onDomain;
    private final Function<Failure.RateLimit, ? extends R> onRateLimit;
    private final Function<Failure.ServiceUnavailable, ? extends R> onServiceUnavailable;
    private final Function<Failure.Unexpected, ? extends R> onUnexpected;
    private final Function<? super Failure, ? extends R> otherwise;

    private FailureHandlers(Builder<R> builder) {
        this.onValidation = builder.onValidation;
        this.onNotFound = builder.onNotFound;
        this.onConflict = builder.onConflict;
        this.onBadRequest = builder.onBadRequest;
        this.onUnauthorized = builder.onUnauthorized;
        this.onForbidden = builder.onForbidden;
        this.onDomain = builder.onDomain;
        this.onRateLimit = builder.onRateLimit;
        this.onServiceUnavailable = builder.onServiceUnavailable;
        this.onUnexpected = builder.onUnexpected;
        this.otherwise = builder.otherwise;
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    /**
     * Applies the handler for the failure's kind, falling back to the catch-all.
     *
     * @param failure the failure to handle
     * @return the handler's output
     * @throws UnhandledFailureException if no handler accepts the failure
     */
    public R apply(Failure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        if (!hasHandlerFor(failure.kind())) {
            if (otherwise == null) {
                throw new UnhandledFailureException(failure);
            }
            return otherwise.apply(failure);
        }
        return switch (failure.kind()) {
            case VALIDATION -> onValidation.apply((Failure.Validation) failure);
            case NOT_FOUND -> onNotFound.apply((Failure.NotFound) failure);
            case CONFLICT -> onConflict.apply((Failure.Conflict) failure);
            case BAD_REQUEST -> onBadRequest.apply((Failure.BadRequest) failure);
            case UNAUTHORIZED -> onUnauthorized.apply((Failure.Unauthorized) failure);
            case FORBIDDEN -> onForbidden.apply((Failure.Forbidden) failure);
            case DOMAIN -> onDomain.apply((Failure.Domain) failure);
            case RATE_LIMIT -> onRateLimit.apply((Failure.RateLimit) failure);
            case SERVICE_UNAVAILABLE -> onServiceUnavailable.apply((Failure.ServiceUnavailable) failure);
            case UNEXPECTED -> onUnexpected.apply((Failure.Unexpected) failure);
            case AGGREGATE -> throw new UnhandledFailureException(failure);
        };
    }

    /**
     * Whether a dedicated handler is registered for the kind (the catch-all not included).
     */
    public boolean hasHandlerFor(FailureKind kind) {
        return switch (kind) {
            case VALIDATION -> onValidation != null;
            case NOT_FOUND -> onNotFound != null;
            case CONFLICT -> onConflict != null;
            case BAD_REQUEST -> onBadRequest != null;
            case UNAUTHORIZED -> onUnauthorized != null;
            case FORBIDDEN -> onForbidden != null;
            case DOMAIN -> onDomain != null;
            case RATE_LIMIT -> onRateLimit != null;
            case SERVICE_UNAVAILABLE -> onServiceUnavailable != null;
            case UNEXPECTED -> onUnexpected != null;
            case AGGREGATE -> false;
        };
    }

    /**
     * Builder for {@link FailureHandlers}. Every handler is optional.
     */
    public static final class Builder<R> {
        private Function<Failure.Validation, ? extends R> onValidation;
        private Function<Failure.NotFound, ? extends R> onNotFound;
        private Function<Failure.Conflict, ? extends R> onConflict;
        private Function<Failure.BadRequest, ? extends R> onBadRequest;
        private Function<Failure.Unauthorized, ? extends R> onUnauthorized;
        private Function<Failure.Forbidden, ? extends R> onForbidden;
        private Function<Failure.Domain, ? extends R> onDomain;
        private Function<Failure.RateLimit, ? extends R> onRateLimit;
        private Function<Failure.ServiceUnavailable, ? extends R> onServiceUnavailable;
        private Function<Failure.Unexpected, ? extends R> onUnexpected;
        private Function<? super Failure, ? extends R> otherwise;

        private Builder() {}

        public Builder<R> onValidation(Function<Failure.Validation, ? extends R> handler) {
            this.onValidation = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onNotFound(Function<Failure.NotFound, ? extends R> handler) {
            this.onNotFound = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onConflict(Function<Failure.Conflict, ? extends R> handler) {
            this.onConflict = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onBadRequest(Function<Failure.BadRequest, ? extends R> handler) {
            this.onBadRequest = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onUnauthorized(Function<Failure.Unauthorized, ? extends R> handler) {
            this.onUnauthorized = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onForbidden(Function<Failure.Forbidden, ? extends R> handler) {
            this.onForbidden = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onDomain(Function<Failure.Domain, ? extends R> handler) {
            this.onDomain = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onRateLimit(Function<Failure.RateLimit, ? extends R> handler) {
            this.onRateLimit = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onServiceUnavailable(Function<Failure.ServiceUnavailable, ? extends R> handler) {
            this.onServiceUnavailable = Objects.requireNonNull(handler);
            return this;
        }

        public Builder<R> onUnexpected(Function<Failure.Unexpected, ? extends R> handler) {
            this.onUnexpected = Objects.requireNonNull(handler);
            return this;
        }

        /**
         * Sets the catch-all, used for aggregates and for any kind without its own handler.
         */
        public Builder<R> otherwise(Function<? super Failure, ? extends R> handler) {
            this.otherwise = Objects.requireNonNull(handler);
            return this;
        }

        public FailureHandlers<R> build() {
            return new FailureHandlers<>(this);
        }
    }
}
