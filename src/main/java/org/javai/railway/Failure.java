package org.javai.railway;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The failure side of a {@link Result}.
 *
 * <p>The variant set is closed. Each variant carries a human-readable message, a stable
 * code and an optional instance naming the resource the failure refers to. Two variants
 * are structural: {@link Validation} holds per-field messages and {@link Aggregate}
 * holds unrelated sibling failures.
 *
 * <p>Failures are combined with {@link #combine(Failure)}; see {@link Failures#combine(Failure, Failure)}
 * for the merge rules.
 */
public sealed interface Failure permits
        Failure.Validation,
        Failure.NotFound,
        Failure.Conflict,
        Failure.BadRequest,
        Failure.Unauthorized,
        Failure.Forbidden,
        Failure.Domain,
        Failure.RateLimit,
        Failure.ServiceUnavailable,
        Failure.Unexpected,
        Failure.Aggregate {

    String message();

    String code();

    /**
     * The resource this failure refers to, or null.
     */
    String instance();

    FailureKind kind();

    /**
     * Combines this failure with another, this one on the left.
     *
     * @param other the right-hand failure
     * @return the combined failure
     * @throws IllegalArgumentException if {@code other} is null
     */
    default Failure combine(Failure other) {
        return Failures.combine(this, other);
    }

    // === Variants ===

    /**
     * One or more fields failed validation. All field errors share one code.
     *
     * @param fieldErrors per-field messages, in the order they were reported (never empty)
     * @param code the validation code
     * @param detail an overall description; empty when the field errors speak for themselves
     * @param instance the resource that was validated (may be null)
     */
    record Validation(List<FieldError> fieldErrors, String code, String detail, String instance) implements Failure {

        public Validation {
            if (fieldErrors == null || fieldErrors.isEmpty()) {
                throw new IllegalArgumentException("at least one field error must be supplied");
            }
            fieldErrors = List.copyOf(fieldErrors);
            code = code == null ? FailureKind.VALIDATION.defaultCode() : code;
            detail = detail == null ? "" : detail;
        }

        public Validation(List<FieldError> fieldErrors) {
            this(fieldErrors, null, null, null);
        }

        /**
         * Creates a validation failure for a single field.
         *
         * @param fieldName the field that failed; empty for an object-level message
         * @param details one or more messages for the field
         */
        public static Validation forField(String fieldName, String... details) {
            return new Validation(List.of(new FieldError(fieldName, details)));
        }

        /**
         * Returns a copy with one more field error appended.
         */
        public Validation and(String fieldName, String... details) {
            List<FieldError> extended = new ArrayList<>(fieldErrors);
            extended.add(new FieldError(fieldName, details));
            return new Validation(extended, code, detail, instance);
        }

        /**
         * Merges another validation failure into this one. Field errors are concatenated,
         * this one's first; the code is this one's.
         *
         * @param other the validation failure to append
         * @return the merged failure
         */
        public Validation merge(Validation other) {
            List<FieldError> merged = new ArrayList<>(fieldErrors.size() + other.fieldErrors.size());
            merged.addAll(fieldErrors);
            merged.addAll(other.fieldErrors);
            return new Validation(merged, code, mergeDetail(detail, other.detail),
                    instance != null ? instance : other.instance);
        }

        @Override
        public String message() {
            if (!detail.isBlank()) {
                return detail;
            }
            return fieldErrors.stream()
                    .map(FieldError::toString)
                    .collect(Collectors.joining("; "));
        }

        @Override
        public FailureKind kind() {
            return FailureKind.VALIDATION;
        }

        private static String mergeDetail(String left, String right) {
            if (left.isBlank()) {
                return right;
            }
            if (right.isBlank() || left.equals(right)) {
                return left;
            }
            return left + " | " + right;
        }

        /**
         * The messages reported for one field.
         *
         * @param fieldName the field name, empty for object-level messages
         * @param details the messages (never empty, never blank)
         */
        public record FieldError(String fieldName, List<String> details) {

            public FieldError {
                fieldName = fieldName == null ? "" : fieldName;
                if (details == null || details.isEmpty()) {
                    throw new IllegalArgumentException("a field error needs at least one detail message");
                }
                for (String detail : details) {
                    if (detail == null || detail.isBlank()) {
                        throw new IllegalArgumentException("Field detail cannot be null/empty");
                    }
                }
                details = List.copyOf(details);
            }

            public FieldError(String fieldName, String... details) {
                this(fieldName, details == null ? null : Arrays.asList(details));
            }

            @Override
            public String toString() {
                String joined = String.join(", ", details);
                return fieldName.isEmpty() ? joined : fieldName + ": " + joined;
            }
        }
    }

    record NotFound(String message, String code, String instance) implements Failure {

        public NotFound {
            message = requireMessage(message);
            code = code == null ? FailureKind.NOT_FOUND.defaultCode() : code;
        }

        public NotFound(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.NOT_FOUND;
        }
    }

    record Conflict(String message, String code, String instance) implements Failure {

        public Conflict {
            message = requireMessage(message);
            code = code == null ? FailureKind.CONFLICT.defaultCode() : code;
        }

        public Conflict(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.CONFLICT;
        }
    }

    record BadRequest(String message, String code, String instance) implements Failure {

        public BadRequest {
            message = requireMessage(message);
            code = code == null ? FailureKind.BAD_REQUEST.defaultCode() : code;
        }

        public BadRequest(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.BAD_REQUEST;
        }
    }

    record Unauthorized(String message, String code, String instance) implements Failure {

        public Unauthorized {
            message = requireMessage(message);
            code = code == null ? FailureKind.UNAUTHORIZED.defaultCode() : code;
        }

        public Unauthorized(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.UNAUTHORIZED;
        }
    }

    record Forbidden(String message, String code, String instance) implements Failure {

        public Forbidden {
            message = requireMessage(message);
            code = code == null ? FailureKind.FORBIDDEN.defaultCode() : code;
        }

        public Forbidden(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.FORBIDDEN;
        }
    }

    /**
     * A business rule was violated.
     */
    record Domain(String message, String code, String instance) implements Failure {

        public Domain {
            message = requireMessage(message);
            code = code == null ? FailureKind.DOMAIN.defaultCode() : code;
        }

        public Domain(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.DOMAIN;
        }
    }

    record RateLimit(String message, String code, String instance) implements Failure {

        public RateLimit {
            message = requireMessage(message);
            code = code == null ? FailureKind.RATE_LIMIT.defaultCode() : code;
        }

        public RateLimit(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.RATE_LIMIT;
        }
    }

    record ServiceUnavailable(String message, String code, String instance) implements Failure {

        public ServiceUnavailable {
            message = requireMessage(message);
            code = code == null ? FailureKind.SERVICE_UNAVAILABLE.defaultCode() : code;
        }

        public ServiceUnavailable(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.SERVICE_UNAVAILABLE;
        }
    }

    /**
     * Something went wrong that no other variant describes.
     */
    record Unexpected(String message, String code, String instance) implements Failure {

        public Unexpected {
            message = requireMessage(message);
            code = code == null ? FailureKind.UNEXPECTED.defaultCode() : code;
        }

        public Unexpected(String message) {
            this(message, null, null);
        }

        @Override
        public FailureKind kind() {
            return FailureKind.UNEXPECTED;
        }
    }

    /**
     * Unrelated sibling failures, in the order they were combined.
     * Never directly contains another aggregate.
     *
     * @param failures at least two failures, none of them an aggregate
     */
    record Aggregate(List<Failure> failures) implements Failure {

        public Aggregate {
            if (failures == null || failures.size() < 2) {
                throw new IllegalArgumentException("an aggregate wraps at least two failures");
            }
            failures = List.copyOf(failures);
            for (Failure failure : failures) {
                if (failure instanceof Aggregate) {
                    throw new IllegalArgumentException("aggregates must be flattened, found a nested aggregate");
                }
            }
        }

        @Override
        public String message() {
            return failures.size() + " failures occurred: " + failures.stream()
                    .map(Failure::message)
                    .collect(Collectors.joining("; "));
        }

        @Override
        public String code() {
            return FailureKind.AGGREGATE.defaultCode();
        }

        @Override
        public String instance() {
            return null;
        }

        @Override
        public FailureKind kind() {
            return FailureKind.AGGREGATE;
        }
    }

    // === Static factories ===

    /**
     * Creates an object-level validation failure (no field name).
     */
    static Validation validation(String message) {
        return Validation.forField("", message);
    }

    /**
     * Creates a validation failure for one field.
     */
    static Validation validation(String message, String fieldName) {
        return Validation.forField(fieldName, message);
    }

    static NotFound notFound(String message) {
        return new NotFound(message);
    }

    static Conflict conflict(String message) {
        return new Conflict(message);
    }

    static BadRequest badRequest(String message) {
        return new BadRequest(message);
    }

    static Unauthorized unauthorized(String message) {
        return new Unauthorized(message);
    }

    static Forbidden forbidden(String message) {
        return new Forbidden(message);
    }

    static Domain domain(String message) {
        return new Domain(message);
    }

    static RateLimit rateLimit(String message) {
        return new RateLimit(message);
    }

    static ServiceUnavailable serviceUnavailable(String message) {
        return new ServiceUnavailable(message);
    }

    static Unexpected unexpected(String message) {
        return new Unexpected(message);
    }

    private static String requireMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        return message;
    }
}
