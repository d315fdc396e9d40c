package org.javai.railway;

/**
 * The closed set of failure variants.
 *
 * <p>Declaration order is significant: it is the order in which
 * {@link FailureHandlers} documents its handlers, with {@link #AGGREGATE}
 * reachable only through the catch-all.
 */
public enum FailureKind {
    VALIDATION("validation.error"),
    NOT_FOUND("not.found.error"),
    CONFLICT("conflict.error"),
    BAD_REQUEST("bad.request.error"),
    UNAUTHORIZED("unauthorized.error"),
    FORBIDDEN("forbidden.error"),
    DOMAIN("domain.error"),
    RATE_LIMIT("rate.limit.error"),
    SERVICE_UNAVAILABLE("service.unavailable.error"),
    UNEXPECTED("unexpected.error"),

    /**
     * Structural variant wrapping unrelated sibling failures.
     */
    AGGREGATE("aggregate.error");

    private final String defaultCode;

    FailureKind(String defaultCode) {
        this.defaultCode = defaultCode;
    }

    /**
     * The code a failure of this kind carries when none is given explicitly.
     */
    public String defaultCode() {
        return defaultCode;
    }
}
