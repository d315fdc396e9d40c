package org.javai.railway;

/**
 * Thrown when {@link Result#getOrThrow()} is called on a failed result.
 * Reading the value of a failure is a caller bug; check {@link Result#isOk()} first or
 * branch with {@link Result#match}.
 */
public class ResultFailedException extends RuntimeException {

    private final Failure failure;

    public ResultFailedException(Failure failure) {
        super("Result failed: " + failure.message());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
