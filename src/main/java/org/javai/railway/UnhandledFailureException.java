package org.javai.railway;

/**
 * Thrown when {@link FailureHandlers} has neither a handler for a failure's kind nor a catch-all.
 * This is a programming error, never a recoverable result.
 */
public class UnhandledFailureException extends IllegalStateException {

    private final Failure failure;

    public UnhandledFailureException(Failure failure) {
        super("No handler provided for failure kind " + failure.kind()
                + ". Either provide a specific handler or use otherwise(...) as a catch-all.");
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
