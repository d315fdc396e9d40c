package org.javai.railway.boundary;

import org.javai.railway.Failure;

/**
 * Classifies exceptions into failures.
 * Implementations should be deterministic: the same exception always yields the same kind.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return the failure to place on the failure track
     */
    Failure classify(String operation, Throwable throwable);
}
