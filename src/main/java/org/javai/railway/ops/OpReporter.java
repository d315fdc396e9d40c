package org.javai.railway.ops;

import org.javai.railway.Failure;
import org.javai.railway.Result;
import org.javai.railway.retry.RetryDecision;

import java.time.Duration;

/**
 * Observes results for operational visibility.
 * Implementations might emit metrics, structured logs, or traces.
 *
 * <p>Reporters are passed explicitly to the components that use them. Nothing in this
 * library installs a reporter globally.
 */
public interface OpReporter {

    /**
     * Records the result of a named operation, on either track.
     */
    void record(String operation, Result<?> result);

    /**
     * Reports that a failed attempt is being retried. Called once the wait is over and just
     * before the next attempt starts, so a cancelled wait is never reported as a retry.
     *
     * @param operation The operation name
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay How long the retrier waited before the next attempt
     */
    default void reportRetryAttempt(String operation, Failure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the retrier gave up.
     *
     * @param operation The operation name
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     * @param reason Why the policy stopped
     */
    default void reportRetryExhausted(String operation, Failure failure, int totalAttempts,
                                      RetryDecision.StopReason reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that retrying stopped because cancellation was requested.
     *
     * @param operation The operation name
     * @param lastResult The result of the last completed attempt
     * @param totalAttempts The total number of attempts made
     */
    default void reportRetryCancelled(String operation, Result<?> lastResult, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return (operation, result) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }

    /**
     * Wraps a reporter so that exceptions it throws are logged instead of propagated.
     * A reporter failure must never change the result of the operation being observed.
     *
     * @param reporter the reporter to guard
     * @return the reporter itself if it is already a composite, otherwise a single-entry composite
     */
    static OpReporter guarded(OpReporter reporter) {
        if (reporter instanceof CompositeOpReporter composite) {
            return composite;
        }
        return CompositeOpReporter.of(reporter);
    }
}
