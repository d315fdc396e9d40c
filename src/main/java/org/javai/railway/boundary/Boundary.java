package org.javai.railway.boundary;

import java.util.Objects;
import org.javai.railway.Failure;
import org.javai.railway.Result;
import org.javai.railway.ops.OpReporter;

/**
 * The boundary adapter for integrating third-party APIs that throw checked exceptions.
 * Catches exceptions, classifies them into failures, reports the result, and returns it.
 *
 * <p>This is the single point where checked exceptions are translated into Results.
 * After passing through a Boundary, code operates entirely on the two tracks.</p>
 *
 * <p>RuntimeExceptions are defects, not operational failures. They are not caught and
 * propagate to the caller.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * // Simple usage for testing or prototyping
 * Boundary boundary = Boundary.silent();
 *
 * // Production usage with reporting
 * Boundary boundary = Boundary.withReporter(myReporter);
 *
 * // Full control
 * Boundary boundary = Boundary.of(classifier, reporter);
 *
 * Result<Response> result = boundary.call(
 *     "HttpClient.send",
 *     () -> httpClient.send(request)
 * );
 * }</pre>
 */
public final class Boundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = new DefaultFailureClassifier();

    private final FailureClassifier classifier;
    private final OpReporter reporter;

    /**
     * Creates a silent Boundary that classifies failures but does not report them.
     *
     * @return a Boundary with default classification and no reporting
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_CLASSIFIER, OpReporter.noOp());
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     *
     * @param reporter receives the result of every call
     * @return a Boundary with default classification and custom reporting
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    /**
     * Creates a Boundary with custom classification and reporting.
     *
     * @param classifier the classifier for translating exceptions to failures
     * @param reporter receives the result of every call
     * @return a fully configured Boundary
     */
    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = OpReporter.guarded(Objects.requireNonNull(reporter, "reporter must not be null"));
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into a Result.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the value, or Fail with a classified failure
     */
    public <T> Result<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        Result<T> result;
        try {
            result = Result.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            result = Result.fail(classify(operation, e));
        }
        reporter.record(operation, result);
        return result;
    }

    private Failure classify(String operation, Exception e) {
        return Objects.requireNonNull(classifier.classify(operation, e), "classifier returned null");
    }
}
