package org.javai.railway.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.railway.Failure;
import org.javai.railway.Failures;
import org.javai.railway.Result;
import org.javai.railway.ops.OpReporter;
import org.javai.railway.retry.RetryDecision;

import java.time.Duration;

/**
 * Reports results using Log4j2 structured logging.
 *
 * <p>Failures are logged at a level chosen by their kind:
 * <ul>
 *   <li>{@code Unexpected}, {@code ServiceUnavailable} → ERROR</li>
 *   <li>{@code RateLimit}, {@code Conflict}, {@code Aggregate} → WARN</li>
 *   <li>every other failure kind → INFO</li>
 * </ul>
 * Successes are logged at DEBUG.
 *
 * <p>Every entry carries a marker ({@code FAILURE}, {@code RETRY}, {@code RETRY_EXHAUSTED}
 * or {@code RETRY_CANCELLED}) so appenders can route them separately.
 */
public class Log4jOpReporter implements OpReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker RETRY_CANCELLED_MARKER = MarkerManager.getMarker("RETRY_CANCELLED");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.railway.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void record(String operation, Result<?> result) {
		if (result instanceof Result.Fail<?> fail) {
			Failure failure = fail.failure();
			logger.atLevel(levelFor(failure))
				.withMarker(FAILURE_MARKER)
				.log(formatFailureMessage(operation, failure));
		} else {
			logger.atDebug().log("Operation [{}] succeeded", operation);
		}
	}

	@Override
	public void reportRetryAttempt(String operation, Failure failure, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying operation [{}] after attempt {} and a {} ms wait. Code: {}, Message: {}",
				operation,
				attemptNumber,
				delay.toMillis(),
				failure.code(),
				failure.message());
	}

	@Override
	public void reportRetryExhausted(String operation, Failure failure, int totalAttempts,
									 RetryDecision.StopReason reason) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry gave up for operation [{}] after {} attempts ({}). Code: {}, Message: {}",
				operation,
				totalAttempts,
				reason,
				failure.code(),
				failure.message());
	}

	@Override
	public void reportRetryCancelled(String operation, Result<?> lastResult, int totalAttempts) {
		logger.atInfo()
			.withMarker(RETRY_CANCELLED_MARKER)
			.log("Retry cancelled for operation [{}] after {} attempts", operation, totalAttempts);
	}

	private static String formatFailureMessage(String operation, Failure failure) {
		return "Failure in operation [%s]: %s | kind=%s, code=%s%s%s".formatted(
				operation,
				failure.message(),
				failure.kind(),
				failure.code(),
				formatInstance(failure.instance()),
				formatCount(failure));
	}

	private static String formatInstance(String instance) {
		return instance != null ? ", instance=" + instance : "";
	}

	private static String formatCount(Failure failure) {
		int count = Failures.flatten(failure).size();
		return count > 1 ? ", failures=" + count : "";
	}

	static Level levelFor(Failure failure) {
		return switch (failure.kind()) {
			case UNEXPECTED, SERVICE_UNAVAILABLE -> Level.ERROR;
			case RATE_LIMIT, CONFLICT, AGGREGATE -> Level.WARN;
			default -> Level.INFO;
		};
	}
}
