package org.javai.railway.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.railway.ConfigResolver;
import org.javai.railway.Failure;
import org.javai.railway.Failures;
import org.javai.railway.Result;
import org.javai.railway.ops.OpReporter;
import org.javai.railway.retry.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports results as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the operation name, prefixed by a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.order.fetch","kind":"NOT_FOUND",...}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jOpReporter pattern:</p>
 * <ul>
 *   <li>{@link #MetricsOpReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsOpReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsOpReporter(String, String)} - with namespace and custom logger name</li>
 *   <li>{@link #fromConfiguration()} - namespace from {@code railway.metrics.namespace}</li>
 * </ul>
 */
public class MetricsOpReporter implements OpReporter {

	public static final String NAMESPACE_PROPERTY = "railway.metrics.namespace";
	public static final String NAMESPACE_ENV = "RAILWAY_METRICS_NAMESPACE";

	private static final String DEFAULT_LOGGER_NAME = "org.javai.railway.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	/**
	 * Creates a reporter whose namespace comes from {@value #NAMESPACE_PROPERTY} or
	 * {@value #NAMESPACE_ENV}. No namespace is used when neither is set.
	 */
	public static MetricsOpReporter fromConfiguration() {
		return fromConfiguration(ConfigResolver.system());
	}

	public static MetricsOpReporter fromConfiguration(ConfigResolver config) {
		return new MetricsOpReporter(config.resolve(NAMESPACE_PROPERTY, NAMESPACE_ENV).orElse(null));
	}

	@Override
	public void record(String operation, Result<?> result) {
		ObjectNode event;
		if (result instanceof Result.Fail<?> fail) {
			event = baseEvent("failure", operation);
			appendFailure(event, fail.failure());
		} else {
			event = baseEvent("success", operation);
		}
		emit(event);
	}

	@Override
	public void reportRetryAttempt(String operation, Failure failure, int attemptNumber, Duration delay) {
		ObjectNode event = baseEvent("retry_attempt", operation);
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		event.put("kind", failure.kind().name());
		event.put("code", failure.code());
		emit(event);
	}

	@Override
	public void reportRetryExhausted(String operation, Failure failure, int totalAttempts,
									 RetryDecision.StopReason reason) {
		ObjectNode event = baseEvent("retry_exhausted", operation);
		event.put("totalAttempts", totalAttempts);
		event.put("reason", reason.name());
		event.put("kind", failure.kind().name());
		event.put("code", failure.code());
		emit(event);
	}

	@Override
	public void reportRetryCancelled(String operation, Result<?> lastResult, int totalAttempts) {
		ObjectNode event = baseEvent("retry_cancelled", operation);
		event.put("totalAttempts", totalAttempts);
		event.put("lastOutcome", lastResult.isOk() ? "success" : "failure");
		emit(event);
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private ObjectNode baseEvent(String eventType, String operation) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", buildTrackingKey(operation));
		return event;
	}

	private static void appendFailure(ObjectNode event, Failure failure) {
		event.put("kind", failure.kind().name());
		event.put("code", failure.code());
		event.put("message", failure.message());
		if (failure.instance() != null) {
			event.put("instance", failure.instance());
		}
		event.put("failureCount", Failures.flatten(failure).size());
		if (failure instanceof Failure.Validation validation) {
			ArrayNode fields = event.putArray("fields");
			for (Failure.Validation.FieldError fieldError : validation.fieldErrors()) {
				fields.add(fieldError.fieldName());
			}
		}
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize metrics event {}", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
