package org.javai.railway.ops;

import org.javai.railway.Failure;
import org.javai.railway.Result;
import org.javai.railway.retry.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged at WARN, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.of(
 *     new Log4jOpReporter(),
 *     new MetricsOpReporter("orders")
 * );
 *
 * // Or using the builder for more control:
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, MetricsOpReporter.fromConfiguration())
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void record(String operation, Result<?> result) {
		fanOut("record", reporter -> reporter.record(operation, result));
	}

	@Override
	public void reportRetryAttempt(String operation, Failure failure, int attemptNumber, Duration delay) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(operation, failure, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(String operation, Failure failure, int totalAttempts,
									 RetryDecision.StopReason reason) {
		fanOut("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(operation, failure, totalAttempts, reason));
	}

	@Override
	public void reportRetryCancelled(String operation, Result<?> lastResult, int totalAttempts) {
		fanOut("reportRetryCancelled", reporter -> reporter.reportRetryCancelled(operation, lastResult, totalAttempts));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				LOG.warn("OpReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(OpReporter reporter) {
			reporters.add(Objects.requireNonNull(reporter, "reporter must not be null"));
			return this;
		}

		public Builder addAll(Collection<? extends OpReporter> reporters) {
			for (OpReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
