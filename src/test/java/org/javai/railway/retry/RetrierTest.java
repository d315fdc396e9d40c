package org.javai.railway.retry;

import org.javai.railway.CancellationToken;
import org.javai.railway.Failure;
import org.javai.railway.Result;
import org.javai.railway.boundary.Boundary;
import org.javai.railway.ops.OpReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetrierTest {

    private List<RetryAttempt> reportedRetries;
    private List<RetryExhausted> reportedExhausted;
    private List<Integer> reportedCancellations;
    private List<Result<?>> recorded;
    private List<Duration> sleeps;
    private OpReporter reporter;

    record RetryAttempt(Failure failure, int attemptNumber, Duration delay) {}
    record RetryExhausted(Failure failure, int totalAttempts, RetryDecision.StopReason reason) {}

    @BeforeEach
    void setUp() {
        reportedRetries = new ArrayList<>();
        reportedExhausted = new ArrayList<>();
        reportedCancellations = new ArrayList<>();
        recorded = new ArrayList<>();
        sleeps = new ArrayList<>();

        reporter = new OpReporter() {
            @Override
            public void record(String operation, Result<?> result) {
                recorded.add(result);
            }

            @Override
            public void reportRetryAttempt(String operation, Failure failure, int attemptNumber, Duration delay) {
                reportedRetries.add(new RetryAttempt(failure, attemptNumber, delay));
            }

            @Override
            public void reportRetryExhausted(String operation, Failure failure, int totalAttempts,
                                             RetryDecision.StopReason reason) {
                reportedExhausted.add(new RetryExhausted(failure, totalAttempts, reason));
            }

            @Override
            public void reportRetryCancelled(String operation, Result<?> lastResult, int totalAttempts) {
                reportedCancellations.add(totalAttempts);
            }
        };
    }

    private Retrier retrier(RetryPolicy policy) {
        return Retrier.builder()
                .policy(policy)
                .reporter(reporter)
                .sleeper((delay, token) -> {
                    sleeps.add(delay);
                    return false;
                })
                .build();
    }

    @Test
    void execute_success_returnsOkWithoutRetry() {
        Result<String> result = retrier(RetryPolicy.defaults()).execute("Op", () -> Result.ok("success"));

        assertThat(result.getOrThrow()).isEqualTo("success");
        assertThat(reportedRetries).isEmpty();
        assertThat(recorded).containsExactly(result);
    }

    @Test
    void execute_alwaysFailing_invokesMaxRetriesPlusOneAndReturnsLastFailure() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder().maxRetries(2).build();

        Result<String> result = retrier(policy).execute("Op",
                () -> Result.fail(Failure.serviceUnavailable("attempt " + attempts.incrementAndGet())));

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(result.failure().message()).isEqualTo("attempt 3");
        assertThat(reportedRetries).extracting(RetryAttempt::attemptNumber).containsExactly(1, 2);
        assertThat(reportedExhausted).containsExactly(
                new RetryExhausted(Failure.serviceUnavailable("attempt 3"), 3, RetryDecision.StopReason.EXHAUSTED));
    }

    @Test
    void execute_recoversOnLaterAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        Result<String> result = retrier(RetryPolicy.defaults()).execute("Op", () -> {
            if (attempts.incrementAndGet() < 3) {
                return Result.fail(Failure.serviceUnavailable("down"));
            }
            return Result.ok("success on attempt 3");
        });

        assertThat(result.getOrThrow()).isEqualTo("success on attempt 3");
        assertThat(reportedRetries).hasSize(2);
        assertThat(reportedExhausted).isEmpty();
    }

    @Test
    void execute_predicateRejectsFirstFailure_invokesOnce() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder()
                .maxRetries(5)
                .retryIf(failure -> failure instanceof Failure.ServiceUnavailable)
                .build();

        Result<String> result = retrier(policy).execute("Op", () -> {
            attempts.incrementAndGet();
            return Result.fail(Failure.validation("bad input"));
        });

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.failure()).isEqualTo(Failure.validation("bad input"));
        assertThat(reportedExhausted).extracting(RetryExhausted::reason)
                .containsExactly(RetryDecision.StopReason.STOPPED_BY_POLICY);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_waitsWithExponentialBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
                .maxRetries(3)
                .initialDelay(Duration.ofMillis(100))
                .backoffMultiplier(2.0)
                .build();

        retrier(policy).execute("Op", () -> Result.fail(Failure.serviceUnavailable("down")));

        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    void execute_noRetryPolicy_runsOnce() {
        AtomicInteger attempts = new AtomicInteger();

        retrier(RetryPolicy.noRetry()).execute("Op", () -> {
            attempts.incrementAndGet();
            return Result.fail(Failure.serviceUnavailable("down"));
        });

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_cancelledBeforeFirstAttempt_throws() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retrier(RetryPolicy.defaults()).execute("Op", token, () -> {
            attempts.incrementAndGet();
            return Result.ok("never");
        })).isInstanceOf(CancellationException.class);
        assertThat(attempts.get()).isZero();
    }

    @Test
    void execute_cancelledDuringDelay_returnsLatestResult() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger attempts = new AtomicInteger();
        Retrier retrier = Retrier.builder()
                .reporter(reporter)
                .sleeper((delay, t) -> {
                    token.cancel();
                    return t.isCancellationRequested();
                })
                .build();

        Result<String> result = retrier.execute("Op", token,
                () -> Result.fail(Failure.serviceUnavailable("attempt " + attempts.incrementAndGet())));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.failure().message()).isEqualTo("attempt 1");
        assertThat(reportedCancellations).containsExactly(1);
    }

    @Test
    void execute_cancelledBetweenAttempts_stopsBeforeNextAttempt() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger attempts = new AtomicInteger();

        Result<String> result = retrier(RetryPolicy.defaults()).execute("Op", token, () -> {
            if (attempts.incrementAndGet() == 2) {
                token.cancel();
            }
            return Result.fail(Failure.serviceUnavailable("attempt " + attempts.get()));
        });

        assertThat(attempts.get()).isEqualTo(2);
        assertThat(result.failure().message()).isEqualTo("attempt 2");
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void execute_cancelledAfterFailedAttempt_reportsCancellationWithoutRetry() {
        CancellationToken token = CancellationToken.create();
        List<String> events = new ArrayList<>();
        Retrier retrier = Retrier.builder()
                .reporter(new OpReporter() {
                    @Override
                    public void record(String operation, Result<?> result) {
                        events.add("record");
                    }

                    @Override
                    public void reportRetryAttempt(String operation, Failure failure, int attemptNumber, Duration delay) {
                        events.add("attempt" + attemptNumber);
                    }

                    @Override
                    public void reportRetryCancelled(String operation, Result<?> lastResult, int totalAttempts) {
                        events.add("cancelled" + totalAttempts);
                    }
                })
                .sleeper((delay, t) -> false)
                .build();

        Result<String> result = retrier.execute("Op", token, () -> {
            token.cancel();
            return Result.fail(Failure.notFound("order 7"));
        });

        assertThat(result.failure()).isEqualTo(Failure.notFound("order 7"));
        assertThat(events).containsExactly("cancelled1", "record");
    }

    @Test
    void execute_retryIsReportedAfterTheWait() {
        List<String> events = new ArrayList<>();
        AtomicInteger attempts = new AtomicInteger();
        Retrier retrier = Retrier.builder()
                .reporter(new OpReporter() {
                    @Override
                    public void record(String operation, Result<?> result) {
                        events.add("record");
                    }

                    @Override
                    public void reportRetryAttempt(String operation, Failure failure, int attemptNumber, Duration delay) {
                        events.add("attempt" + attemptNumber);
                    }
                })
                .sleeper((delay, t) -> {
                    events.add("wait");
                    return false;
                })
                .build();

        retrier.execute("Op", () -> attempts.incrementAndGet() < 2
                ? Result.<String>fail(Failure.serviceUnavailable("down"))
                : Result.ok("up"));

        assertThat(events).containsExactly("wait", "attempt1", "record");
    }

    @Test
    void execute_reporterFailure_doesNotAffectResult() {
        Retrier retrier = Retrier.builder()
                .reporter((operation, result) -> {
                    throw new IllegalStateException("reporter broken");
                })
                .sleeper((delay, token) -> false)
                .build();

        assertThat(retrier.execute("Op", () -> Result.ok(1)).getOrThrow()).isEqualTo(1);
    }

    @Test
    void execute_withBoundary_retriesCheckedExceptions() {
        AtomicInteger attempts = new AtomicInteger();

        Result<String> result = retrier(RetryPolicy.defaults()).execute("Fetch", Boundary.silent(), () -> {
            if (attempts.incrementAndGet() < 2) {
                throw new IOException("connection reset");
            }
            return "payload";
        });

        assertThat(result.getOrThrow()).isEqualTo("payload");
        assertThat(reportedRetries).singleElement()
                .satisfies(retry -> assertThat(retry.failure()).isInstanceOf(Failure.ServiceUnavailable.class));
    }

    @Test
    void retry_staticConvenience_usesDefaults() {
        Result<Integer> result = Retrier.retry(() -> Result.ok(42));

        assertThat(result.getOrThrow()).isEqualTo(42);
    }
}
