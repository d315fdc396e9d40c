package org.javai.railway;

import org.javai.railway.ops.OpReporter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class ResultTest {

    @Test
    void ok_minimalOk() {
        Result<Void> result = Result.ok();

        assertThat(result.isOk()).isTrue();
        assertThat(result.isFail()).isFalse();
        assertThat(((Result.Ok<Void>) result).value()).isNull();
    }

    @Test
    void ok_failure_throws() {
        assertThatThrownBy(() -> Result.ok("x").failure())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fail_getOrThrow_throwsWithFailure() {
        Failure failure = Failure.notFound("user 3");

        assertThatThrownBy(() -> Result.fail(failure).getOrThrow())
                .isInstanceOf(ResultFailedException.class)
                .hasMessage("Result failed: user 3")
                .satisfies(e -> assertThat(((ResultFailedException) e).failure()).isSameAs(failure));
    }

    @Test
    void fail_nullFailure_throws() {
        assertThatThrownBy(() -> Result.fail(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void getOrElse_returnsDefaultOnlyOnFailure() {
        assertThat(Result.ok("v").getOrElse("d")).isEqualTo("v");
        assertThat(Result.<String>fail(Failure.notFound("x")).getOrElse("d")).isEqualTo("d");
        assertThat(Result.<String>fail(Failure.notFound("x")).getOrElseGet(() -> "lazy")).isEqualTo("lazy");
    }

    @Test
    void toOptional_emptyForFailure() {
        assertThat(Result.ok(5).toOptional()).contains(5);
        assertThat(Result.fail(Failure.conflict("x")).toOptional()).isEmpty();
    }

    @Test
    void okIf_and_failIf_chooseTrack() {
        Failure failure = Failure.badRequest("negative");

        assertThat(Result.okIf(true, 1, failure).isOk()).isTrue();
        assertThat(Result.okIf(false, 1, failure).failure()).isSameAs(failure);
        assertThat(Result.failIf(true, 1, failure).isFail()).isTrue();
    }

    @Test
    void fromOptional_emptyUsesSuppliedFailure() {
        Failure failure = Failure.notFound("no config");

        assertThat(Result.fromOptional(Optional.of("a"), () -> failure).getOrThrow()).isEqualTo("a");
        assertThat(Result.fromOptional(Optional.empty(), () -> failure).failure()).isSameAs(failure);
    }

    // === flatMap / map ===

    @Test
    void flatMap_onFailure_neverInvokesFunction() {
        AtomicInteger calls = new AtomicInteger();
        Result<Integer> failed = Result.fail(Failure.notFound("missing"));

        Result<Integer> result = failed.flatMap(v -> {
            calls.incrementAndGet();
            return Result.ok(v + 1);
        });

        assertThat(calls.get()).isZero();
        assertThat(result.failure()).isEqualTo(Failure.notFound("missing"));
    }

    @Test
    void flatMap_leftIdentity() {
        Function<Integer, Result<String>> f = v -> Result.ok("#" + v);

        assertThat(Result.ok(4).flatMap(f)).isEqualTo(f.apply(4));
    }

    @Test
    void flatMap_rightIdentity() {
        Result<Integer> result = Result.ok(4);

        assertThat(result.flatMap(Result::ok)).isEqualTo(result);
    }

    @Test
    void flatMap_nullFromFunction_throws() {
        assertThatThrownBy(() -> Result.ok(1).flatMap(v -> null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void map_identityAndComposition() {
        Result<Integer> result = Result.ok(3);
        Function<Integer, Integer> plusOne = v -> v + 1;
        Function<Integer, Integer> twice = v -> v * 2;

        assertThat(result.map(Function.identity())).isEqualTo(result);
        assertThat(result.map(plusOne).map(twice)).isEqualTo(result.map(plusOne.andThen(twice)));
    }

    @Test
    void map_onFailure_preservesFailure() {
        Failure failure = Failure.unexpected("boom");

        assertThat(Result.<Integer>fail(failure).map(v -> v * 2).failure()).isSameAs(failure);
    }

    // === ensure ===

    @Test
    void ensure_predicateFails_switchesToFailure() {
        Result<Integer> result = Result.ok(5).ensure(x -> x > 10, Failure.validation("too small"));

        assertThat(result.failure()).isEqualTo(Failure.validation("too small"));
    }

    @Test
    void ensure_predicateHolds_keepsValue() {
        assertThat(Result.ok(15).ensure(x -> x > 10, Failure.validation("too small")).getOrThrow()).isEqualTo(15);
    }

    @Test
    void ensure_onFailure_predicateNotEvaluated() {
        AtomicInteger calls = new AtomicInteger();

        Result.<Integer>fail(Failure.notFound("x")).ensure(v -> calls.incrementAndGet() > 0, Failure.validation("no"));

        assertThat(calls.get()).isZero();
    }

    @Test
    void ensure_derivesFailureFromValue() {
        Result<Integer> result = Result.ok(3).ensure(x -> x % 2 == 0, x -> Failure.domain(x + " is odd"));

        assertThat(result.failure().message()).isEqualTo("3 is odd");
    }

    @Test
    void when_and_unless_runOnlyWhenConditionSelects() {
        Function<Integer, Result<Integer>> negate = v -> Result.ok(-v);

        assertThat(Result.ok(4).when(v -> v > 3, negate).getOrThrow()).isEqualTo(-4);
        assertThat(Result.ok(2).when(v -> v > 3, negate).getOrThrow()).isEqualTo(2);
        assertThat(Result.ok(2).unless(v -> v > 3, negate).getOrThrow()).isEqualTo(-2);
    }

    @Test
    void when_operationReturningNull_isRejected() {
        assertThatThrownBy(() -> Result.ok(4).when(v -> v > 3, v -> null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("when operation returned null");
    }

    @Test
    void recoverWith_recoveryReturningNull_isRejected() {
        Result<String> failed = Result.fail(Failure.notFound("gone"));

        assertThatThrownBy(() -> failed.recoverWith(f -> null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("recovery returned null");
        assertThatThrownBy(() -> failed.compensate(() -> null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("compensation returned null");
    }

    // === compensate / recover ===

    @Test
    void compensate_replacesFailure() {
        Result<String> result = Result.<String>fail(Failure.serviceUnavailable("primary down"))
                .compensate(() -> Result.ok("from cache"));

        assertThat(result.getOrThrow()).isEqualTo("from cache");
    }

    @Test
    void compensate_onSuccess_isNotInvoked() {
        AtomicInteger calls = new AtomicInteger();

        Result<String> result = Result.ok("primary").compensate(() -> {
            calls.incrementAndGet();
            return Result.ok("fallback");
        });

        assertThat(result.getOrThrow()).isEqualTo("primary");
        assertThat(calls.get()).isZero();
    }

    @Test
    void compensate_withPredicate_onlyHandlesMatchingFailures() {
        Result<String> notFound = Result.fail(Failure.notFound("x"));
        Result<String> conflict = Result.fail(Failure.conflict("y"));

        assertThat(notFound.compensate(f -> f instanceof Failure.NotFound, () -> Result.ok("default")).getOrThrow())
                .isEqualTo("default");
        assertThat(conflict.compensate(f -> f instanceof Failure.NotFound, () -> Result.ok("default")))
                .isSameAs(conflict);
    }

    @Test
    void recover_and_recoverWith_receiveFailure() {
        Result<String> failed = Result.fail(Failure.rateLimit("slow"));

        assertThat(failed.recover(Failure::message).getOrThrow()).isEqualTo("slow");
        assertThat(failed.recoverWith(f -> Result.fail(Failure.unexpected("wrapped " + f.message()))).failure().message())
                .isEqualTo("wrapped slow");
        assertThat(failed.recoverWith(f -> f instanceof Failure.NotFound, f -> Result.ok("x"))).isSameAs(failed);
    }

    // === tap / mapFailure / match ===

    @Test
    void tap_runsOnlyOnMatchingTrack() {
        List<String> seen = new ArrayList<>();

        Result.ok("a").tap(seen::add).tapOnFailure(f -> seen.add("failure"));
        Result.<String>fail(Failure.notFound("b")).tap(seen::add).tapOnFailure(f -> seen.add(f.message()));

        assertThat(seen).containsExactly("a", "b");
    }

    @Test
    void mapFailure_transformsOnlyFailures() {
        Result<String> failed = Result.fail(Failure.notFound("order"));

        Result<String> mapped = failed.mapFailure(f -> Failure.domain("cannot ship: " + f.message()));

        assertThat(mapped.failure()).isEqualTo(Failure.domain("cannot ship: order"));
        assertThat(Result.ok("v").mapFailure(f -> Failure.domain("never"))).isEqualTo(Result.ok("v"));
    }

    @Test
    void match_picksHandlerByTrack() {
        assertThat(Result.ok(2).match(v -> "ok " + v, Failure::message)).isEqualTo("ok 2");
        assertThat(Result.<Integer>fail(Failure.notFound("gone")).match(v -> "ok " + v, Failure::message))
                .isEqualTo("gone");
    }

    // === combine ===

    @Test
    void combine_bothOk_pairsValues() {
        Result<Pair<String, Integer>> result = Result.ok("a").combine(Result.ok(1));

        assertThat(result.getOrThrow()).isEqualTo(Pair.of("a", 1));
    }

    @Test
    void combine_growsTupleAndReportsEveryFailure() {
        Failure first = Failure.notFound("a");
        Failure third = Failure.conflict("c");

        Result<Pair<Pair<String, Integer>, Boolean>> result = Result.<String>fail(first)
                .combine(Result.ok(2))
                .combine(Result.<Boolean>fail(third));

        assertThat(Failures.flatten(result.failure())).containsExactly(first, third);
    }

    @Test
    void combine_withCombiner_appliesToValues() {
        assertThat(Result.ok(2).combine(Result.ok(3), Integer::sum).getOrThrow()).isEqualTo(5);
    }

    // === observe ===

    @Test
    void observe_reportsAndReturnsSameResult() {
        List<String> recorded = new ArrayList<>();
        Result<String> result = Result.ok("v");

        Result<String> observed = result.observe((operation, r) -> recorded.add(operation + ":" + r.isOk()), "Load");

        assertThat(observed).isSameAs(result);
        assertThat(recorded).containsExactly("Load:true");
    }

    @Test
    void observe_reporterException_doesNotEscape() {
        OpReporter failing = (operation, r) -> {
            throw new IllegalStateException("reporter broken");
        };
        Result<String> result = Result.fail(Failure.notFound("x"));

        assertThat(result.observe(failing, "Load")).isSameAs(result);
    }
}
