package org.javai.railway;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Combination rules for {@link Failure} values.
 *
 * <p>Two validation failures merge into one validation report. Any other pairing is
 * wrapped in an {@link Failure.Aggregate}, flattening aggregates on either side so that
 * the result never nests. A validation failure taking part in such a pairing stays one
 * entry; its field errors are not split apart.
 */
public final class Failures {

    private Failures() {
        // Utility class
    }

    /**
     * Combines two failures, left first.
     *
     * @param left the accumulated failure so far, or null if there is none
     * @param right the failure to add
     * @return {@code right} if {@code left} is null, otherwise the combination of both
     * @throws IllegalArgumentException if {@code right} is null
     */
    public static Failure combine(Failure left, Failure right) {
        if (right == null) {
            throw new IllegalArgumentException("right-hand failure must not be null");
        }
        if (left == null) {
            return right;
        }
        if (left instanceof Failure.Validation leftValidation && right instanceof Failure.Validation rightValidation) {
            return leftValidation.merge(rightValidation);
        }
        List<Failure> flattened = new ArrayList<>();
        appendFlattened(flattened, left);
        appendFlattened(flattened, right);
        return new Failure.Aggregate(flattened);
    }

    /**
     * Folds failures left to right through {@link #combine(Failure, Failure)}.
     *
     * @param failures the failures in the order they should appear
     * @return the combined failure, or empty if there were none
     */
    public static Optional<Failure> combineAll(Iterable<? extends Failure> failures) {
        Failure accumulated = null;
        for (Failure failure : failures) {
            accumulated = combine(accumulated, failure);
        }
        return Optional.ofNullable(accumulated);
    }

    /**
     * Returns the failures a failure stands for: an aggregate's entries, or the failure itself.
     */
    public static List<Failure> flatten(Failure failure) {
        if (failure instanceof Failure.Aggregate aggregate) {
            return aggregate.failures();
        }
        return List.of(failure);
    }

    private static void appendFlattened(List<Failure> target, Failure failure) {
        target.addAll(flatten(failure));
    }
}
