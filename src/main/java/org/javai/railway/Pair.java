package org.javai.railway;

/**
 * Two values produced together by {@link Result#combine(Result)}.
 *
 * @param first the left value
 * @param second the right value
 */
public record Pair<A, B>(A first, B second) {

    public static <A, B> Pair<A, B> of(A first, B second) {
        return new Pair<>(first, second);
    }
}
