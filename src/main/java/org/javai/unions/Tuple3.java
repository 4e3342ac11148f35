package org.javai.unions;

import java.util.Objects;

/**
 * Three values produced together by {@code zip} or {@code combine}.
 */
public record Tuple3<A, B, C>(A first, B second, C third) {

    public static <A, B, C> Tuple3<A, B, C> of(A first, B second, C third) {
        return new Tuple3<>(first, second, third);
    }

    /**
     * Destructures the tuple into {@code mapper}'s parameters.
     */
    public <R> R map(Function3<? super A, ? super B, ? super C, ? extends R> mapper) {
        Objects.requireNonNull(mapper);
        return mapper.apply(first, second, third);
    }
}
