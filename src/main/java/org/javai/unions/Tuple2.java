package org.javai.unions;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Two values produced together by {@code zip} or {@code combine}.
 */
public record Tuple2<A, B>(A first, B second) {

    public static <A, B> Tuple2<A, B> of(A first, B second) {
        return new Tuple2<>(first, second);
    }

    /**
     * Destructures the tuple into {@code mapper}'s parameters.
     */
    public <R> R map(BiFunction<? super A, ? super B, ? extends R> mapper) {
        Objects.requireNonNull(mapper);
        return mapper.apply(first, second);
    }
}
