package org.javai.unions;

/**
 * A function of three arguments.
 */
@FunctionalInterface
public interface Function3<A, B, C, R> {

    R apply(A first, B second, C third);
}
