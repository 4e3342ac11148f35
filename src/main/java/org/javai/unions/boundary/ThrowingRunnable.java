package org.javai.unions.boundary;

/**
 * A side-effecting action that may throw a checked exception.
 *
 * @param <E> The type of exception that may be thrown
 * @see Boundary#run(String, ThrowingRunnable)
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {

    void run() throws E;
}
