package org.javai.unions.boundary;

import org.javai.unions.Failure;

/**
 * Translates a caught exception into a {@link Failure}.
 * Implementations should be deterministic: the same exception always yields the same failure.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return the failure to return in place of the exception
     */
    Failure classify(String operation, Throwable throwable);
}
