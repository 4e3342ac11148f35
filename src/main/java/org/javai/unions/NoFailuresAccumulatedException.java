package org.javai.unions;

/**
 * Thrown when {@link FailureBuilder#build()} is called before any failure was appended.
 * This is an unchecked exception because it indicates misuse of the API: the caller
 * should have checked {@link FailureBuilder#hasFailures()} or used {@link FailureBuilder#tryBuild()}.
 */
public class NoFailuresAccumulatedException extends IllegalStateException {

    public NoFailuresAccumulatedException() {
        super("No failures to build.");
    }
}
