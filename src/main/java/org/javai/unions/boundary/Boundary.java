package org.javai.unions.boundary;

import java.util.Objects;
import org.javai.unions.Failure;
import org.javai.unions.Result;
import org.javai.unions.UnitResult;
import org.javai.unions.ops.FailureReporter;

/**
 * The boundary adapter for code that reports errors by throwing checked exceptions.
 * Catches exceptions, classifies them into failures, reports them, and returns a {@link Result}.
 *
 * <p>This is the single point where checked exceptions are translated into failure values.
 * After passing through a Boundary, code composes results instead of catching.</p>
 *
 * <p>RuntimeExceptions (defects) are not caught; they propagate to the caller.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * // Simple usage for testing or prototyping
 * Boundary boundary = Boundary.silent();
 *
 * // Production usage with reporting
 * Boundary boundary = Boundary.withReporter(new Log4jFailureReporter());
 *
 * // Full control
 * Boundary boundary = Boundary.of(classifier, reporter);
 *
 * Result<String> config = boundary.call(
 *     "Files.readString",
 *     () -> Files.readString(path)
 * );
 * }</pre>
 */
public final class Boundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = new BoundaryFailureClassifier();

    private final FailureClassifier classifier;
    private final FailureReporter reporter;

    /**
     * Creates a silent Boundary that classifies failures but does not report them.
     *
     * @return a Boundary with default classification and no reporting
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_CLASSIFIER, FailureReporter.noOp());
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     *
     * @param reporter the reporter for classified failures
     * @return a Boundary with default classification and custom reporting
     */
    public static Boundary withReporter(FailureReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    /**
     * Creates a Boundary with custom classification and reporting.
     *
     * @param classifier the classifier for translating exceptions to failures
     * @param reporter the reporter for classified failures
     * @return a fully configured Boundary
     */
    public static Boundary of(FailureClassifier classifier, FailureReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, FailureReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into a failure.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute; must not return null
     * @return a success with the value, or a failure with the classified exception
     */
    public <T> Result<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Result.success(work.get());
        } catch (RuntimeException e) {
            // Defects propagate; they are not failures of the operation.
            throw e;
        } catch (Exception e) {
            return Result.failure(handleException(operation, e));
        }
    }

    /**
     * Executes an action that may throw checked exceptions.
     *
     * @param operation The operation name for context and reporting
     * @param work The action to execute
     * @return success, or a failure with the classified exception
     */
    public UnitResult run(String operation, ThrowingRunnable<? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            work.run();
            return UnitResult.success();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            return UnitResult.failure(handleException(operation, e));
        }
    }

    private Failure handleException(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        Failure failure = Objects.requireNonNull(classifier.classify(operation, e),
                "classifier must not return null");
        reporter.report(failure);
        return failure;
    }
}
