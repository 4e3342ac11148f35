package org.javai.unions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Collection-level and multi-operand operations over {@link UnitResult}.
 */
public final class UnitResults {

    private UnitResults() {
        // Utility class
    }

    /**
     * Outcome counts of a unit result collection.
     *
     * @param successCount how many results succeeded
     * @param failures the failures in encounter order
     */
    public record Partition(int successCount, List<Failure> failures) {

        public Partition {
            failures = List.copyOf(failures);
        }
    }

    // === Collections ===

    /**
     * Succeeds if every result succeeded; otherwise returns the first failure.
     */
    public static UnitResult sequence(Iterable<UnitResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        for (UnitResult result : results) {
            if (result.isFailure()) {
                return result;
            }
        }
        return UnitResult.success();
    }

    /**
     * Runs {@code action} on each element, stopping at the first failure.
     */
    public static <S> UnitResult traverse(Iterable<S> source, Function<? super S, UnitResult> action) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(action, "action must not be null");
        for (S item : source) {
            UnitResult result = action.apply(item);
            if (result.isFailure()) {
                return result;
            }
        }
        return UnitResult.success();
    }

    /**
     * Succeeds if every result succeeded; otherwise fails with every failure.
     */
    public static UnitResult collectAll(Iterable<UnitResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        FailureBuilder failures = new FailureBuilder();
        for (UnitResult result : results) {
            failures.appendOnFailure(result);
        }
        return toUnitResult(failures);
    }

    public static Partition partition(Iterable<UnitResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        int successCount = 0;
        List<Failure> failures = new ArrayList<>();
        for (UnitResult result : results) {
            if (result.isSuccess()) {
                successCount++;
            } else {
                failures.add(result.getFailure());
            }
        }
        return new Partition(successCount, failures);
    }

    public static int countSuccesses(Iterable<UnitResult> results) {
        return partition(results).successCount();
    }

    public static int countFailures(Iterable<UnitResult> results) {
        return partition(results).failures().size();
    }

    public static List<Failure> extractFailures(Iterable<UnitResult> results) {
        return partition(results).failures();
    }

    // === Multi-operand ===

    /**
     * Returns the first failure among already-computed results, or success.
     */
    public static UnitResult combine(UnitResult... results) {
        return sequence(List.of(results));
    }

    /**
     * Runs {@code steps} in order and stops at the first failure; later steps are not invoked.
     */
    @SafeVarargs
    public static UnitResult bind(Supplier<UnitResult>... steps) {
        for (Supplier<UnitResult> step : steps) {
            UnitResult result = Objects.requireNonNull(step.get(), "step must not return null");
            if (result.isFailure()) {
                return result;
            }
        }
        return UnitResult.success();
    }

    /**
     * Fails with the failures of every failing operand.
     */
    public static UnitResult bindAll(UnitResult... results) {
        return collectAll(List.of(results));
    }

    // === Requirements ===

    public static UnitResult ensure(boolean condition, Failure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return condition ? UnitResult.success() : UnitResult.failure(failure);
    }

    /**
     * Evaluates the requirements in order and fails with the first one that does not hold.
     * Conditions after it are not evaluated.
     */
    public static UnitResult ensure(Requirement... requirements) {
        for (Requirement requirement : requirements) {
            if (!requirement.holds()) {
                return UnitResult.failure(requirement.failure());
            }
        }
        return UnitResult.success();
    }

    /**
     * Evaluates every requirement and fails with the failures of all that do not hold.
     */
    public static UnitResult ensureAll(Requirement... requirements) {
        FailureBuilder failures = new FailureBuilder();
        for (Requirement requirement : requirements) {
            if (!requirement.holds()) {
                failures.append(requirement.failure());
            }
        }
        return toUnitResult(failures);
    }

    private static UnitResult toUnitResult(FailureBuilder failures) {
        return failures.hasFailures() ? UnitResult.failure(failures.build()) : UnitResult.success();
    }
}
