package org.javai.unions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.javai.unions.check.GeneralChecks;
import org.javai.unions.check.StringChecks;

/**
 * Collection-level and multi-operand operations over {@link Result}.
 *
 * <p>Each operation comes in a short-circuiting and an accumulating form:
 * {@link #sequence} returns the first failure while {@link #collectAll} reports all of them,
 * and {@link #combine} stops at the first failing operand while {@link #combineAll}
 * evaluates every operand.
 */
public final class Results {

    private Results() {
        // Utility class
    }

    /**
     * Successful values and failures of a result collection, nothing discarded.
     *
     * @param successes the successful values in encounter order
     * @param failures the failures in encounter order
     */
    public record Partition<T>(List<T> successes, List<Failure> failures) {

        public Partition {
            successes = List.copyOf(successes);
            failures = List.copyOf(failures);
        }
    }

    // === Collections ===

    /**
     * Succeeds with every value if all results succeeded; otherwise returns the first failure.
     */
    public static <T> Result<List<T>> sequence(Iterable<Result<T>> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<T> values = new ArrayList<>();
        for (Result<T> result : results) {
            if (result.isFailure()) {
                return Result.failure(result.getFailure());
            }
            values.add(result.getValue());
        }
        return Result.success(List.copyOf(values));
    }

    /**
     * Maps each element and sequences the results. {@code selector} is not invoked for the
     * elements after the first failure.
     */
    public static <S, T> Result<List<T>> traverse(Iterable<S> source, Function<? super S, Result<T>> selector) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
        List<T> values = new ArrayList<>();
        for (S item : source) {
            Result<T> result = selector.apply(item);
            if (result.isFailure()) {
                return Result.failure(result.getFailure());
            }
            values.add(result.getValue());
        }
        return Result.success(List.copyOf(values));
    }

    /**
     * Succeeds with every value if all results succeeded; otherwise fails with every failure,
     * merged into an aggregate when there is more than one.
     */
    public static <T> Result<List<T>> collectAll(Iterable<Result<T>> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<T> values = new ArrayList<>();
        FailureBuilder failures = new FailureBuilder();
        for (Result<T> result : results) {
            if (result.isSuccess()) {
                values.add(result.getValue());
            } else {
                failures.append(result.getFailure());
            }
        }
        if (failures.hasFailures()) {
            return Result.failure(failures.build());
        }
        return Result.success(List.copyOf(values));
    }

    public static <T> Partition<T> partition(Iterable<Result<T>> results) {
        Objects.requireNonNull(results, "results must not be null");
        List<T> successes = new ArrayList<>();
        List<Failure> failures = new ArrayList<>();
        for (Result<T> result : results) {
            if (result.isSuccess()) {
                successes.add(result.getValue());
            } else {
                failures.add(result.getFailure());
            }
        }
        return new Partition<>(successes, failures);
    }

    public static <T> List<T> chooseSuccesses(Iterable<Result<T>> results) {
        return partition(results).successes();
    }

    public static <T> List<Failure> chooseFailures(Iterable<Result<T>> results) {
        return partition(results).failures();
    }

    // === Multi-operand ===

    /**
     * Succeeds with both values, or returns the first failure in argument order.
     */
    public static <A, B> Result<Tuple2<A, B>> combine(Result<A> first, Result<B> second) {
        if (first.isFailure()) {
            return Result.failure(first.getFailure());
        }
        if (second.isFailure()) {
            return Result.failure(second.getFailure());
        }
        return Result.success(Tuple2.of(first.getValue(), second.getValue()));
    }

    public static <A, B, C> Result<Tuple3<A, B, C>> combine(Result<A> first, Result<B> second, Result<C> third) {
        if (first.isFailure()) {
            return Result.failure(first.getFailure());
        }
        if (second.isFailure()) {
            return Result.failure(second.getFailure());
        }
        if (third.isFailure()) {
            return Result.failure(third.getFailure());
        }
        return Result.success(Tuple3.of(first.getValue(), second.getValue(), third.getValue()));
    }

    /**
     * Succeeds with both values, or fails with the failures of every failing operand.
     */
    public static <A, B> Result<Tuple2<A, B>> combineAll(Result<A> first, Result<B> second) {
        FailureBuilder failures = new FailureBuilder()
                .appendOnFailure(first)
                .appendOnFailure(second);
        if (failures.hasFailures()) {
            return Result.failure(failures.build());
        }
        return Result.success(Tuple2.of(first.getValue(), second.getValue()));
    }

    public static <A, B, C> Result<Tuple3<A, B, C>> combineAll(Result<A> first, Result<B> second, Result<C> third) {
        FailureBuilder failures = new FailureBuilder()
                .appendOnFailure(first)
                .appendOnFailure(second)
                .appendOnFailure(third);
        if (failures.hasFailures()) {
            return Result.failure(failures.build());
        }
        return Result.success(Tuple3.of(first.getValue(), second.getValue(), third.getValue()));
    }

    // === Options inside results ===

    /**
     * Unwraps the option inside a successful result, failing with {@link Option#NONE_FAILURE}
     * if it is absent.
     */
    public static <T> Result<T> ensureSome(Result<Option<T>> result) {
        return ensureSome(result, Option.NONE_FAILURE);
    }

    public static <T> Result<T> ensureSome(Result<Option<T>> result, Failure failureIfNone) {
        Objects.requireNonNull(failureIfNone, "failureIfNone must not be null");
        return result.bind(option -> option.toResult(failureIfNone));
    }

    public static <T> UnitResult ensureNone(Result<Option<T>> result) {
        return ensureNone(result, Option.SOME_FAILURE);
    }

    public static <T> UnitResult ensureNone(Result<Option<T>> result, Failure failureIfSome) {
        Objects.requireNonNull(failureIfSome, "failureIfSome must not be null");
        return result.match(option -> option.ensureNone(failureIfSome), UnitResult::failure);
    }

    // === Lifting possibly-null values ===

    public static <T> Result<T> ensureNotNull(T value) {
        return ensureNotNull(value, GeneralChecks.NULL);
    }

    public static <T> Result<T> ensureNotNull(T value, Failure failureIfNull) {
        Objects.requireNonNull(failureIfNull, "failureIfNull must not be null");
        return value == null ? Result.failure(failureIfNull) : Result.success(value);
    }

    public static Result<String> ensureNotNullOrEmpty(String value) {
        return ensureNotNullOrEmpty(value, null);
    }

    /**
     * Fails with {@code failure} if {@code value} is null or empty. When {@code failure} is
     * null, a null value fails with the general null failure and an empty one with the
     * empty-string failure.
     */
    public static Result<String> ensureNotNullOrEmpty(String value, Failure failure) {
        if (value == null) {
            return Result.failure(failure != null ? failure : GeneralChecks.NULL);
        }
        if (value.isEmpty()) {
            return Result.failure(failure != null ? failure : StringChecks.EMPTY);
        }
        return Result.success(value);
    }

    public static Result<String> ensureNotNullOrBlank(String value) {
        return ensureNotNullOrBlank(value, null);
    }

    /**
     * Like {@link #ensureNotNullOrEmpty(String, Failure)}, also rejecting whitespace-only
     * strings.
     */
    public static Result<String> ensureNotNullOrBlank(String value, Failure failure) {
        if (value == null) {
            return Result.failure(failure != null ? failure : GeneralChecks.NULL);
        }
        if (value.isBlank()) {
            return Result.failure(failure != null ? failure : StringChecks.EMPTY);
        }
        return Result.success(value);
    }

    /**
     * Succeeds only if {@code value} is null.
     */
    public static UnitResult ensureNull(Object value) {
        return ensureNull(value, GeneralChecks.NOT_NULL);
    }

    public static UnitResult ensureNull(Object value, Failure failureIfPresent) {
        Objects.requireNonNull(failureIfPresent, "failureIfPresent must not be null");
        return value == null ? UnitResult.success() : UnitResult.failure(failureIfPresent);
    }
}
