package org.javai.unions;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Represents the outcome of an operation that may fail.
 * Either {@link Ok} containing a non-null value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Two composition families are offered. The short-circuiting family ({@link #map},
 * {@link #bind}, {@link #ensure}, ...) stops at the first failure and never invokes the
 * functions it was given once failed. The accumulating family ({@link #bindAll},
 * {@link #ensureAll}) evaluates both operands and merges every failure through a
 * {@link FailureBuilder}, so the caller sees all problems at once.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Result<Order> order = parseQuantity(form.quantity())
 *     .ensure(q -> q <= stock, Failure.conflict("Stock.Insufficient", "Not enough stock"))
 *     .bind(q -> orders.place(form.sku(), q));
 *
 * return order.match(
 *     o -> Response.created(o.id()),
 *     failure -> Response.badRequest(failure.message()));
 * }</pre>
 *
 * @param <T> The type of the successful value
 * @see UnitResult
 */
public sealed interface Result<T> permits Result.Ok, Result.Fail {

    /**
     * A successful result containing a value.
     *
     * @param value the successful value, never null
     */
    record Ok<T>(T value) implements Result<T> {

        public Ok {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public Failure getFailure() {
            throw new IllegalStateException("Result is not in a failure state.");
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> bind(Function<? super T, ? extends Result<U>> binder) {
            Objects.requireNonNull(binder);
            return Objects.requireNonNull(binder.apply(value), "binder must not return null");
        }

        @Override
        public Result<T> mapFailure(Function<? super Failure, Failure> mapper) {
            return this;
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super Failure, ? extends R> onFailure) {
            Objects.requireNonNull(onSuccess);
            return onSuccess.apply(value);
        }

        @Override
        public Result<T> ensure(Predicate<? super T> predicate, Failure failure) {
            Objects.requireNonNull(predicate);
            Objects.requireNonNull(failure, "failure must not be null");
            return predicate.test(value) ? this : new Fail<>(failure);
        }

        @Override
        public Result<T> recover(Function<? super Failure, ? extends T> recovery) {
            return this;
        }

        @Override
        public Result<T> recoverWith(Function<? super Failure, ? extends Result<T>> recovery) {
            return this;
        }

        @Override
        public String toString() {
            return "Success: " + value;
        }
    }

    /**
     * A failed result containing failure details.
     *
     * @param failure the failure details
     */
    record Fail<T>(Failure failure) implements Result<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public T getValue() {
            throw new ResultFailedException(failure);
        }

        @Override
        public Failure getFailure() {
            return failure;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> Result<U> bind(Function<? super T, ? extends Result<U>> binder) {
            return new Fail<>(failure);
        }

        @Override
        public Result<T> mapFailure(Function<? super Failure, Failure> mapper) {
            Objects.requireNonNull(mapper);
            return new Fail<>(mapper.apply(failure));
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super Failure, ? extends R> onFailure) {
            Objects.requireNonNull(onFailure);
            return onFailure.apply(failure);
        }

        @Override
        public Result<T> ensure(Predicate<? super T> predicate, Failure failure) {
            return this;
        }

        @Override
        public Result<T> recover(Function<? super Failure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }

        @Override
        public Result<T> recoverWith(Function<? super Failure, ? extends Result<T>> recovery) {
            Objects.requireNonNull(recovery);
            return Objects.requireNonNull(recovery.apply(failure), "recovery must not return null");
        }

        @Override
        public String toString() {
            return "Failure: " + failure;
        }
    }

    // Query methods
    boolean isSuccess();
    boolean isFailure();

    // Value extraction

    /**
     * Returns the value. Calling this on a failure is a deliberate crash.
     *
     * @throws ResultFailedException carrying the failure, if this result failed
     */
    T getValue();

    /**
     * Returns the failure.
     *
     * @throws IllegalStateException if this result succeeded
     */
    Failure getFailure();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Result<U> map(Function<? super T, ? extends U> mapper);
    <U> Result<U> bind(Function<? super T, ? extends Result<U>> binder);
    Result<T> mapFailure(Function<? super Failure, Failure> mapper);

    /**
     * Folds the result: exactly one of the two functions is invoked.
     */
    <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super Failure, ? extends R> onFailure);

    /**
     * Keeps a success only if {@code predicate} holds, otherwise fails with {@code failure}.
     * A failure is returned unchanged and the predicate is not evaluated.
     */
    Result<T> ensure(Predicate<? super T> predicate, Failure failure);

    // Recovery
    Result<T> recover(Function<? super Failure, ? extends T> recovery);
    Result<T> recoverWith(Function<? super Failure, ? extends Result<T>> recovery);

    /**
     * Runs a valueless step on the value; a failing step replaces this result, a succeeding
     * one keeps the original value.
     */
    default Result<T> bindUnit(Function<? super T, UnitResult> step) {
        Objects.requireNonNull(step);
        if (isFailure()) {
            return this;
        }
        UnitResult next = step.apply(getValue());
        return next.isFailure() ? failure(next.getFailure()) : this;
    }

    // Accumulation

    /**
     * Continues with {@code next} when this result succeeded; otherwise reports the failures
     * of both operands together.
     */
    default <U> Result<U> bindAll(Result<U> next) {
        Objects.requireNonNull(next, "next must not be null");
        if (isSuccess()) {
            return next;
        }
        return failure(new FailureBuilder()
                .append(getFailure())
                .appendOnFailure(next)
                .build());
    }

    /**
     * Keeps this result when {@code next} succeeded; otherwise reports the failures of both
     * operands together.
     */
    default Result<T> bindAll(UnitResult next) {
        Objects.requireNonNull(next, "next must not be null");
        if (next.isSuccess()) {
            return this;
        }
        return failure(new FailureBuilder()
                .appendOnFailure(this)
                .append(next.getFailure())
                .build());
    }

    /**
     * Accumulating counterpart of {@link #ensure}: when {@code condition} does not hold,
     * {@code failure} is added to any failure this result already carries.
     */
    default Result<T> ensureAll(boolean condition, Failure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        if (condition) {
            return this;
        }
        return failure(new FailureBuilder()
                .appendOnFailure(this)
                .append(failure)
                .build());
    }

    /**
     * Starts a chain of named checks over the value.
     * The returned builder must be collapsed with {@link EnsureBuilder#build()} in the same
     * expression.
     */
    default EnsureBuilder<T> ensureThat() {
        return EnsureBuilder.from(this);
    }

    // Observers

    default Result<T> onSuccess(Consumer<? super T> action) {
        Objects.requireNonNull(action);
        if (isSuccess()) {
            action.accept(getValue());
        }
        return this;
    }

    default Result<T> onFailure(Consumer<? super Failure> action) {
        Objects.requireNonNull(action);
        if (isFailure()) {
            action.accept(getFailure());
        }
        return this;
    }

    default Result<T> onEither(Consumer<? super T> onSuccess, Consumer<? super Failure> onFailure) {
        Objects.requireNonNull(onSuccess);
        Objects.requireNonNull(onFailure);
        if (isSuccess()) {
            onSuccess.accept(getValue());
        } else {
            onFailure.accept(getFailure());
        }
        return this;
    }

    // Conversions

    /**
     * Converts to an option. The failure, if any, is discarded.
     */
    default Option<T> toOption() {
        return isSuccess() ? Option.some(getValue()) : Option.none();
    }

    default Option<Failure> failureOption() {
        return isFailure() ? Option.some(getFailure()) : Option.none();
    }

    default UnitResult discardValue() {
        return isSuccess() ? UnitResult.success() : UnitResult.failure(getFailure());
    }

    // Escape hatches

    /**
     * Returns the value, or throws the exception {@code exceptionSelector} builds from the
     * failure.
     */
    default T getValueOrThrow(Function<? super Failure, ? extends RuntimeException> exceptionSelector) {
        Objects.requireNonNull(exceptionSelector);
        if (isSuccess()) {
            return getValue();
        }
        throw exceptionSelector.apply(getFailure());
    }

    /**
     * Does nothing on success; throws a {@link ResultFailedException} on failure.
     */
    default void throwIfFailure() {
        throwIfFailure(ResultFailedException::new);
    }

    default void throwIfFailure(Function<? super Failure, ? extends RuntimeException> exceptionSelector) {
        Objects.requireNonNull(exceptionSelector);
        if (isFailure()) {
            throw exceptionSelector.apply(getFailure());
        }
    }

    // Static factories

    static <T> Result<T> success(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> failure(Failure failure) {
        return new Fail<>(failure);
    }

    /**
     * Creates a failed result with a general failure carrying only a message.
     */
    static <T> Result<T> failure(String message) {
        return new Fail<>(Failure.of(message));
    }

    /**
     * Starts a chain of named checks over a bare value.
     *
     * @see #ensureThat()
     */
    static <T> EnsureBuilder<T> validate(T value) {
        return EnsureBuilder.from(success(value));
    }
}
