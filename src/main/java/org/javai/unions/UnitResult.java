package org.javai.unions;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The outcome of an operation that produces no value.
 * Either {@link Ok}, carrying nothing at all, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Composition mirrors {@link Result}: {@link #bind}, {@link #ensure} and friends
 * short-circuit on the first failure, while {@link #bindAll} and {@link #ensureAll}
 * accumulate. {@link #withValue} promotes a success into a value-carrying result.
 */
public sealed interface UnitResult permits UnitResult.Ok, UnitResult.Fail {

    /**
     * A successful result.
     */
    record Ok() implements UnitResult {

        private static final Ok INSTANCE = new Ok();

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Failure getFailure() {
            throw new IllegalStateException("Result is not in a failure state.");
        }

        @Override
        public String toString() {
            return "Success";
        }
    }

    /**
     * A failed result containing failure details.
     *
     * @param failure the failure details
     */
    record Fail(Failure failure) implements UnitResult {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Failure getFailure() {
            return failure;
        }

        @Override
        public String toString() {
            return "Failure: " + failure;
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the failure.
     *
     * @throws IllegalStateException if this result succeeded
     */
    Failure getFailure();

    default Option<Failure> failureOption() {
        return isFailure() ? Option.some(getFailure()) : Option.none();
    }

    // Short-circuiting composition

    default UnitResult bind(Supplier<UnitResult> next) {
        Objects.requireNonNull(next);
        return isFailure() ? this : Objects.requireNonNull(next.get(), "next must not return null");
    }

    default <U> Result<U> bindValue(Supplier<? extends Result<U>> next) {
        Objects.requireNonNull(next);
        if (isFailure()) {
            return Result.failure(getFailure());
        }
        return Objects.requireNonNull(next.get(), "next must not return null");
    }

    /**
     * Keeps a success only if {@code predicate} holds, otherwise fails with {@code failure}.
     * A failure is returned unchanged and the predicate is not evaluated.
     */
    default UnitResult ensure(BooleanSupplier predicate, Failure failure) {
        Objects.requireNonNull(predicate);
        Objects.requireNonNull(failure, "failure must not be null");
        if (isFailure()) {
            return this;
        }
        return predicate.getAsBoolean() ? this : failure(failure);
    }

    default UnitResult mapFailure(Function<? super Failure, Failure> mapper) {
        Objects.requireNonNull(mapper);
        return isFailure() ? failure(mapper.apply(getFailure())) : this;
    }

    default <R> R match(Supplier<? extends R> onSuccess, Function<? super Failure, ? extends R> onFailure) {
        Objects.requireNonNull(onSuccess);
        Objects.requireNonNull(onFailure);
        return isSuccess() ? onSuccess.get() : onFailure.apply(getFailure());
    }

    // Accumulation

    default UnitResult bindAll(UnitResult next) {
        Objects.requireNonNull(next, "next must not be null");
        if (next.isSuccess()) {
            return this;
        }
        return failure(new FailureBuilder()
                .appendOnFailure(this)
                .append(next.getFailure())
                .build());
    }

    default <U> Result<U> bindAll(Result<U> next) {
        Objects.requireNonNull(next, "next must not be null");
        if (isSuccess()) {
            return next;
        }
        return Result.failure(new FailureBuilder()
                .append(getFailure())
                .appendOnFailure(next)
                .build());
    }

    default UnitResult ensureAll(boolean condition, Failure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        if (condition) {
            return this;
        }
        return failure(new FailureBuilder()
                .appendOnFailure(this)
                .append(failure)
                .build());
    }

    // Observers

    default UnitResult onSuccess(Runnable action) {
        Objects.requireNonNull(action);
        if (isSuccess()) {
            action.run();
        }
        return this;
    }

    default UnitResult onFailure(Consumer<? super Failure> action) {
        Objects.requireNonNull(action);
        if (isFailure()) {
            action.accept(getFailure());
        }
        return this;
    }

    default UnitResult onEither(Runnable onSuccess, Consumer<? super Failure> onFailure) {
        Objects.requireNonNull(onSuccess);
        Objects.requireNonNull(onFailure);
        if (isSuccess()) {
            onSuccess.run();
        } else {
            onFailure.accept(getFailure());
        }
        return this;
    }

    // Promotion

    /**
     * Promotes a success into a result carrying {@code value}; a failure keeps its failure.
     */
    default <T> Result<T> withValue(T value) {
        return isSuccess() ? Result.success(value) : Result.failure(getFailure());
    }

    /**
     * Like {@link #withValue(Object)}, but only invokes {@code valueFactory} on success.
     */
    default <T> Result<T> withValueFrom(Supplier<? extends T> valueFactory) {
        Objects.requireNonNull(valueFactory);
        return isSuccess() ? Result.success(valueFactory.get()) : Result.failure(getFailure());
    }

    // Escape hatches

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

    static UnitResult success() {
        return Ok.INSTANCE;
    }

    static UnitResult failure(Failure failure) {
        return new Fail(failure);
    }

    /**
     * Creates a failed result with a general failure carrying only a message.
     */
    static UnitResult failure(String message) {
        return new Fail(Failure.of(message));
    }
}
