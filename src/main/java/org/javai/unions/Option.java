package org.javai.unions;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A value that may or may not be present.
 * Either {@link Some} holding a non-null value, or {@link None}.
 *
 * <p>Options are immutable. Every combinator returns a new Option; an absent option never
 * exposes a value and its combinators never invoke the functions they are given.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Option<String> email = users.findById(id)
 *     .map(User::email)
 *     .filter(e -> e.endsWith("@example.com"));
 *
 * String greeting = email.match(e -> "Mail sent to " + e, () -> "No address on file");
 * }</pre>
 *
 * @param <T> The type of the present value
 */
public sealed interface Option<T> permits Option.Some, Option.None {

    /**
     * The default failure used when an absent option is converted to a result.
     */
    Failure NONE_FAILURE = Failure.validation("OptionError.None", "The value cannot be none.");

    /**
     * The default failure used when a present option was expected to be absent.
     */
    Failure SOME_FAILURE = Failure.validation("OptionError.Some", "The value cannot be some.");

    /**
     * A present value.
     *
     * @param value the value, never null
     */
    record Some<T>(T value) implements Option<T> {

        public Some {
            Objects.requireNonNull(value, "value must not be null, use Option.none()");
        }

        @Override
        public boolean isSome() {
            return true;
        }

        @Override
        public boolean isNone() {
            return false;
        }

        @Override
        public T get() {
            return value;
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
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Some<>(mapper.apply(value));
        }

        @Override
        public <U> Option<U> bind(Function<? super T, ? extends Option<U>> binder) {
            Objects.requireNonNull(binder);
            return Objects.requireNonNull(binder.apply(value), "binder must not return null");
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSome, Supplier<? extends R> onNone) {
            Objects.requireNonNull(onSome);
            return onSome.apply(value);
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            Objects.requireNonNull(predicate);
            return predicate.test(value) ? this : none();
        }

        @Override
        public Option<T> orElse(Option<T> fallback) {
            return this;
        }

        @Override
        public Option<T> orElse(Supplier<? extends Option<T>> fallback) {
            return this;
        }

        @Override
        public String toString() {
            return "Some(" + value + ")";
        }
    }

    /**
     * An absent value.
     */
    record None<T>() implements Option<T> {

        @Override
        public boolean isSome() {
            return false;
        }

        @Override
        public boolean isNone() {
            return true;
        }

        @Override
        public T get() {
            throw new NoSuchElementException("Option is None");
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
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            return none();
        }

        @Override
        public <U> Option<U> bind(Function<? super T, ? extends Option<U>> binder) {
            return none();
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSome, Supplier<? extends R> onNone) {
            Objects.requireNonNull(onNone);
            return onNone.get();
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            return this;
        }

        @Override
        public Option<T> orElse(Option<T> fallback) {
            return Objects.requireNonNull(fallback, "fallback must not be null");
        }

        @Override
        public Option<T> orElse(Supplier<? extends Option<T>> fallback) {
            Objects.requireNonNull(fallback, "fallback must not be null");
            return fallback.get();
        }

        @Override
        public String toString() {
            return "None";
        }
    }

    // Query methods
    boolean isSome();
    boolean isNone();

    // Value extraction

    /**
     * Returns the value. Calling this on an absent option is a programming error.
     *
     * @throws NoSuchElementException if the option is absent
     */
    T get();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Option<U> map(Function<? super T, ? extends U> mapper);
    <U> Option<U> bind(Function<? super T, ? extends Option<U>> binder);
    Option<T> filter(Predicate<? super T> predicate);

    /**
     * Folds the option: exactly one of the two functions is invoked.
     */
    <R> R match(Function<? super T, ? extends R> onSome, Supplier<? extends R> onNone);

    // Fallbacks
    Option<T> orElse(Option<T> fallback);

    /**
     * Returns this option if present, otherwise the option produced by {@code fallback}.
     * The supplier is only invoked when needed.
     */
    Option<T> orElse(Supplier<? extends Option<T>> fallback);

    // Observers

    default Option<T> onSome(Consumer<? super T> action) {
        Objects.requireNonNull(action);
        if (isSome()) {
            action.accept(get());
        }
        return this;
    }

    default Option<T> onNone(Runnable action) {
        Objects.requireNonNull(action);
        if (isNone()) {
            action.run();
        }
        return this;
    }

    default Option<T> onEither(Consumer<? super T> onSome, Runnable onNone) {
        Objects.requireNonNull(onSome);
        Objects.requireNonNull(onNone);
        if (isSome()) {
            onSome.accept(get());
        } else {
            onNone.run();
        }
        return this;
    }

    /**
     * Returns true if this option holds a value equal to {@code value}.
     */
    default boolean contains(T value) {
        return isSome() && get().equals(value);
    }

    // Conversions

    default Optional<T> toOptional() {
        return isSome() ? Optional.of(get()) : Optional.empty();
    }

    /**
     * Converts to a result, failing with {@link #NONE_FAILURE} when absent.
     */
    default Result<T> toResult() {
        return toResult(NONE_FAILURE);
    }

    default Result<T> toResult(Failure failureIfNone) {
        Objects.requireNonNull(failureIfNone, "failureIfNone must not be null");
        return isSome() ? Result.success(get()) : Result.failure(failureIfNone);
    }

    /**
     * Succeeds only if this option is absent, otherwise fails with {@link #SOME_FAILURE}.
     */
    default UnitResult ensureNone() {
        return ensureNone(SOME_FAILURE);
    }

    default UnitResult ensureNone(Failure failureIfSome) {
        Objects.requireNonNull(failureIfSome, "failureIfSome must not be null");
        return isNone() ? UnitResult.success() : UnitResult.failure(failureIfSome);
    }

    /**
     * Starts a chain of named checks over this option's value.
     * The returned builder must be collapsed with {@link FilterBuilder#build()} in the same
     * expression; it is not a value to store or pass around.
     */
    default FilterBuilder<T> filterBuilder() {
        return FilterBuilder.from(this);
    }

    // Static factories

    static <T> Option<T> some(T value) {
        return new Some<>(value);
    }

    static <T> Option<T> none() {
        return new None<>();
    }

    static <T> Option<T> ofNullable(T value) {
        return value == null ? none() : new Some<>(value);
    }

    static <T> Option<T> fromOptional(Optional<T> optional) {
        Objects.requireNonNull(optional, "optional must not be null");
        return optional.map(Option::some).orElseGet(Option::none);
    }

    /**
     * Starts a chain of named checks over a bare value.
     *
     * @see #filterBuilder()
     */
    static <T> FilterBuilder<T> filterThat(T value) {
        return FilterBuilder.from(some(value));
    }
}
