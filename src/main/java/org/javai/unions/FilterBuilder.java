package org.javai.unions;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A value passing through a chain of named checks on its way back into an {@link Option}.
 *
 * <p>The builder is in one of two states. While <em>eligible</em> it carries the value and
 * each {@link #check} evaluates its predicate; the first predicate that does not hold moves
 * it to <em>disqualified</em>, after which every further check is a no-op. {@link #build()}
 * collapses an eligible builder to {@code Some(value)} and a disqualified one to
 * {@code None}.
 *
 * <p>Obtain a builder from {@link Option#filterBuilder()} or {@link Option#filterThat(Object)}
 * and collapse it in the same expression:</p>
 * <pre>{@code
 * Option<String> username = Option.filterThat(input)
 *     .check(StringChecks.notBlank())
 *     .check(StringChecks.hasMaxLength(32))
 *     .build();
 * }</pre>
 *
 * <p>A builder is a transient view over the original value. Do not store it in a field,
 * return it, or pass it as an argument.
 *
 * @param <T> The type of the value under check
 */
public final class FilterBuilder<T> {

    private final T value;
    private final boolean eligible;

    private FilterBuilder(T value, boolean eligible) {
        this.value = value;
        this.eligible = eligible;
    }

    static <T> FilterBuilder<T> from(Option<T> option) {
        Objects.requireNonNull(option, "option must not be null");
        return option.isSome() ? new FilterBuilder<>(option.get(), true) : new FilterBuilder<>(null, false);
    }

    /**
     * Applies one check. Disqualifies the value if {@code predicate} does not hold;
     * does nothing once already disqualified.
     */
    public FilterBuilder<T> check(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (!eligible || predicate.test(value)) {
            return this;
        }
        return new FilterBuilder<>(null, false);
    }

    /**
     * Returns true if every check so far has held.
     */
    public boolean isEligible() {
        return eligible;
    }

    public Option<T> build() {
        return eligible ? Option.some(value) : Option.none();
    }

    /**
     * Collapses the builder and maps the surviving value.
     */
    public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
        return build().map(mapper);
    }

    /**
     * Collapses the builder and binds the surviving value.
     */
    public <U> Option<U> bind(Function<? super T, ? extends Option<U>> binder) {
        return build().bind(binder);
    }
}
