package org.javai.unions;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Collection-level operations over {@link Option}.
 *
 * <p>{@link #sequence} and {@link #traverse} short-circuit on the first absent option;
 * {@link #partition}, {@link #choose} and {@link #chooseMap} keep whatever is present.
 */
public final class Options {

    private Options() {
        // Utility class
    }

    /**
     * Present values of an option collection, with the number of absent ones.
     *
     * @param values the present values in encounter order
     * @param noneCount how many options were absent
     */
    public record Partition<T>(List<T> values, int noneCount) {

        public Partition {
            values = List.copyOf(values);
        }
    }

    /**
     * Turns a collection of options into an option of a list: present only if every element
     * is present. Stops at the first absent element.
     */
    public static <T> Option<List<T>> sequence(Iterable<Option<T>> options) {
        Objects.requireNonNull(options, "options must not be null");
        List<T> values = new ArrayList<>();
        for (Option<T> option : options) {
            if (option.isNone()) {
                return Option.none();
            }
            values.add(option.get());
        }
        return Option.some(List.copyOf(values));
    }

    /**
     * Maps each element and sequences the results. {@code selector} is not invoked for the
     * elements after the first absent result.
     */
    public static <S, T> Option<List<T>> traverse(Iterable<S> source, Function<? super S, Option<T>> selector) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
        List<T> values = new ArrayList<>();
        for (S item : source) {
            Option<T> option = selector.apply(item);
            if (option.isNone()) {
                return Option.none();
            }
            values.add(option.get());
        }
        return Option.some(List.copyOf(values));
    }

    public static <T> Partition<T> partition(Iterable<Option<T>> options) {
        Objects.requireNonNull(options, "options must not be null");
        List<T> values = new ArrayList<>();
        int noneCount = 0;
        for (Option<T> option : options) {
            if (option.isSome()) {
                values.add(option.get());
            } else {
                noneCount++;
            }
        }
        return new Partition<>(values, noneCount);
    }

    /**
     * Keeps only the present values.
     */
    public static <T> List<T> choose(Iterable<Option<T>> options) {
        return partition(options).values();
    }

    /**
     * Maps each element and keeps only the present results.
     */
    public static <S, T> List<T> chooseMap(Iterable<S> source, Function<? super S, Option<T>> selector) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
        List<T> values = new ArrayList<>();
        for (S item : source) {
            selector.apply(item).onSome(values::add);
        }
        return List.copyOf(values);
    }

    public static <A, B> Option<Tuple2<A, B>> zip(Option<A> first, Option<B> second) {
        if (first.isNone() || second.isNone()) {
            return Option.none();
        }
        return Option.some(Tuple2.of(first.get(), second.get()));
    }

    public static <A, B, C> Option<Tuple3<A, B, C>> zip(Option<A> first, Option<B> second, Option<C> third) {
        if (first.isNone() || second.isNone() || third.isNone()) {
            return Option.none();
        }
        return Option.some(Tuple3.of(first.get(), second.get(), third.get()));
    }

    public static <T> Option<T> flatten(Option<Option<T>> nested) {
        return nested.bind(Function.identity());
    }

    // === Presence as result ===

    public static <T> Option<T> firstOrNone(Iterable<T> source) {
        Objects.requireNonNull(source, "source must not be null");
        Iterator<T> iterator = source.iterator();
        return iterator.hasNext() ? Option.ofNullable(iterator.next()) : Option.none();
    }

    /**
     * Returns the first element matching {@code predicate}, or none if there is no match.
     */
    public static <T> Option<T> firstOrNone(Iterable<T> source, Predicate<? super T> predicate) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        for (T item : source) {
            if (predicate.test(item)) {
                return Option.ofNullable(item);
            }
        }
        return Option.none();
    }

    public static <T> Option<T> lastOrNone(Iterable<T> source) {
        return lastOrNone(source, item -> true);
    }

    /**
     * Returns the last element matching {@code predicate}, or none if there is no match.
     * Lists are scanned from the end.
     */
    public static <T> Option<T> lastOrNone(Iterable<T> source, Predicate<? super T> predicate) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(predicate, "predicate must not be null");
        if (source instanceof List<T> list) {
            ListIterator<T> iterator = list.listIterator(list.size());
            while (iterator.hasPrevious()) {
                T item = iterator.previous();
                if (predicate.test(item)) {
                    return Option.ofNullable(item);
                }
            }
            return Option.none();
        }
        T last = null;
        for (T item : source) {
            if (predicate.test(item)) {
                last = item;
            }
        }
        return Option.ofNullable(last);
    }
}
