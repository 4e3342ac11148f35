package org.javai.unions.check;

import java.util.Objects;
import java.util.function.Predicate;
import org.javai.unions.Failure;

record PredicateCheck<T>(Predicate<? super T> predicate, Failure failure) implements Check<T> {

    PredicateCheck {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
    }

    @Override
    public boolean test(T value) {
        return predicate.test(value);
    }
}
