package org.javai.unions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates failures for one validation episode and collapses them into a single
 * {@link Failure}.
 *
 * <p>Appending an aggregate splices its children in, so the built failure is never a
 * nested aggregate. The outcome of {@link #tryBuild()} depends on how many failures were
 * appended: none yields an empty option, one yields that failure, more yield an aggregate
 * in append order.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * FailureBuilder failures = new FailureBuilder()
 *     .appendOnFailure(validateName(form.name()))
 *     .appendOnFailure(validateAge(form.age()));
 *
 * UnitResult checked = failures.tryBuild()
 *     .match(UnitResult::failure, UnitResult::success);
 * }</pre>
 *
 * <p>Instances are mutable and not thread-safe; create one per episode.
 */
public final class FailureBuilder {

    private final List<Failure> failures = new ArrayList<>();

    public FailureBuilder append(Failure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        if (failure.isAggregate()) {
            failures.addAll(failure.errors());
        } else {
            failures.add(failure);
        }
        return this;
    }

    public FailureBuilder appendAll(Iterable<Failure> failures) {
        Objects.requireNonNull(failures, "failures must not be null");
        for (Failure failure : failures) {
            append(failure);
        }
        return this;
    }

    /**
     * Appends the failure of {@code result}, if it has one.
     */
    public FailureBuilder appendOnFailure(Result<?> result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.isFailure()) {
            append(result.getFailure());
        }
        return this;
    }

    /**
     * Appends the failure of {@code result}, if it has one.
     */
    public FailureBuilder appendOnFailure(UnitResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result.isFailure()) {
            append(result.getFailure());
        }
        return this;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int size() {
        return failures.size();
    }

    /**
     * Collapses the accumulated failures.
     *
     * @return none when nothing was appended, the single failure, or an aggregate
     */
    public Option<Failure> tryBuild() {
        return switch (failures.size()) {
            case 0 -> Option.none();
            case 1 -> Option.some(failures.get(0));
            default -> Option.some(Failure.aggregate(failures));
        };
    }

    /**
     * Collapses the accumulated failures, which must not be empty.
     *
     * @throws NoFailuresAccumulatedException if nothing was appended
     */
    public Failure build() {
        if (failures.isEmpty()) {
            throw new NoFailuresAccumulatedException();
        }
        return tryBuild().get();
    }
}
