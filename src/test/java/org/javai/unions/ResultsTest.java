package org.javai.unions;

import org.javai.unions.check.GeneralChecks;
import org.javai.unions.check.StringChecks;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ResultsTest {

    private final Failure a = Failure.validation("A", "a");
    private final Failure b = Failure.validation("B", "b");

    @Test
    void sequence_returnsFirstFailure() {
        Result<List<Integer>> result = Results.sequence(List.of(
                Result.success(1), Result.<Integer>failure(a), Result.<Integer>failure(b)));

        assertThat(result.getFailure()).isSameAs(a);
    }

    @Test
    void sequence_allSucceed_collectsValuesInOrder() {
        assertThat(Results.sequence(List.of(Result.success(1), Result.success(2))))
                .isEqualTo(Result.success(List.of(1, 2)));
    }

    @Test
    void collectAll_reportsEveryFailure() {
        Result<List<Integer>> result = Results.collectAll(List.of(
                Result.success(1), Result.<Integer>failure(a), Result.<Integer>failure(b)));

        assertThat(result.getFailure().errors()).containsExactly(a, b);
    }

    @Test
    void collectAll_singleFailure_matchesSequence() {
        List<Result<Integer>> results = List.of(Result.success(1), Result.<Integer>failure(a));

        assertThat(Results.collectAll(results).getFailure()).isEqualTo(Results.sequence(results).getFailure());
    }

    @Test
    void collectAll_failureCountIndependentOfOrder() {
        List<Result<Integer>> forward = List.of(Result.<Integer>failure(a), Result.success(1), Result.<Integer>failure(b));
        List<Result<Integer>> backward = List.of(Result.<Integer>failure(b), Result.success(1), Result.<Integer>failure(a));

        assertThat(Results.collectAll(forward).getFailure().errors()).hasSize(2);
        assertThat(Results.collectAll(backward).getFailure().errors()).hasSize(2);
    }

    @Test
    void traverse_stopsAtFirstFailure() {
        AtomicInteger calls = new AtomicInteger();

        Result<List<Integer>> result = Results.traverse(List.of("1", "x", "y"), s -> {
            calls.incrementAndGet();
            return s.matches("\\d") ? Result.success(Integer.parseInt(s)) : Result.<Integer>failure("not a digit: " + s);
        });

        assertThat(result.getFailure().message()).isEqualTo("not a digit: x");
        assertThat(calls).hasValue(2);
    }

    @Test
    void partition_keepsBothSides() {
        Results.Partition<Integer> partition = Results.partition(List.of(
                Result.success(1), Result.<Integer>failure(a), Result.success(2)));

        assertThat(partition.successes()).containsExactly(1, 2);
        assertThat(partition.failures()).containsExactly(a);
        assertThat(Results.chooseSuccesses(List.of(Result.success(1), Result.<Integer>failure(a)))).containsExactly(1);
        assertThat(Results.chooseFailures(List.of(Result.success(1), Result.<Integer>failure(a)))).containsExactly(a);
    }

    @Test
    void combine_failsFastInArgumentOrder() {
        assertThat(Results.combine(Result.success("x"), Result.success(1)))
                .isEqualTo(Result.success(Tuple2.of("x", 1)));
        assertThat(Results.combine(Result.<String>failure(a), Result.<Integer>failure(b)).getFailure()).isSameAs(a);
        assertThat(Results.combine(Result.success(1), Result.success(2), Result.<Integer>failure(b)).getFailure())
                .isSameAs(b);
    }

    @Test
    void combineAll_accumulatesEveryFailingOperand() {
        Result<Tuple3<String, Integer, Boolean>> result = Results.combineAll(
                Result.<String>failure(a), Result.success(1), Result.<Boolean>failure(b));

        assertThat(result.getFailure().errors()).containsExactly(a, b);
        assertThat(Results.combineAll(Result.success(1), Result.success(2)))
                .isEqualTo(Result.success(Tuple2.of(1, 2)));
    }

    @Test
    void ensureSome_unwrapsPresentOption() {
        assertThat(Results.ensureSome(Result.success(Option.some(3)))).isEqualTo(Result.success(3));
        assertThat(Results.ensureSome(Result.success(Option.<Integer>none())).getFailure())
                .isEqualTo(Option.NONE_FAILURE);
        assertThat(Results.ensureSome(Result.<Option<Integer>>failure(a)).getFailure()).isSameAs(a);
    }

    @Test
    void ensureNone_succeedsOnlyForAbsentOption() {
        assertThat(Results.ensureNone(Result.success(Option.none())).isSuccess()).isTrue();
        assertThat(Results.ensureNone(Result.success(Option.some(1))).getFailure()).isEqualTo(Option.SOME_FAILURE);
        assertThat(Results.ensureNone(Result.<Option<Integer>>failure(a)).getFailure()).isSameAs(a);
    }

    @Test
    void ensureNotNull_liftsNullableValues() {
        assertThat(Results.ensureNotNull("x")).isEqualTo(Result.success("x"));
        assertThat(Results.ensureNotNull(null).getFailure()).isEqualTo(GeneralChecks.NULL);
        assertThat(Results.ensureNotNull(null, a).getFailure()).isSameAs(a);
    }

    @Test
    void ensureNotNullOrEmpty_distinguishesNullFromEmpty() {
        assertThat(Results.ensureNotNullOrEmpty(null).getFailure()).isEqualTo(GeneralChecks.NULL);
        assertThat(Results.ensureNotNullOrEmpty("").getFailure()).isEqualTo(StringChecks.EMPTY);
        assertThat(Results.ensureNotNullOrEmpty(" ")).isEqualTo(Result.success(" "));
        assertThat(Results.ensureNotNullOrEmpty("", a).getFailure()).isSameAs(a);
    }

    @Test
    void ensureNotNullOrBlank_rejectsWhitespace() {
        assertThat(Results.ensureNotNullOrBlank("  ").getFailure()).isEqualTo(StringChecks.EMPTY);
        assertThat(Results.ensureNotNullOrBlank("x")).isEqualTo(Result.success("x"));
    }

    @Test
    void ensureNull_succeedsOnlyForNull() {
        assertThat(Results.ensureNull(null).isSuccess()).isTrue();
        assertThat(Results.ensureNull("x").getFailure()).isEqualTo(GeneralChecks.NOT_NULL);
    }
}
