package org.javai.unions;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class OptionTest {

    @Test
    void some_isPresent() {
        Option<Integer> option = Option.some(5);

        assertThat(option.isSome()).isTrue();
        assertThat(option.isNone()).isFalse();
        assertThat(option.get()).isEqualTo(5);
    }

    @Test
    void none_isAbsent() {
        Option<Integer> option = Option.none();

        assertThat(option.isSome()).isFalse();
        assertThat(option.isNone()).isTrue();
    }

    @Test
    void some_null_isRejected() {
        assertThatThrownBy(() -> Option.some(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void get_onNone_throws() {
        assertThatThrownBy(() -> Option.none().get())
                .isInstanceOf(NoSuchElementException.class)
                .hasMessage("Option is None");
    }

    @Test
    void ofNullable_mapsNullToNone() {
        assertThat(Option.ofNullable(null)).isEqualTo(Option.none());
        assertThat(Option.ofNullable("x")).isEqualTo(Option.some("x"));
    }

    @Test
    void map_onSome_transformsValue() {
        assertThat(Option.some(5).map(x -> x * 2)).isEqualTo(Option.some(10));
    }

    @Test
    void map_onNone_staysNoneWithoutInvokingMapper() {
        AtomicInteger calls = new AtomicInteger();

        Option<Integer> mapped = Option.<Integer>none().map(x -> calls.incrementAndGet());

        assertThat(mapped.isNone()).isTrue();
        assertThat(calls).hasValue(0);
    }

    @Test
    void bind_onNone_neverInvokesBinder() {
        AtomicInteger calls = new AtomicInteger();

        Option<Integer> bound = Option.<Integer>none().bind(x -> {
            calls.incrementAndGet();
            return Option.some(x * 2);
        });

        assertThat(bound).isEqualTo(Option.none());
        assertThat(calls).hasValue(0);
    }

    @Test
    void bind_onSome_returnsBinderResult() {
        assertThat(Option.some(3).bind(x -> Option.some(x + 1))).isEqualTo(Option.some(4));
        assertThat(Option.some(3).bind(x -> Option.none()).isNone()).isTrue();
    }

    @Test
    void filter_keepsValueOnlyWhenPredicateHolds() {
        assertThat(Option.some(4).filter(x -> x % 2 == 0)).isEqualTo(Option.some(4));
        assertThat(Option.some(3).filter(x -> x % 2 == 0).isNone()).isTrue();
    }

    @Test
    void match_invokesExactlyOneBranch() {
        assertThat(Option.some("a").match(s -> "some " + s, () -> "none")).isEqualTo("some a");
        assertThat(Option.<String>none().match(s -> "some " + s, () -> "none")).isEqualTo("none");
    }

    @Test
    void getOrElse_returnsDefaultOnlyWhenAbsent() {
        assertThat(Option.some(1).getOrElse(9)).isEqualTo(1);
        assertThat(Option.<Integer>none().getOrElse(9)).isEqualTo(9);
        assertThat(Option.<Integer>none().getOrElseGet(() -> 7)).isEqualTo(7);
    }

    @Test
    void orElse_supplierIsLazy() {
        AtomicInteger calls = new AtomicInteger();

        Option<Integer> kept = Option.some(1).orElse(() -> {
            calls.incrementAndGet();
            return Option.some(2);
        });

        assertThat(kept).isEqualTo(Option.some(1));
        assertThat(calls).hasValue(0);
        assertThat(Option.<Integer>none().orElse(Option.some(2))).isEqualTo(Option.some(2));
    }

    @Test
    void observers_runOnMatchingStateAndReturnSameOption() {
        List<String> seen = new ArrayList<>();
        Option<String> some = Option.some("v");

        Option<String> returned = some.onSome(seen::add).onNone(() -> seen.add("none"));
        Option.<String>none().onEither(seen::add, () -> seen.add("none"));

        assertThat(returned).isSameAs(some);
        assertThat(seen).containsExactly("v", "none");
    }

    @Test
    void contains_comparesPresentValue() {
        assertThat(Option.some("a").contains("a")).isTrue();
        assertThat(Option.some("a").contains("b")).isFalse();
        assertThat(Option.<String>none().contains("a")).isFalse();
    }

    @Test
    void toResult_onSome_roundTripsThroughToOption() {
        Failure failure = Failure.notFound("missing");

        assertThat(Option.some(5).toResult(failure).toOption()).isEqualTo(Option.some(5));
    }

    @Test
    void toResult_onNone_failsWithGivenFailure() {
        Failure failure = Failure.notFound("missing");

        Result<Integer> result = Option.<Integer>none().toResult(failure);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getFailure()).isSameAs(failure);
    }

    @Test
    void toResult_onNoneWithoutFailure_usesDefault() {
        assertThat(Option.none().toResult().getFailure()).isEqualTo(Option.NONE_FAILURE);
        assertThat(Option.NONE_FAILURE.code()).isEqualTo("OptionError.None");
    }

    @Test
    void ensureNone_succeedsOnlyWhenAbsent() {
        assertThat(Option.none().ensureNone().isSuccess()).isTrue();
        assertThat(Option.some(1).ensureNone().getFailure()).isEqualTo(Option.SOME_FAILURE);
    }

    @Test
    void optionalBridge_roundTrips() {
        assertThat(Option.fromOptional(Optional.of("x"))).isEqualTo(Option.some("x"));
        assertThat(Option.fromOptional(Optional.empty()).isNone()).isTrue();
        assertThat(Option.some("x").toOptional()).contains("x");
        assertThat(Option.none().toOptional()).isEmpty();
    }

    @Test
    void toString_rendersState() {
        assertThat(Option.some(1).toString()).isEqualTo("Some(1)");
        assertThat(Option.none().toString()).isEqualTo("None");
    }
}
