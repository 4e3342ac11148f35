package org.javai.unions;

import org.javai.unions.check.NumericChecks;
import org.javai.unions.check.StringChecks;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class EnsureBuilderTest {

    @Test
    void build_allChecksHold_succeeds() {
        Result<Integer> age = Result.validate(30)
                .check(NumericChecks.nonNegative())
                .check(NumericChecks.lessThan(150))
                .build();

        assertThat(age).isEqualTo(Result.success(30));
    }

    @Test
    void build_firstFailingCheckWins() {
        Result<String> name = Result.validate("")
                .check(StringChecks.notEmpty())
                .check(StringChecks.hasMinLength(3))
                .build();

        assertThat(name.getFailure()).isEqualTo(StringChecks.EMPTY);
    }

    @Test
    void check_withExplicitFailure_reportsIt() {
        Failure tooOld = Failure.validation("Age.TooOld", "Age must be below 150");

        Result<Integer> age = Result.validate(200).check(x -> x < 150, tooOld).build();

        assertThat(age.getFailure()).isSameAs(tooOld);
    }

    @Test
    void ensureThat_onFailure_keepsOriginalFailureAndSkipsChecks() {
        AtomicInteger evaluations = new AtomicInteger();
        Failure original = Failure.notFound("missing");

        Result<Integer> result = Result.<Integer>failure(original)
                .ensureThat()
                .check(x -> evaluations.incrementAndGet() > 0, Failure.of("never"))
                .build();

        assertThat(result.getFailure()).isSameAs(original);
        assertThat(evaluations).hasValue(0);
    }

    @Test
    void check_afterDisqualification_isNoOp() {
        AtomicInteger evaluations = new AtomicInteger();

        EnsureBuilder<Integer> builder = Result.validate(5)
                .check(x -> x > 10, Failure.of("small"))
                .check(x -> evaluations.incrementAndGet() > 0, Failure.of("other"));

        assertThat(builder.isEligible()).isFalse();
        assertThat(builder.build().getFailure().message()).isEqualTo("small");
        assertThat(evaluations).hasValue(0);
    }

    @Test
    void withFailure_overridesDefault() {
        Failure custom = Failure.validation("Name.Short", "Name too short");

        Result<String> name = Result.validate("ab")
                .check(StringChecks.hasMinLength(3).withFailure(custom))
                .build();

        assertThat(name.getFailure()).isSameAs(custom);
    }

    @Test
    void shortcuts_collapseThenContinue() {
        assertThat(Result.validate("abc").check(StringChecks.notEmpty()).map(String::length))
                .isEqualTo(Result.success(3));
        assertThat(Result.validate("7").check(StringChecks.matches("^\\d$")).bind(s -> Result.success(Integer.valueOf(s))))
                .isEqualTo(Result.success(7));
    }

    @Test
    void bindAll_accumulatesBuilderFailureWithNext() {
        Result<String> result = Result.validate("")
                .check(StringChecks.notEmpty())
                .bindAll(Result.<String>failure("other"));

        assertThat(result.getFailure().errors()).containsExactly(StringChecks.EMPTY, Failure.of("other"));
    }
}
