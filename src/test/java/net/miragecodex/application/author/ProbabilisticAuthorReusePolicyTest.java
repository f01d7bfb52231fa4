package net.miragecodex.application.author;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;
import org.junit.jupiter.api.Test;

class ProbabilisticAuthorReusePolicyTest {

    @Test
    void should_AlwaysReuse_When_ProbabilityIsOne() {
        ProbabilisticAuthorReusePolicy policy = new ProbabilisticAuthorReusePolicy(1.0, new Random(1));

        for (int i = 0; i < 50; i++) {
            assertThat(policy.shouldAttemptReuse("mystery")).isTrue();
        }
    }

    @Test
    void should_NeverReuse_When_ProbabilityIsZero() {
        ProbabilisticAuthorReusePolicy policy = new ProbabilisticAuthorReusePolicy(0.0, new Random(1));

        for (int i = 0; i < 50; i++) {
            assertThat(policy.shouldAttemptReuse("mystery")).isFalse();
        }
    }

    @Test
    void should_RejectProbability_When_OutsideUnitInterval() {
        assertThatThrownBy(() -> new ProbabilisticAuthorReusePolicy(1.5, new Random()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
