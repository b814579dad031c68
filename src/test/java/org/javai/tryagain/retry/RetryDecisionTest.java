package org.javai.tryagain.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class RetryDecisionTest {

    @Test
    void retry_exposesDelayAsWaitTime() {
        RetryDecision decision = RetryDecision.Retry.after(Duration.ofSeconds(2));

        assertThat(decision.waitTime()).contains(Duration.ofSeconds(2));
    }

    @Test
    void retry_immediate_hasZeroDelay() {
        assertThat(RetryDecision.Retry.immediate().delay()).isEqualTo(Duration.ZERO);
    }

    @Test
    void retry_rejectsNegativeDelay() {
        assertThatThrownBy(() -> RetryDecision.Retry.after(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void retry_rejectsNullDelay() {
        assertThatThrownBy(() -> new RetryDecision.Retry(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void giveUp_hasNoWaitTime() {
        RetryDecision decision = RetryDecision.GiveUp.because("enough");

        assertThat(decision.waitTime()).isEmpty();
        assertThat(((RetryDecision.GiveUp) decision).reason()).isEqualTo("enough");
    }

    @Test
    void giveUp_reasonIsOptional() {
        assertThat(new RetryDecision.GiveUp().reason()).isNull();
    }

    @Test
    void of_presentWaitTime_retries() {
        assertThat(RetryDecision.of(Optional.of(Duration.ofMillis(300))))
                .isEqualTo(RetryDecision.Retry.after(Duration.ofMillis(300)));
    }

    @Test
    void of_emptyWaitTime_givesUp() {
        assertThat(RetryDecision.of(Optional.empty())).isInstanceOf(RetryDecision.GiveUp.class);
    }
}
