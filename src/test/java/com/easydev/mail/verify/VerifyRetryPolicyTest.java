package com.easydev.mail.verify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class VerifyRetryPolicyTest {

    @Test
    void backoffDelay_doublesFromBase() {
        final VerifyRetryPolicy policy = new VerifyRetryPolicy(4, 2000);

        assertThat(policy.backoffDelay(1)).isEqualTo(2000);
        assertThat(policy.backoffDelay(2)).isEqualTo(4000);
        assertThat(policy.backoffDelay(3)).isEqualTo(8000);
    }

    @Test
    void backoffDelay_saturates_insteadOfOverflowing() {
        assertThat(new VerifyRetryPolicy(100, 1000).backoffDelay(80)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void hasNext_isFalseOnLastAttempt() {
        final VerifyRetryPolicy policy = new VerifyRetryPolicy(3, 10);

        assertThat(policy.hasNext(2)).isTrue();
        assertThat(policy.hasNext(3)).isFalse();
    }

    @Test
    void constructor_rejectsNegativeDelay() {
        assertThatThrownBy(() -> new VerifyRetryPolicy(3, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
