package com.example.dutyroster.swap;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwapStatusTest {

    @Test
    void onlyPendingAndAwaitingSchedulerAreOpen() {
        assertThat(SwapStatus.PENDING.isOpen()).isTrue();
        assertThat(SwapStatus.AWAITING_SCHEDULER.isOpen()).isTrue();
        assertThat(SwapStatus.APPROVED.isOpen()).isFalse();
        assertThat(SwapStatus.REJECTED.isOpen()).isFalse();
    }

    @Test
    void openSetCannotBeChangedByCallers() {
        assertThatThrownBy(() -> SwapStatus.OPEN.add(SwapStatus.APPROVED))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> SwapStatus.OPEN.remove(SwapStatus.PENDING))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(SwapStatus.APPROVED.isOpen()).isFalse();
    }
}
