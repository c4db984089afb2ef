package com.phillippitts.uptimemonitor.service.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class CheckConcurrencyGuardTest {

    @Test
    void zeroLimitMeansUnlimited() throws InterruptedException {
        CheckConcurrencyGuard guard = CheckConcurrencyGuard.unlimited();

        for (int i = 0; i < 1000; i++) {
            guard.acquire();
        }

        assertThat(guard.isLimited()).isFalse();
        assertThat(guard.availablePermits()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void rejectsNegativeLimit() {
        assertThatThrownBy(() -> new CheckConcurrencyGuard(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void releaseRestoresPermit() throws InterruptedException {
        CheckConcurrencyGuard guard = new CheckConcurrencyGuard(2);

        guard.acquire();
        assertThat(guard.availablePermits()).isEqualTo(1);
        guard.release();

        assertThat(guard.availablePermits()).isEqualTo(2);
        assertThat(guard.getLimit()).isEqualTo(2);
    }

    @Test
    void blocksWhenLimitReached() throws InterruptedException {
        CheckConcurrencyGuard guard = new CheckConcurrencyGuard(1);
        guard.acquire();
        AtomicBoolean acquired = new AtomicBoolean();

        Thread waiter = new Thread(() -> {
            try {
                guard.acquire();
                acquired.set(true);
                guard.release();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1)).untilFalse(acquired);

        guard.release();
        await().atMost(Duration.ofSeconds(2)).untilTrue(acquired);
        waiter.join(2000);
    }
}
