package com.example.ttlcache.expiry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@DisplayName("ExpiryReaper")
class ExpiryReaperTest {

    private static final Duration INTERVAL = Duration.ofMillis(10);

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(5);
        }
        return condition.getAsBoolean();
    }

    @Nested
    @DisplayName("With a private scheduler")
    class PrivateScheduler {

        @Test
        @DisplayName("should sweep repeatedly until stopped")
        void shouldSweepUntilStopped() throws Exception {
            AtomicInteger sweeps = new AtomicInteger();
            ExpiryReaper reaper = ExpiryReaper.start("test", sweeps::incrementAndGet, INTERVAL, null);

            assertThat(waitUntil(() -> sweeps.get() >= 3)).isTrue();
            assertThat(reaper.getState()).isEqualTo(ExpiryReaper.State.RUNNING);

            reaper.stop();
            Thread.sleep(INTERVAL.toMillis() * 3);
            int afterStop = sweeps.get();
            Thread.sleep(INTERVAL.toMillis() * 5);

            assertThat(sweeps.get()).isEqualTo(afterStop);
            assertThat(reaper.getState()).isEqualTo(ExpiryReaper.State.STOPPED);
        }

        @Test
        @DisplayName("should tolerate repeated stop calls")
        void shouldTolerateRepeatedStop() {
            ExpiryReaper reaper = ExpiryReaper.start("test", () -> 0, INTERVAL, null);

            reaper.stop();
            reaper.stop();
            reaper.stop();

            assertThat(reaper.getState()).isEqualTo(ExpiryReaper.State.STOPPED);
        }

        @Test
        @DisplayName("should keep its schedule after a failing sweep")
        void shouldSurviveFailingSweep() throws Exception {
            AtomicInteger sweeps = new AtomicInteger();
            ExpiryReaper reaper = ExpiryReaper.start("test", () -> {
                if (sweeps.incrementAndGet() == 1) {
                    throw new IllegalStateException("boom");
                }
                return 1;
            }, INTERVAL, null);
            try {
                assertThat(waitUntil(() -> sweeps.get() >= 3)).isTrue();
            } finally {
                reaper.stop();
            }
        }

        @Test
        @DisplayName("should not sweep before the first interval elapses")
        void shouldDelayFirstSweep() throws Exception {
            AtomicInteger sweeps = new AtomicInteger();
            ExpiryReaper reaper = ExpiryReaper.start("test", sweeps::incrementAndGet, Duration.ofHours(1), null);
            try {
                Thread.sleep(50);
                assertThat(sweeps.get()).isZero();
                assertThat(reaper.getInterval()).isEqualTo(Duration.ofHours(1));
            } finally {
                reaper.stop();
            }
        }

        @Test
        @DisplayName("should reject a non-positive interval")
        void shouldRejectNonPositiveInterval() {
            assertThatThrownBy(() -> ExpiryReaper.start("test", () -> 0, Duration.ZERO, null))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ExpiryReaper.start("test", () -> 0, Duration.ofMillis(-1), null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("With a shared scheduler")
    class SharedScheduler {

        private ThreadPoolTaskScheduler scheduler;

        @BeforeEach
        void setUp() {
            scheduler = new ThreadPoolTaskScheduler();
            scheduler.setPoolSize(1);
            scheduler.initialize();
        }

        @AfterEach
        void tearDown() {
            scheduler.shutdown();
        }

        @Test
        @DisplayName("should leave the shared scheduler running after stop")
        void shouldLeaveSharedSchedulerRunning() throws Exception {
            AtomicInteger first = new AtomicInteger();
            AtomicInteger second = new AtomicInteger();
            ExpiryReaper one = ExpiryReaper.start("one", first::incrementAndGet, INTERVAL, scheduler);
            ExpiryReaper two = ExpiryReaper.start("two", second::incrementAndGet, INTERVAL, scheduler);

            one.stop();
            int secondBefore = second.get();

            assertThat(waitUntil(() -> second.get() > secondBefore + 2)).isTrue();
            assertThat(scheduler.getScheduledExecutor().isShutdown()).isFalse();

            two.stop();
        }
    }
}
