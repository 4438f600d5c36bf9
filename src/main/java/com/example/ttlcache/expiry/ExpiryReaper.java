package com.example.ttlcache.expiry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Periodic background sweep that removes expired cache entries independently
 * of read traffic.
 *
 * <p>The sweep runs with a fixed delay on a {@link TaskScheduler}. When no
 * scheduler is supplied the reaper creates a private single-thread daemon
 * scheduler and shuts it down on {@link #stop()}; a supplied scheduler is
 * left running.
 *
 * <p>{@code RUNNING -> STOPPED} is the only transition. {@link #stop()} flips
 * an atomic state and cancels the scheduled task without interrupting a sweep
 * in progress, so repeated calls return immediately.
 */
public class ExpiryReaper {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    public enum State {
        RUNNING,
        STOPPED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final String name;
    private final Duration interval;
    private final ThreadPoolTaskScheduler ownedScheduler; // null when the scheduler is shared
    private final ScheduledFuture<?> task;

    private ExpiryReaper(String name, IntSupplier sweep, Duration interval,
                         TaskScheduler scheduler, ThreadPoolTaskScheduler ownedScheduler) {
        this.name = name;
        this.interval = interval;
        this.ownedScheduler = ownedScheduler;
        this.task = scheduler.scheduleWithFixedDelay(
            () -> sweepOnce(sweep),
            Instant.now().plus(interval),
            interval
        );
    }

    /**
     * Schedules {@code sweep} every {@code interval}. The first tick fires one
     * interval after this call.
     *
     * @param name      label used in log output
     * @param sweep     removes expired entries and returns how many it removed
     * @param interval  fixed delay between the end of one sweep and the next
     * @param scheduler shared scheduler, or null to create a private one
     */
    public static ExpiryReaper start(String name, IntSupplier sweep, Duration interval, TaskScheduler scheduler) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sweep, "sweep");
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("sweep interval must be positive: " + interval);
        }

        ThreadPoolTaskScheduler owned = null;
        if (scheduler == null) {
            owned = newPrivateScheduler();
            scheduler = owned;
        }
        ExpiryReaper reaper = new ExpiryReaper(name, sweep, interval, scheduler, owned);
        log.info("Expiry reaper started for {} (interval={})", name, interval);
        return reaper;
    }

    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            return;
        }
        task.cancel(false);
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
        log.info("Expiry reaper stopped for {}", name);
    }

    public State getState() {
        return state.get();
    }

    public Duration getInterval() {
        return interval;
    }

    private void sweepOnce(IntSupplier sweep) {
        if (state.get() == State.STOPPED) {
            return;
        }
        try {
            int removed = sweep.getAsInt();
            if (removed > 0) {
                log.debug("Expiry sweep for {} removed {} entries", name, removed);
            }
        } catch (RuntimeException e) {
            // an exception escaping a periodic task would cancel every later tick
            log.warn("Expiry sweep for {} failed, next attempt in {}", name, interval, e);
        }
    }

    private static ThreadPoolTaskScheduler newPrivateScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("ttl-cache-reaper-");
        s.setDaemon(true);
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.initialize();
        return s;
    }
}
