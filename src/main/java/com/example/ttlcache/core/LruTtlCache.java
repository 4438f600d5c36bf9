package com.example.ttlcache.core;

import com.example.ttlcache.expiry.ExpiryReaper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * {@link TtlCache} backed by a hash index and an intrusive recency list kept
 * in lock-step under one {@link ReentrantLock}.
 *
 * <p>Eviction drops exactly the least recently used entry, and only when a new
 * key arrives at full capacity. Expired entries are removed on read and by a
 * background {@link ExpiryReaper} started by the constructor.
 */
public class LruTtlCache<K, V> implements TtlCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(LruTtlCache.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<K, CacheEntry<K, V>> index = new HashMap<>();
    private final RecencyList<K, V> order = new RecencyList<>();

    private final int capacity;
    private final int sweepBatchSize;
    private final Clock clock;
    private final ExpiryReaper reaper;

    public LruTtlCache(int capacity) {
        this(capacity, Clock.systemUTC(), ExpiryReaper.DEFAULT_INTERVAL);
    }

    public LruTtlCache(int capacity, Clock clock, Duration sweepInterval) {
        this(capacity, clock, null, sweepInterval, Integer.MAX_VALUE);
    }

    /**
     * @param capacity       maximum number of entries, must be positive
     * @param clock          source of "now" for expiry deadlines
     * @param scheduler      shared scheduler for the reaper, or null for a private one
     * @param sweepInterval  delay between reaper sweeps
     * @param sweepBatchSize entries examined per lock hold during a sweep
     * @throws InvalidCapacityException if {@code capacity <= 0}
     */
    public LruTtlCache(
        int capacity,
        Clock clock,
        TaskScheduler scheduler,
        Duration sweepInterval,
        int sweepBatchSize
    ) {
        if (capacity <= 0) {
            throw new InvalidCapacityException(capacity);
        }
        if (sweepBatchSize <= 0) {
            throw new IllegalArgumentException("sweep batch size must be positive: " + sweepBatchSize);
        }
        this.capacity = capacity;
        this.sweepBatchSize = sweepBatchSize;
        this.clock = Objects.requireNonNull(clock, "clock");
        // started last: the sweep reads the fields above
        this.reaper = ExpiryReaper.start("cache@" + Integer.toHexString(System.identityHashCode(this)),
            this::purgeExpired, sweepInterval, scheduler);
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public void add(K key, V value) {
        put(key, value, null);
    }

    @Override
    public void addWithTtl(K key, V value, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        put(key, value, deadline(clock.instant(), ttl));
    }

    // saturates at Instant.MAX / Instant.MIN instead of overflowing
    private static Instant deadline(Instant now, Duration ttl) {
        if (ttl.isNegative()) {
            return ttl.compareTo(Duration.between(now, Instant.MIN)) <= 0 ? Instant.MIN : now.plus(ttl);
        }
        return ttl.compareTo(Duration.between(now, Instant.MAX)) >= 0 ? Instant.MAX : now.plus(ttl);
    }

    private void put(K key, V value, Instant expiry) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        lock.lock();
        try {
            CacheEntry<K, V> entry = index.get(key);
            if (entry != null) {
                // updates never evict
                entry.update(value, expiry);
                order.moveToFront(entry);
                return;
            }

            if (order.size() >= capacity) {
                evictLeastRecentlyUsed();
            }

            CacheEntry<K, V> newEntry = new CacheEntry<>(key, value, expiry);
            order.pushFront(newEntry);
            index.put(key, newEntry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");

        lock.lock();
        try {
            CacheEntry<K, V> entry = index.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpiredAt(clock.instant())) {
                unlink(entry);
                return Optional.empty();
            }
            order.moveToFront(entry);
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(K key) {
        Objects.requireNonNull(key, "key");

        lock.lock();
        try {
            CacheEntry<K, V> entry = index.get(key);
            if (entry != null) {
                unlink(entry);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            index.clear();
            order.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<K> keys() {
        lock.lock();
        try {
            List<K> keys = new ArrayList<>(order.size());
            for (CacheEntry<K, V> e = order.head(); e != null; e = e.next) {
                keys.add(e.key);
            }
            return keys;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Walks the recency list from head to tail in batches of at most
     * {@code sweepBatchSize} entries, one lock hold per batch. A sweep visits
     * at most as many entries as the cache held when it began. If the entry the
     * next batch would start from has been removed in between, the sweep ends
     * and the remainder is left to the next run.
     */
    @Override
    public int purgeExpired() {
        int removed = 0;
        int budget = 0;
        int visited = 0;
        CacheEntry<K, V> cursor = null;
        boolean first = true;
        do {
            lock.lock();
            try {
                if (first) {
                    cursor = order.head();
                    budget = order.size();
                    first = false;
                } else if (index.get(cursor.key) != cursor) {
                    break;
                }

                Instant now = clock.instant();
                int scanned = 0;
                while (cursor != null && scanned < sweepBatchSize && visited < budget) {
                    CacheEntry<K, V> next = cursor.next;
                    if (cursor.isExpiredAt(now)) {
                        unlink(cursor);
                        removed++;
                    }
                    cursor = next;
                    scanned++;
                    visited++;
                }
                if (visited >= budget) {
                    // entries moved to the head mid-sweep would otherwise be walked again
                    cursor = null;
                }
            } finally {
                lock.unlock();
            }
        } while (cursor != null);
        return removed;
    }

    @Override
    public void stop() {
        reaper.stop();
    }

    @Override
    public boolean isStopped() {
        return reaper.getState() == ExpiryReaper.State.STOPPED;
    }

    // caller holds the lock
    private void evictLeastRecentlyUsed() {
        CacheEntry<K, V> victim = order.removeTail();
        if (victim != null) {
            index.remove(victim.key);
            log.debug("Evicted least recently used key {}", victim.key);
        }
    }

    // caller holds the lock
    private void unlink(CacheEntry<K, V> entry) {
        order.unlink(entry);
        index.remove(entry.key);
    }
}
