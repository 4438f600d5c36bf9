package com.example.ttlcache.core;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Bounded key-value cache with least-recently-used eviction and optional
 * per-entry time-to-live.
 *
 * <p>Keys and values must not be null. Absence of a key is reported as an
 * empty {@link Optional}, never as an exception.
 *
 * <p>{@link #stop()} must be called by the owner before the cache is discarded.
 * A stopped cache keeps serving every operation; only the background expiry
 * sweep ends, so expired entries are then dropped lazily by {@link #get} or by
 * an explicit {@link #purgeExpired()}.
 */
public interface TtlCache<K, V> extends AutoCloseable {

    /**
     * Maximum number of entries, fixed at construction.
     */
    int capacity();

    /**
     * Inserts or replaces a permanent entry. Replacing clears any expiry.
     */
    void add(K key, V value);

    /**
     * Inserts or replaces an entry expiring {@code ttl} from now.
     * A zero or negative ttl stores an entry that is already expired.
     */
    void addWithTtl(K key, V value, Duration ttl);

    /**
     * Returns the live value for {@code key} and marks it most recently used.
     * An expired entry is removed and reported as absent.
     */
    Optional<V> get(K key);

    void remove(K key);

    void clear();

    /**
     * Number of held entries, including expired ones not yet swept.
     */
    int size();

    /**
     * Snapshot of held keys, most recently used first.
     */
    List<K> keys();

    /**
     * Removes every expired entry now and returns how many were removed.
     */
    int purgeExpired();

    /**
     * Stops the background expiry sweep. Idempotent and non-blocking.
     */
    void stop();

    boolean isStopped();

    @Override
    default void close() {
        stop();
    }
}
