package com.example.ttlcache.core;

import java.time.Instant;

/**
 * Storage node of {@link LruTtlCache}: one key/value pair, its optional expiry
 * and the links that place it in the {@link RecencyList}.
 * Only touched while the owning cache's lock is held.
 */
final class CacheEntry<K, V> {

    final K key;              // kept on the node so an evicted tail can be dropped from the index
    V value;
    Instant expiry;           // null means the entry never expires

    CacheEntry<K, V> prev;    // towards the most recently used end
    CacheEntry<K, V> next;    // towards the least recently used end

    CacheEntry(K key, V value, Instant expiry) {
        this.key = key;
        this.value = value;
        this.expiry = expiry;
    }

    /**
     * Expired iff an expiry is set and it is not strictly after {@code now}.
     */
    boolean isExpiredAt(Instant now) {
        return expiry != null && !expiry.isAfter(now);
    }

    void update(V value, Instant expiry) {
        this.value = value;
        this.expiry = expiry;
    }
}
