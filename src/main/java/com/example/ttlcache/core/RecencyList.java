package com.example.ttlcache.core;

/**
 * Intrusive doubly linked list of {@link CacheEntry} nodes.
 * Head is the most recently used entry, tail the next eviction candidate.
 * Not thread-safe; guarded by the owning cache's lock.
 */
final class RecencyList<K, V> {

    private CacheEntry<K, V> head;
    private CacheEntry<K, V> tail;
    private int size;

    CacheEntry<K, V> head() {
        return head;
    }

    CacheEntry<K, V> tail() {
        return tail;
    }

    int size() {
        return size;
    }

    void pushFront(CacheEntry<K, V> node) {
        node.prev = null;
        node.next = head;
        if (head == null) {
            tail = node;
        } else {
            head.prev = node;
        }
        head = node;
        size++;
    }

    void moveToFront(CacheEntry<K, V> node) {
        if (node == head) {
            return;
        }
        unlink(node);
        pushFront(node);
    }

    void unlink(CacheEntry<K, V> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next; // removing head
        }

        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev; // removing tail
        }

        node.prev = null;
        node.next = null;
        size--;
    }

    /**
     * Unlinks and returns the tail node, or null when the list is empty.
     */
    CacheEntry<K, V> removeTail() {
        CacheEntry<K, V> victim = tail;
        if (victim != null) {
            unlink(victim);
        }
        return victim;
    }

    void clear() {
        head = null;
        tail = null;
        size = 0;
    }
}
