package com.example.ttlcache.core;

/**
 * Thrown when a cache is constructed with a capacity that is not positive.
 */
public class InvalidCapacityException extends IllegalArgumentException {

    private final int capacity;

    public InvalidCapacityException(int capacity) {
        super("invalid capacity: " + capacity);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
