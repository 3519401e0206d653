package com.swearguard.bot.service;

import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded message to verdict cache. Reads are lock-free; writes are serialized by one lock and evict
 * the oldest inserted entry once the cache is full. Eviction ignores access recency.
 */
public final class ResultCache {
    private final int maxSize;
    private final ConcurrentHashMap<String, Boolean> entries = new ConcurrentHashMap<>();
    private final Queue<String> insertionOrder = new ConcurrentLinkedQueue<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResultCache(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    public Optional<Boolean> get(String key) {
        Boolean value = entries.get(key);
        if (value == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(value);
    }

    public void put(String key, boolean value) {
        writeLock.lock();
        try {
            if (!entries.containsKey(key)) {
                while (entries.size() >= maxSize) {
                    String oldest = insertionOrder.poll();
                    if (oldest == null) {
                        break;
                    }
                    entries.remove(oldest);
                }
                insertionOrder.add(key);
            }
            entries.put(key, value);
        } finally {
            writeLock.unlock();
        }
    }

    public void clear() {
        writeLock.lock();
        try {
            entries.clear();
            insertionOrder.clear();
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }
}
