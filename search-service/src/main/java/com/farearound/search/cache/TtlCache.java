package com.farearound.search.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, thread-safe key-value store with per-entry expiry.
 *
 * <p>Reads share a read lock; writes, lazy removal of expired entries and eviction take the
 * write lock. When a new key arrives at capacity, expired entries are purged first and, if the
 * store is still full, the entry closest to expiry is evicted.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code size() <= capacity} once any mutating call returns</li>
 *   <li>an entry is never returned once {@code now >= expiresAt}</li>
 * </ul>
 */
@Slf4j
public class TtlCache<K, V> {

    private final Map<K, CacheEntry<V>> entries;
    private final ReadWriteLock lock;
    private final Clock clock;
    private final int capacity;
    private final Duration defaultTtl;

    public TtlCache(int capacity, Duration defaultTtl, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1, got " + capacity);
        }
        requirePositive(defaultTtl);
        this.capacity = capacity;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    public Optional<V> get(K key) {
        requireKey(key);
        Instant now = clock.instant();

        CacheEntry<V> entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }

        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isExpired(now)) {
            return Optional.of(entry.value());
        }

        lock.writeLock().lock();
        try {
            // Only drop the instance we saw; a concurrent set may have replaced it.
            entries.remove(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        return Optional.empty();
    }

    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    public void set(K key, V value, Duration ttl) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Cache value must not be null");
        }
        requirePositive(ttl);

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                purgeExpiredLocked(now);
                if (entries.size() >= capacity) {
                    evictNearestExpiryLocked();
                }
            }
            entries.put(key, new CacheEntry<>(value, now.plus(ttl)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        lock.writeLock().lock();
        try {
            return purgeExpiredLocked(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidate(K key) {
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    private int purgeExpiredLocked(Instant now) {
        int removed = 0;
        Iterator<CacheEntry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private void evictNearestExpiryLocked() {
        K victim = null;
        Instant earliest = null;
        for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
            Instant expiresAt = e.getValue().expiresAt();
            if (earliest == null || expiresAt.isBefore(earliest)) {
                earliest = expiresAt;
                victim = e.getKey();
            }
        }
        if (victim != null) {
            entries.remove(victim);
            log.debug("Evicted cache entry nearest to expiry: expiresAt={}", earliest);
        }
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key must not be null");
        }
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
    }
}
