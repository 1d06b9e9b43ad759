package com.phillippitts.liveagent.util;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Lazily populated map whose entries are computed at most once per key.
 *
 * <p>Lookups of present keys are lock-free. The first requests for a missing key serialize on a
 * lock private to that key and re-check before loading, so the loader runs once per key even
 * under contention. A loader failure caches nothing; the next request retries. Entries are never
 * evicted.
 *
 * @param <K> key type; needs value equality
 * @param <V> cached value type
 */
public final class KeyedOnceCache<K, V> {

    private final ConcurrentMap<K, V> values = new ConcurrentHashMap<>();
    private final ConcurrentMap<K, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicInteger loads = new AtomicInteger();

    public V get(K key, Function<? super K, ? extends V> loader) {
        Objects.requireNonNull(key, "key");
        V cached = values.get(key);
        if (cached != null) {
            return cached;
        }
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            cached = values.get(key);
            if (cached != null) {
                return cached;
            }
            V loaded = Objects.requireNonNull(loader.apply(key), "loader returned null");
            values.put(key, loaded);
            loads.incrementAndGet();
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    /** Successful loads since creation. */
    public int loadCount() {
        return loads.get();
    }

    public int size() {
        return values.size();
    }
}
