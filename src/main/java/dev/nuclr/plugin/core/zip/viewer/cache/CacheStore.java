package dev.nuclr.plugin.core.zip.viewer.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe, capacity-bounded cache of decoded images with a swappable
 * eviction strategy.
 * Key: (archivePath, memberName, variant).
 *
 * <p>One lock guards the whole store. Entries are whole decoded images and a
 * store holds tens of them, so per-key locking buys nothing. Eviction
 * listeners run after the lock has been released.
 */
@Slf4j
public final class CacheStore {

    public static final long DEFAULT_MAX_MEMORY_BYTES = 200L * 1024 * 1024;

    private final ReentrantLock lock = new ReentrantLock();
    private final long maxMemoryBytes;
    private final EvictionListener evictionListener;

    // Guarded by lock
    private EvictionStrategy strategy;
    private long hits;
    private long misses;
    private long evictions;

    public CacheStore(int capacity) {
        this(capacity, EvictionPolicy.LRU);
    }

    public CacheStore(int capacity, EvictionPolicy policy) {
        this(capacity, policy, DEFAULT_MAX_MEMORY_BYTES, EvictionListener.NONE);
    }

    public CacheStore(int capacity, EvictionPolicy policy, long maxMemoryBytes, EvictionListener evictionListener) {
        if (capacity <= 0) throw new InvalidCapacityException(capacity);
        if (maxMemoryBytes <= 0) throw new IllegalArgumentException("maxMemoryBytes must be positive");
        this.maxMemoryBytes = maxMemoryBytes;
        this.evictionListener = evictionListener != null ? evictionListener : EvictionListener.NONE;
        this.strategy = EvictionStrategy.create(policy, capacity, maxMemoryBytes);
    }

    // ------------------------------------------------------------ lookups

    /**
     * Look up a key, counting a hit or a miss and marking the entry as used.
     */
    public Optional<DecodedImage> get(CacheKey key) {
        lock.lock();
        try {
            CacheEntry entry = strategy.get(key);
            boolean hit = entry != null;
            if (hit) hits++;
            else misses++;
            strategy.recordAccess(hit);
            return hit ? Optional.of(entry.image()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /** Presence check. Does not touch the entry or the statistics. */
    public boolean contains(CacheKey key) {
        lock.lock();
        try {
            return strategy.contains(key);
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------ mutation

    /**
     * Insert or replace. An image that never materialised is refused.
     *
     * @return true if the image is now cached under {@code key}
     */
    public boolean put(CacheKey key, DecodedImage image) {
        if (key == null) throw new IllegalArgumentException("key must not be null");
        if (image == null) {
            log.warn("Refusing to cache null image for {}", key);
            return false;
        }
        if (!image.isMaterialized()) {
            log.warn("Refusing to cache unmaterialised image for {}", key);
            return false;
        }

        List<CacheEntry> evicted;
        lock.lock();
        try {
            evicted = strategy.put(key, image);
            evictions += evicted.size();
        } finally {
            lock.unlock();
        }
        notifyEvicted(evicted);
        return true;
    }

    public boolean remove(CacheKey key) {
        lock.lock();
        try {
            return strategy.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /** Drop every variant of every member of one archive. */
    public int invalidate(String archivePath) {
        lock.lock();
        try {
            int removed = 0;
            for (CacheEntry entry : strategy.entries()) {
                if (entry.key().belongsTo(archivePath)) {
                    strategy.remove(entry.key());
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            strategy.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Image cache cleared");
    }

    /**
     * Change the bound, evicting down to it immediately.
     *
     * @throws InvalidCapacityException if {@code newCapacity <= 0}
     */
    public void resize(int newCapacity) {
        if (newCapacity <= 0) throw new InvalidCapacityException(newCapacity);
        List<CacheEntry> evicted;
        lock.lock();
        try {
            evicted = strategy.resize(newCapacity);
            evictions += evicted.size();
        } finally {
            lock.unlock();
        }
        notifyEvicted(evicted);
        log.debug("Image cache resized to {} ({} evicted)", newCapacity, evicted.size());
    }

    /**
     * Switch strategy at runtime. Content is carried over in the old
     * strategy's eviction order, so the entries most worth keeping are
     * inserted last.
     */
    public void setPolicy(EvictionPolicy policy) {
        List<CacheEntry> evicted = new ArrayList<>();
        lock.lock();
        try {
            if (strategy.policy() == policy) return;
            EvictionStrategy next = EvictionStrategy.create(policy, strategy.capacity(), maxMemoryBytes);
            for (CacheEntry entry : strategy.entries()) {
                evicted.addAll(next.put(entry.key(), entry.image()));
            }
            log.info("Image cache strategy {} -> {}", strategy.policy(), policy);
            strategy = next;
            evictions += evicted.size();
        } finally {
            lock.unlock();
        }
        notifyEvicted(evicted);
    }

    // ------------------------------------------------------------ introspection

    public int size() {
        lock.lock();
        try {
            return strategy.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        lock.lock();
        try {
            return strategy.capacity();
        } finally {
            lock.unlock();
        }
    }

    public EvictionPolicy policy() {
        lock.lock();
        try {
            return strategy.policy();
        } finally {
            lock.unlock();
        }
    }

    public long maxMemoryBytes() {
        return maxMemoryBytes;
    }

    public CacheStats stats() {
        lock.lock();
        try {
            long total = hits + misses;
            double hitRate = total > 0 ? (double) hits / total : 0.0;
            return new CacheStats(strategy.size(), strategy.capacity(), hits, misses, hitRate,
                    evictions, strategy.memoryUsage(), strategy.policy());
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        lock.lock();
        try {
            hits = 0;
            misses = 0;
            evictions = 0;
        } finally {
            lock.unlock();
        }
    }

    private void notifyEvicted(List<CacheEntry> evicted) {
        for (CacheEntry entry : evicted) {
            log.debug("Evicted {}", entry.key());
            try {
                evictionListener.onEvict(entry.key(), entry.image());
            } catch (RuntimeException e) {
                log.warn("Eviction listener failed for {}", entry.key(), e);
            }
        }
    }
}
