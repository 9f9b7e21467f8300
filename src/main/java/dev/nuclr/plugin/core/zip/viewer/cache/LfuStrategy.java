package dev.nuclr.plugin.core.zip.viewer.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * LFU with frequency buckets. The victim comes from the lowest non-empty
 * bucket, oldest insertion first. A byte ceiling is enforced on every insert
 * and replacement, on top of the count bound.
 */
class LfuStrategy implements EvictionStrategy {

    private final Map<CacheKey, CacheEntry> entries = new HashMap<>();
    private final TreeMap<Integer, LinkedHashSet<CacheKey>> buckets = new TreeMap<>();
    private final long maxMemoryBytes;
    private int capacity;
    private long memoryUsage;

    LfuStrategy(int capacity, long maxMemoryBytes) {
        this.capacity = capacity;
        this.maxMemoryBytes = maxMemoryBytes;
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.LFU;
    }

    long maxMemoryBytes() {
        return maxMemoryBytes;
    }

    @Override
    public CacheEntry get(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry != null) promote(entry);
        return entry;
    }

    @Override
    public boolean contains(CacheKey key) {
        return entries.containsKey(key);
    }

    @Override
    public List<CacheEntry> put(CacheKey key, DecodedImage image) {
        CacheEntry existing = entries.get(key);
        if (existing != null) {
            memoryUsage -= existing.sizeBytes();
            existing.replace(image);
            memoryUsage += existing.sizeBytes();
            promote(existing);
            List<CacheEntry> evicted = new ArrayList<>();
            // A grown replacement pushes others out, never itself
            while (entries.size() > 1 && memoryUsage > maxMemoryBytes) {
                evicted.add(evictOneExcept(key));
            }
            return evicted;
        }

        List<CacheEntry> evicted = new ArrayList<>();
        long incoming = image.estimatedBytes();
        // An image bigger than the whole ceiling still goes in, alone
        while (!entries.isEmpty() && memoryUsage + incoming > maxMemoryBytes) {
            evicted.add(evictOne());
        }
        while (!entries.isEmpty() && entries.size() >= capacity) {
            evicted.add(evictOne());
        }

        CacheEntry entry = new CacheEntry(key, image);
        entries.put(key, entry);
        bucket(entry.frequency()).add(key);
        memoryUsage += entry.sizeBytes();
        return evicted;
    }

    @Override
    public CacheEntry remove(CacheKey key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            unlink(removed.frequency(), key);
            memoryUsage -= removed.sizeBytes();
        }
        return removed;
    }

    @Override
    public List<CacheEntry> resize(int newCapacity) {
        this.capacity = newCapacity;
        List<CacheEntry> evicted = new ArrayList<>();
        while (entries.size() > newCapacity) {
            evicted.add(evictOne());
        }
        return evicted;
    }

    @Override
    public void clear() {
        entries.clear();
        buckets.clear();
        memoryUsage = 0;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public long memoryUsage() {
        return memoryUsage;
    }

    @Override
    public List<CacheEntry> entries() {
        List<CacheEntry> ordered = new ArrayList<>(entries.size());
        for (LinkedHashSet<CacheKey> keys : buckets.values()) {
            for (CacheKey key : keys) {
                ordered.add(entries.get(key));
            }
        }
        return ordered;
    }

    private void promote(CacheEntry entry) {
        unlink(entry.frequency(), entry.key());
        entry.touch();
        bucket(entry.frequency()).add(entry.key());
    }

    private CacheEntry evictOne() {
        Map.Entry<Integer, LinkedHashSet<CacheKey>> lowest = buckets.firstEntry();
        CacheKey victim = lowest.getValue().iterator().next();
        return remove(victim);
    }

    private CacheEntry evictOneExcept(CacheKey keep) {
        for (LinkedHashSet<CacheKey> keys : buckets.values()) {
            for (CacheKey candidate : keys) {
                if (!candidate.equals(keep)) return remove(candidate);
            }
        }
        throw new IllegalStateException("No entry to evict besides " + keep);
    }

    private LinkedHashSet<CacheKey> bucket(int frequency) {
        return buckets.computeIfAbsent(frequency, f -> new LinkedHashSet<>());
    }

    private void unlink(int frequency, CacheKey key) {
        LinkedHashSet<CacheKey> keys = buckets.get(frequency);
        if (keys == null) return;
        keys.remove(key);
        if (keys.isEmpty()) buckets.remove(frequency);
    }
}
