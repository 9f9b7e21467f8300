package dev.nuclr.plugin.core.zip.viewer.cache;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Access-ordered LRU. The eldest entry of the map is the next victim.
 */
class LruStrategy implements EvictionStrategy {

    private final LinkedHashMap<CacheKey, CacheEntry> map = new LinkedHashMap<>(16, 0.75f, true);
    private int capacity;
    private long memoryUsage;

    LruStrategy(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public EvictionPolicy policy() {
        return EvictionPolicy.LRU;
    }

    @Override
    public CacheEntry get(CacheKey key) {
        CacheEntry entry = map.get(key);
        if (entry != null) entry.touch();
        return entry;
    }

    @Override
    public boolean contains(CacheKey key) {
        return map.containsKey(key);
    }

    @Override
    public List<CacheEntry> put(CacheKey key, DecodedImage image) {
        CacheEntry existing = map.get(key);
        if (existing != null) {
            memoryUsage -= existing.sizeBytes();
            existing.replace(image);
            memoryUsage += existing.sizeBytes();
            return List.of();
        }
        List<CacheEntry> evicted = evictDownTo(capacity - 1);
        CacheEntry entry = new CacheEntry(key, image);
        map.put(key, entry);
        memoryUsage += entry.sizeBytes();
        return evicted;
    }

    @Override
    public CacheEntry remove(CacheKey key) {
        CacheEntry removed = map.remove(key);
        if (removed != null) memoryUsage -= removed.sizeBytes();
        return removed;
    }

    @Override
    public List<CacheEntry> resize(int newCapacity) {
        this.capacity = newCapacity;
        return evictDownTo(newCapacity);
    }

    @Override
    public void clear() {
        map.clear();
        memoryUsage = 0;
    }

    @Override
    public int size() {
        return map.size();
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
        return new ArrayList<>(map.values());
    }

    private List<CacheEntry> evictDownTo(int bound) {
        if (map.size() <= bound) return List.of();
        List<CacheEntry> evicted = new ArrayList<>();
        Iterator<CacheEntry> it = map.values().iterator();
        while (map.size() > Math.max(bound, 0) && it.hasNext()) {
            CacheEntry eldest = it.next();
            it.remove();
            memoryUsage -= eldest.sizeBytes();
            evicted.add(eldest);
        }
        return evicted;
    }
}
