package dev.nuclr.plugin.core.zip.viewer.cache;

import java.util.List;

/**
 * Bookkeeping and victim selection behind a {@link CacheStore}.
 * Implementations are not thread-safe; the store serialises every call.
 */
interface EvictionStrategy {

    EvictionPolicy policy();

    /** Look up and mark as used. */
    CacheEntry get(CacheKey key);

    boolean contains(CacheKey key);

    /**
     * Insert or replace. Returns the entries evicted to make room, never the
     * replaced entry itself.
     */
    List<CacheEntry> put(CacheKey key, DecodedImage image);

    CacheEntry remove(CacheKey key);

    /** Change the bound and return whatever had to go. */
    List<CacheEntry> resize(int capacity);

    void clear();

    int size();

    int capacity();

    long memoryUsage();

    /** All entries, next victim first. */
    List<CacheEntry> entries();

    /** Hit/miss feedback from the store. */
    default void recordAccess(boolean hit) {
    }

    static EvictionStrategy create(EvictionPolicy policy, int capacity, long maxMemoryBytes) {
        return switch (policy) {
            case LRU      -> new LruStrategy(capacity);
            case LFU      -> new LfuStrategy(capacity, maxMemoryBytes);
            case ADAPTIVE -> new AdaptiveLruStrategy(capacity);
        };
    }
}
