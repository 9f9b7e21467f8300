package dev.nuclr.plugin.core.zip.viewer.cache;

/**
 * Point-in-time snapshot of a {@link CacheStore}, for diagnostics surfaces.
 */
public record CacheStats(
        int size,
        int capacity,
        long hits,
        long misses,
        double hitRate,
        long evictions,
        long memoryEstimate,
        EvictionPolicy policy) {

    public long requests() {
        return hits + misses;
    }
}
