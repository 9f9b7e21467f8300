package dev.nuclr.plugin.core.zip.viewer.cache;

/**
 * Notified after an entry has been evicted for capacity or memory reasons.
 * Not called for explicit removal or {@link CacheStore#clear()}.
 */
@FunctionalInterface
public interface EvictionListener {

    EvictionListener NONE = (key, image) -> {};

    void onEvict(CacheKey key, DecodedImage image);
}
