package dev.nuclr.plugin.core.zip.viewer.cache;

/**
 * Eviction strategies a {@link CacheStore} can run with.
 */
public enum EvictionPolicy {
    /** Least recently used. */
    LRU,
    /** Least frequently used, with a byte ceiling. */
    LFU,
    /** LRU whose capacity follows the observed hit rate. */
    ADAPTIVE
}
