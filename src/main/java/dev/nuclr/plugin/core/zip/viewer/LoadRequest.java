package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey.Variant;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A request to load one archive member at one variant.
 *
 * @param maxByteSize  largest member accepted; larger members fail, never truncate
 * @param forceReload  skip the cache lookup and decode again
 * @param storeVariant cache the derived variant under its own key (gallery thumbnails)
 */
public record LoadRequest(
        Path archive,
        String memberName,
        long maxByteSize,
        Variant variant,
        boolean forceReload,
        Priority priority,
        boolean storeVariant) {

    public enum Priority {
        /** Interactive; always runs before preloads. */
        NORMAL,
        PRELOAD
    }

    public LoadRequest {
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(memberName, "memberName");
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(priority, "priority");
        if (maxByteSize <= 0) {
            throw new IllegalArgumentException("maxByteSize must be positive, got " + maxByteSize);
        }
    }

    public static LoadRequest of(Path archive, String memberName, long maxByteSize, Variant variant) {
        return new LoadRequest(archive, memberName, maxByteSize, variant, false, Priority.NORMAL, false);
    }

    public static LoadRequest original(Path archive, String memberName, long maxByteSize) {
        return of(archive, memberName, maxByteSize, Variant.ORIGINAL);
    }

    public LoadRequest withForceReload(boolean force) {
        return new LoadRequest(archive, memberName, maxByteSize, variant, force, priority, storeVariant);
    }

    public LoadRequest withPriority(Priority newPriority) {
        return new LoadRequest(archive, memberName, maxByteSize, variant, forceReload, newPriority, storeVariant);
    }

    public LoadRequest withStoreVariant(boolean store) {
        return new LoadRequest(archive, memberName, maxByteSize, variant, forceReload, priority, store);
    }

    /** The key this request is answered under. */
    public CacheKey key() {
        return CacheKey.of(archive, memberName, variant);
    }

    public boolean isPreload() {
        return priority == Priority.PRELOAD;
    }
}
