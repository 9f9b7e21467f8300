package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import dev.nuclr.plugin.core.zip.viewer.cache.DecodedImage;

import java.util.Objects;

/**
 * Outcome of one {@link LoadRequest}. Always carries the key it answers so it
 * can be routed without a reverse lookup.
 */
public record LoadResult(
        boolean success,
        DecodedImage image,
        ErrorKind error,
        String message,
        CacheKey key) {

    public LoadResult {
        Objects.requireNonNull(key, "key");
        if (success && image == null) throw new IllegalArgumentException("successful result needs an image");
        if (!success && error == null) throw new IllegalArgumentException("failed result needs an error kind");
    }

    public static LoadResult success(CacheKey key, DecodedImage image) {
        return new LoadResult(true, image, null, null, key);
    }

    public static LoadResult failure(CacheKey key, ErrorKind error, String message) {
        return new LoadResult(false, null, error, message, key);
    }

    /** Text for a status bar. */
    public String statusText() {
        if (success) {
            return image.width() + "x" + image.height();
        }
        return message != null && !message.isBlank() ? message : error.description();
    }
}
