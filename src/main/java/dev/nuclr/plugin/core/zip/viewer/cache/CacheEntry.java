package dev.nuclr.plugin.core.zip.viewer.cache;

/**
 * Store-owned slot for one key. Never leaves the cache package.
 */
final class CacheEntry {

    private final CacheKey key;
    private DecodedImage image;
    private long sizeBytes;
    private int frequency = 1;

    CacheEntry(CacheKey key, DecodedImage image) {
        this.key = key;
        replace(image);
    }

    CacheKey key() {
        return key;
    }

    DecodedImage image() {
        return image;
    }

    long sizeBytes() {
        return sizeBytes;
    }

    int frequency() {
        return frequency;
    }

    void touch() {
        frequency++;
    }

    void replace(DecodedImage newImage) {
        this.image = newImage;
        this.sizeBytes = newImage.estimatedBytes();
    }
}
