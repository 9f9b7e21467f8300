package dev.nuclr.plugin.core.zip.viewer.cache;

/**
 * Thrown when a cache is configured with a capacity below one.
 */
public class InvalidCapacityException extends IllegalArgumentException {

    public InvalidCapacityException(int capacity) {
        super("Cache capacity must be positive, got " + capacity);
    }
}
