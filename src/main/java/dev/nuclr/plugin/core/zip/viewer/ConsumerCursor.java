package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * What one UI surface is currently waiting for. A surface moves its cursor
 * each time it navigates; results for any other key never reach its callback.
 */
public final class ConsumerCursor {

    private final String name;
    private final Consumer<LoadResult> callback;
    private volatile CacheKey expectedKey;

    public ConsumerCursor(String name, Consumer<LoadResult> callback) {
        this.name = Objects.requireNonNull(name, "name");
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    public void expect(CacheKey key) {
        this.expectedKey = key;
    }

    public void clear() {
        this.expectedKey = null;
    }

    public CacheKey expectedKey() {
        return expectedKey;
    }

    public String name() {
        return name;
    }

    boolean wants(CacheKey key) {
        CacheKey expected = expectedKey;
        return expected != null && expected.equals(key);
    }

    void deliver(LoadResult result) {
        callback.accept(result);
    }

    @Override
    public String toString() {
        return "ConsumerCursor[" + name + " -> " + expectedKey + "]";
    }
}
