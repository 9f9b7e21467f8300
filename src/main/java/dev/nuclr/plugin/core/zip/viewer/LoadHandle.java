package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;

import java.util.concurrent.CompletableFuture;

/**
 * Reference to a submitted load.
 *
 * <p>Cancellation is best effort: work that has not started is dropped, work
 * that has started runs to completion and still warms the cache, but this
 * handle's result is no longer produced or published.
 */
public final class LoadHandle {

    private final CacheKey key;
    private final LoadRequest.Priority priority;
    private final CompletableFuture<LoadResult> result;
    private final Runnable onCancel;

    LoadHandle(CacheKey key, LoadRequest.Priority priority, CompletableFuture<LoadResult> result, Runnable onCancel) {
        this.key = key;
        this.priority = priority;
        this.result = result;
        this.onCancel = onCancel;
    }

    static LoadHandle completed(LoadResult result, LoadRequest.Priority priority) {
        return new LoadHandle(result.key(), priority, CompletableFuture.completedFuture(result), () -> {});
    }

    public CacheKey key() {
        return key;
    }

    public LoadRequest.Priority priority() {
        return priority;
    }

    /** Completes with the result; cancelled handles complete exceptionally. */
    public CompletableFuture<LoadResult> result() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    public boolean isCancelled() {
        return result.isCancelled();
    }

    /**
     * @return true if this call cancelled the handle, false if it had
     *         already completed
     */
    public boolean cancel() {
        boolean cancelled = result.cancel(false);
        if (cancelled) onCancel.run();
        return cancelled;
    }
}
