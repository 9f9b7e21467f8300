package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey.Variant;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Warms the cache around the member the user is looking at.
 *
 * <p>Neighbours in the direction of travel are queued first, then the ones
 * behind. Members already cached or already being decoded are skipped, and at
 * most {@code maxQueued} preloads are outstanding at any time so that
 * interactive loads are never starved.
 */
@Slf4j
public class PreloadScheduler {

    public static final int DEFAULT_MAX_QUEUED = 3;

    private final ImageLoadService loader;
    private final CacheStore cache;
    private final int maxQueued;

    private final List<LoadHandle> pending = new ArrayList<>();

    public PreloadScheduler(ImageLoadService loader, CacheStore cache) {
        this(loader, cache, DEFAULT_MAX_QUEUED);
    }

    public PreloadScheduler(ImageLoadService loader, CacheStore cache, int maxQueued) {
        if (maxQueued <= 0) throw new IllegalArgumentException("maxQueued must be positive, got " + maxQueued);
        this.loader = loader;
        this.cache = cache;
        this.maxQueued = maxQueued;
    }

    /** Neighbour depth for the current mode. */
    public static int depthFor(ViewerSettings settings) {
        return settings.getPreloadNeighbors();
    }

    /**
     * Queue preloads around {@code currentIndex}.
     *
     * @param direction positive when moving to higher indices, negative when
     *                  moving back; zero counts as forward
     * @return number of preloads actually submitted
     */
    public synchronized int schedule(Path archive,
                                     List<String> members,
                                     int currentIndex,
                                     int direction,
                                     int depth,
                                     Variant variant,
                                     long maxByteSize) {
        pruneFinished();
        if (members == null || members.isEmpty() || depth <= 0) return 0;

        int step = direction < 0 ? -1 : 1;
        List<Integer> targets = new ArrayList<>(depth * 2);
        for (int offset = 1; offset <= depth; offset++) targets.add(currentIndex + step * offset);
        for (int offset = 1; offset <= depth; offset++) targets.add(currentIndex - step * offset);

        int submitted = 0;
        for (int index : targets) {
            if (pending.size() >= maxQueued) break;
            if (index < 0 || index >= members.size()) continue;

            LoadRequest request = LoadRequest.of(archive, members.get(index), maxByteSize, variant)
                    .withPriority(LoadRequest.Priority.PRELOAD);
            CacheKey key = request.key();
            if (cache.contains(key) || cache.contains(key.toOriginal()) || loader.isInFlight(key)) continue;

            pending.add(loader.submit(request));
            submitted++;
        }
        if (submitted > 0) {
            log.debug("Queued {} preload(s) around {}#{}", submitted, archive.getFileName(), currentIndex);
        }
        return submitted;
    }

    /** Cancel preloads that have not started; returns how many were cancelled. */
    public synchronized int cancelPending() {
        int cancelled = 0;
        for (LoadHandle handle : pending) {
            if (handle.cancel()) cancelled++;
        }
        pending.clear();
        return cancelled;
    }

    public synchronized int pendingCount() {
        pruneFinished();
        return pending.size();
    }

    public int maxQueued() {
        return maxQueued;
    }

    private void pruneFinished() {
        pending.removeIf(LoadHandle::isDone);
    }
}
