package dev.nuclr.plugin.core.zip.viewer;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single delivery channel between the load workers and the UI.
 *
 * <p>Workers {@link #publish} from any thread. {@link #drain()} runs on the
 * consuming thread and hands each result to every cursor still expecting its
 * key. A result nobody expects is dropped, which is how stale results for
 * pages the user already left are discarded.
 *
 * <p>With a delivery executor (normally {@code SwingUtilities::invokeLater})
 * a drain is scheduled on it after each publish, coalesced so that a burst of
 * results costs one hop. Without one the owner calls {@link #drain()} itself.
 */
@Slf4j
public final class ResultRouter {

    private final Queue<LoadResult> queue = new ConcurrentLinkedQueue<>();
    private final List<ConsumerCursor> cursors = new CopyOnWriteArrayList<>();
    private final Executor deliveryExecutor;
    private final AtomicBoolean drainScheduled = new AtomicBoolean();

    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    /** Router drained by its owner. */
    public ResultRouter() {
        this(null);
    }

    public ResultRouter(Executor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
    }

    public ConsumerCursor register(ConsumerCursor cursor) {
        cursors.add(cursor);
        return cursor;
    }

    public void unregister(ConsumerCursor cursor) {
        cursors.remove(cursor);
    }

    /** Safe from any thread. */
    public void publish(LoadResult result) {
        if (result == null) return;
        queue.add(result);
        if (deliveryExecutor != null && drainScheduled.compareAndSet(false, true)) {
            deliveryExecutor.execute(() -> {
                drainScheduled.set(false);
                drain();
            });
        }
    }

    /**
     * Deliver everything queued so far.
     *
     * @return number of results handed to at least one cursor
     */
    public int drain() {
        int delivered = 0;
        LoadResult result;
        while ((result = queue.poll()) != null) {
            boolean matched = false;
            for (ConsumerCursor cursor : cursors) {
                if (!cursor.wants(result.key())) continue;
                matched = true;
                try {
                    cursor.deliver(result);
                } catch (RuntimeException e) {
                    log.error("Consumer {} failed handling {}", cursor.name(), result.key(), e);
                }
            }
            if (matched) {
                delivered++;
                deliveredCount.incrementAndGet();
            } else {
                droppedCount.incrementAndGet();
                log.debug("Dropped stale result for {}", result.key());
            }
        }
        return delivered;
    }

    public int pendingCount() {
        return queue.size();
    }

    public long deliveredCount() {
        return deliveredCount.get();
    }

    public long droppedCount() {
        return droppedCount.get();
    }
}
