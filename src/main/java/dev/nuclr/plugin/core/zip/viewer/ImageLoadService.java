package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.archive.ArchiveHandlePool;
import dev.nuclr.plugin.core.zip.viewer.archive.ArchiveOpenException;
import dev.nuclr.plugin.core.zip.viewer.backend.ImageDecoder;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey.Variant;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheStore;
import dev.nuclr.plugin.core.zip.viewer.cache.DecodedImage;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Turns load requests into decoded images: cache lookup, de-duplicated decode
 * on a bounded worker pool, cache insert, variant production and result
 * publication.
 *
 * <p>{@link #submit(LoadRequest)} never blocks on I/O and is safe to call from
 * the EDT. The full-resolution decode of a member is always cached under its
 * ORIGINAL key before any smaller variant is derived from it, so a result the
 * UI no longer wants still pays off on the next request for that member.
 *
 * <p>Concurrent requests for the same member share one decode. Nothing is
 * retried automatically; a retry is a new request with {@code forceReload}.
 */
@Slf4j
public class ImageLoadService implements AutoCloseable {

    private final CacheStore cache;
    private final ArchiveHandlePool archives;
    private final ImageDecoder decoder;
    private final Consumer<LoadResult> resultSink;
    private final ThreadPoolExecutor executor;

    /** Guards inFlight and every Flight's waiters, task and limit. */
    private final ReentrantLock flightLock = new ReentrantLock();
    private final Map<CacheKey, Flight> inFlight = new HashMap<>();

    private final AtomicLong taskSequence = new AtomicLong();
    private final AtomicLong decodeCount = new AtomicLong();

    private volatile boolean closed;

    public ImageLoadService(CacheStore cache,
                            ArchiveHandlePool archives,
                            ImageDecoder decoder,
                            int workers,
                            Consumer<LoadResult> resultSink) {
        if (workers <= 0) throw new IllegalArgumentException("workers must be positive, got " + workers);
        this.cache = cache;
        this.archives = archives;
        this.decoder = decoder;
        this.resultSink = resultSink != null ? resultSink : r -> {};
        this.executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<>(), new WorkerThreadFactory());
    }

    // ------------------------------------------------------------ public API

    /**
     * Submit a request. Cache hits on the full-resolution image complete
     * before this method returns; everything else completes on a worker.
     */
    public LoadHandle submit(LoadRequest request) {
        CacheKey key = request.key();
        CacheKey originalKey = key.toOriginal();

        if (closed) {
            return LoadHandle.completed(closedResult(key), request.priority());
        }
        if (!request.forceReload()) {
            if (!key.variant().isOriginal() && request.storeVariant()) {
                Optional<DecodedImage> variant = cache.get(key);
                if (variant.isPresent()) {
                    log.debug("Cache hit: {}", key);
                    return deliverNow(checkedSuccess(request, variant.get()), request.priority());
                }
            }
            Optional<DecodedImage> original = cache.get(originalKey);
            if (original.isPresent()) {
                log.debug("Cache hit: {}", originalKey);
                if (key.variant().isOriginal()) {
                    return deliverNow(checkedSuccess(request, original.get()), request.priority());
                }
                return dispatchVariant(request, original.get());
            }
        }
        return dispatchDecode(request, originalKey);
    }

    public boolean isInFlight(CacheKey key) {
        flightLock.lock();
        try {
            return inFlight.containsKey(key.toOriginal());
        } finally {
            flightLock.unlock();
        }
    }

    public int inFlightCount() {
        flightLock.lock();
        try {
            return inFlight.size();
        } finally {
            flightLock.unlock();
        }
    }

    /** Number of decodes from archive bytes since start. */
    public long decodeCount() {
        return decodeCount.get();
    }

    public int queuedTaskCount() {
        return executor.getQueue().size();
    }

    /**
     * Stop the workers and close every pooled archive handle. Loads still
     * queued complete with a failed result; later submits fail immediately.
     */
    @Override
    public void close() {
        closed = true;
        List<Runnable> dropped = executor.shutdownNow();
        for (Runnable r : dropped) {
            if (r instanceof PrioritizedTask task) {
                task.drop();
            }
        }
        if (!dropped.isEmpty()) {
            log.debug("Dropped {} queued load(s) on close", dropped.size());
        }
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Image load workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        flightLock.lock();
        try {
            inFlight.values().forEach(f -> f.decoded.completeExceptionally(new CancellationException("Loader closed")));
            inFlight.clear();
        } finally {
            flightLock.unlock();
        }
        archives.closeAll();
    }

    // ------------------------------------------------------ dispatch paths

    private LoadHandle deliverNow(LoadResult result, LoadRequest.Priority priority) {
        publish(result);
        return LoadHandle.completed(result, priority);
    }

    /** Original already cached; derive the variant off the calling thread. */
    private LoadHandle dispatchVariant(LoadRequest request, DecodedImage original) {
        CompletableFuture<LoadResult> result = new CompletableFuture<>();
        PrioritizedTask task = new PrioritizedTask(request.priority(), taskSequence.incrementAndGet(),
                () -> {
                    if (result.isDone()) return;
                    result.complete(guarded(request.key(), () -> produceVariant(request, original)));
                },
                () -> result.complete(closedResult(request.key())));
        result.thenAccept(this::publish);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            task.drop();
        }
        return new LoadHandle(request.key(), request.priority(), result, () -> executor.remove(task));
    }

    /** Cache miss or forced reload: join the member's decode, starting it if needed. */
    private LoadHandle dispatchDecode(LoadRequest request, CacheKey originalKey) {
        Flight flight;
        boolean created = false;
        flightLock.lock();
        try {
            flight = inFlight.get(originalKey);
            if (flight != null && request.maxByteSize() > flight.maxByteSize) {
                if (flight.started) {
                    // Its reader already runs under the smaller limit; decode again for this one.
                    flight = null;
                } else {
                    flight.maxByteSize = request.maxByteSize();
                }
            }
            if (flight == null) {
                flight = new Flight(request, originalKey);
                inFlight.put(originalKey, flight);
                created = true;
            }
            flight.waiters++;
        } finally {
            flightLock.unlock();
        }

        if (created) {
            flight.schedule(request.priority());
        } else {
            log.debug("Joining in-flight decode of {}", originalKey);
            if (request.priority() == LoadRequest.Priority.NORMAL) flight.escalate();
        }

        CompletableFuture<LoadResult> result = flight.decoded.handle((original, error) ->
                error != null
                        ? failure(request.key(), error)
                        : guarded(request.key(), () -> produceVariant(request, original)));
        result.thenAccept(this::publish);

        Flight joined = flight;
        return new LoadHandle(request.key(), request.priority(), result, () -> leave(joined));
    }

    // ----------------------------------------------------------- worker side

    private DecodedImage decodeOriginal(LoadRequest request, CacheKey originalKey, long maxByteSize)
            throws ArchiveOpenException, DecodeException {
        byte[] data;
        try (ArchiveHandlePool.Lease lease = archives.acquire(request.archive())) {
            data = lease.readMember(request.memberName(), maxByteSize);
        }
        decodeCount.incrementAndGet();
        DecodedImage image = decoder.decode(data, maxByteSize, Variant.ORIGINAL);
        cache.put(originalKey, image);
        log.debug("Decoded {} ({})", originalKey, image);
        return image;
    }

    private LoadResult produceVariant(LoadRequest request, DecodedImage original) {
        CacheKey key = request.key();
        if (key.variant().isOriginal() || exceedsLimit(request, original)) {
            return checkedSuccess(request, original);
        }
        DecodedImage derived = decoder.resample(original, key.variant());
        if (request.storeVariant()) {
            cache.put(key, derived);
        }
        return LoadResult.success(key, derived);
    }

    /** Runs a step and converts anything it throws into a failed result. */
    private LoadResult guarded(CacheKey key, ResultStep step) {
        try {
            return step.run();
        } catch (Throwable t) {
            return failure(key, t);
        }
    }

    /**
     * A shared or cached image may come from a member larger than this
     * request accepts; such a request still fails as too large.
     */
    private LoadResult checkedSuccess(LoadRequest request, DecodedImage image) {
        if (exceedsLimit(request, image)) {
            log.debug("Member {} exceeds request limit {}", request.memberName(), request.maxByteSize());
            return LoadResult.failure(request.key(), ErrorKind.MEMBER_TOO_LARGE,
                    "Too large (" + Sizes.format(image.sourceBytes()) + " > "
                            + Sizes.format(request.maxByteSize()) + "): " + request.memberName());
        }
        return LoadResult.success(request.key(), image);
    }

    private static boolean exceedsLimit(LoadRequest request, DecodedImage image) {
        return image.sourceBytes() > request.maxByteSize();
    }

    private static LoadResult closedResult(CacheKey key) {
        return LoadResult.failure(key, ErrorKind.UNEXPECTED, "Loader closed");
    }

    private LoadResult failure(CacheKey key, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof DecodeException de) {
            log.debug("Load failed for {}: {}", key, de.getMessage());
            return LoadResult.failure(key, de.getKind(), de.getMessage());
        }
        if (cause instanceof ArchiveOpenException ae) {
            log.debug("Archive open failed for {}: {}", key, ae.getMessage());
            return LoadResult.failure(key, ae.errorKind(), ae.getMessage());
        }
        if (cause instanceof OutOfMemoryError) {
            log.warn("Out of memory loading {}", key);
            return LoadResult.failure(key, ErrorKind.OUT_OF_MEMORY, ErrorKind.OUT_OF_MEMORY.description());
        }
        if (cause instanceof RejectedExecutionException) {
            return closedResult(key);
        }
        if (cause instanceof CancellationException) {
            return LoadResult.failure(key, ErrorKind.UNEXPECTED, "Load cancelled");
        }
        log.error("Unexpected failure loading {}", key, cause);
        return LoadResult.failure(key, ErrorKind.UNEXPECTED, "Load error: " + cause.getClass().getSimpleName());
    }

    private void publish(LoadResult result) {
        try {
            resultSink.accept(result);
        } catch (RuntimeException e) {
            log.error("Result sink failed for {}", result.key(), e);
        }
    }

    /** A cancelled handle gives up its interest; the decode goes only when nobody waits and it has not started. */
    private void leave(Flight flight) {
        boolean drop = false;
        flightLock.lock();
        try {
            flight.waiters--;
            if (flight.waiters == 0 && flight.task != null && executor.remove(flight.task)) {
                inFlight.remove(flight.originalKey, flight);
                drop = true;
            }
        } finally {
            flightLock.unlock();
        }
        if (drop) {
            log.debug("Dropped queued decode of {}", flight.originalKey);
            flight.decoded.cancel(false);
        }
    }

    // ----------------------------------------------------------------- types

    @FunctionalInterface
    private interface ResultStep {
        LoadResult run() throws Exception;
    }

    /** One decode of one member, shared by every request that wants it. */
    private final class Flight {

        final LoadRequest request;
        final CacheKey originalKey;
        final CompletableFuture<DecodedImage> decoded = new CompletableFuture<>();

        // Guarded by flightLock
        int waiters;
        PrioritizedTask task;
        LoadRequest.Priority priority;
        long maxByteSize;
        boolean started;

        Flight(LoadRequest request, CacheKey originalKey) {
            this.request = request;
            this.originalKey = originalKey;
            this.maxByteSize = request.maxByteSize();
        }

        void schedule(LoadRequest.Priority taskPriority) {
            PrioritizedTask next = new PrioritizedTask(taskPriority, taskSequence.incrementAndGet(), this::run,
                    () -> decoded.completeExceptionally(new CancellationException("Loader closed")));
            flightLock.lock();
            try {
                task = next;
                priority = taskPriority;
            } finally {
                flightLock.unlock();
            }
            try {
                executor.execute(next);
            } catch (RejectedExecutionException e) {
                flightLock.lock();
                try {
                    inFlight.remove(originalKey, this);
                } finally {
                    flightLock.unlock();
                }
                decoded.completeExceptionally(e);
            }
        }

        /** Re-queue a waiting preload decode at interactive priority. */
        void escalate() {
            boolean requeue;
            flightLock.lock();
            try {
                requeue = priority == LoadRequest.Priority.PRELOAD && task != null && executor.remove(task);
            } finally {
                flightLock.unlock();
            }
            if (requeue) {
                log.debug("Escalating preload of {} to NORMAL", originalKey);
                schedule(LoadRequest.Priority.NORMAL);
            }
        }

        private void run() {
            long limit;
            flightLock.lock();
            try {
                started = true;
                limit = maxByteSize;
            } finally {
                flightLock.unlock();
            }
            try {
                decoded.complete(decodeOriginal(request, originalKey, limit));
            } catch (ArchiveOpenException | DecodeException e) {
                decoded.completeExceptionally(e);
            } catch (Throwable t) {
                if (!(t instanceof OutOfMemoryError)) {
                    log.error("Worker failed decoding {}", originalKey, t);
                }
                decoded.completeExceptionally(t);
            } finally {
                flightLock.lock();
                try {
                    inFlight.remove(originalKey, this);
                } finally {
                    flightLock.unlock();
                }
            }
        }
    }

    /** Orders the work queue: NORMAL before PRELOAD, FIFO within a priority. */
    static final class PrioritizedTask extends FutureTask<Void> implements Comparable<PrioritizedTask> {

        final LoadRequest.Priority priority;
        final long sequence;
        private final Runnable onDrop;

        PrioritizedTask(LoadRequest.Priority priority, long sequence, Runnable body, Runnable onDrop) {
            super(body, null);
            this.priority = priority;
            this.sequence = sequence;
            this.onDrop = onDrop;
        }

        /** Called instead of running when the pool discards this task. */
        void drop() {
            cancel(false);
            onDrop.run();
        }

        @Override
        public int compareTo(PrioritizedTask other) {
            int byPriority = priority.compareTo(other.priority);
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "zip-load-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
