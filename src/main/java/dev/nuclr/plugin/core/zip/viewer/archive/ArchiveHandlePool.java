package dev.nuclr.plugin.core.zip.viewer.archive;

import dev.nuclr.plugin.core.zip.viewer.DecodeException;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps a bounded number of archives open, closing the least recently used
 * one when the bound is exceeded.
 *
 * <p>Handles are reference counted: a handle evicted or released while a
 * {@link Lease} still holds it is closed when that lease is returned, so no
 * handle is ever closed under a running read. Archives are opened outside the
 * pool lock; only the bookkeeping is locked.
 */
@Slf4j
public final class ArchiveHandlePool implements AutoCloseable {

    public static final int DEFAULT_MAX_OPEN = 10;

    private final ReentrantLock lock = new ReentrantLock();
    private final int maxOpen;

    // Guarded by lock. Access order: eldest first.
    private final LinkedHashMap<String, ArchiveHandle> open = new LinkedHashMap<>(16, 0.75f, true);

    public ArchiveHandlePool() {
        this(DEFAULT_MAX_OPEN);
    }

    public ArchiveHandlePool(int maxOpen) {
        if (maxOpen <= 0) throw new IllegalArgumentException("maxOpen must be positive, got " + maxOpen);
        this.maxOpen = maxOpen;
    }

    /**
     * Borrow the handle for {@code path}, opening it if needed. The lease must
     * be closed when the caller is done reading.
     */
    public Lease acquire(Path path) throws ArchiveOpenException {
        String key = CacheKey.normalize(path);

        lock.lock();
        try {
            ArchiveHandle existing = open.get(key);
            if (existing != null) {
                existing.refCount++;
                return new Lease(existing);
            }
        } finally {
            lock.unlock();
        }

        ArchiveHandle fresh = ArchiveHandle.open(Path.of(key));

        List<ArchiveHandle> toClose = new ArrayList<>();
        ArchiveHandle handle;
        lock.lock();
        try {
            handle = open.get(key);
            if (handle == null) {
                handle = fresh;
                open.put(key, handle);
                evictOverflow(toClose);
            } else {
                // Lost an open race; keep the winner
                toClose.add(fresh);
            }
            handle.refCount++;
        } finally {
            lock.unlock();
        }
        toClose.forEach(ArchiveHandle::close);
        return new Lease(handle);
    }

    /** Close and forget one archive. Deferred if a lease is still out. */
    public void release(Path path) {
        String key = CacheKey.normalize(path);
        ArchiveHandle toClose = null;
        lock.lock();
        try {
            ArchiveHandle handle = open.remove(key);
            if (handle != null && retire(handle)) toClose = handle;
        } finally {
            lock.unlock();
        }
        if (toClose != null) toClose.close();
    }

    /** Close every archive. Handles with leases out close on return. */
    public void closeAll() {
        List<ArchiveHandle> toClose = new ArrayList<>();
        lock.lock();
        try {
            for (ArchiveHandle handle : open.values()) {
                if (retire(handle)) toClose.add(handle);
            }
            open.clear();
        } finally {
            lock.unlock();
        }
        toClose.forEach(ArchiveHandle::close);
        log.debug("Closed {} archive handles", toClose.size());
    }

    @Override
    public void close() {
        closeAll();
    }

    public int openCount() {
        lock.lock();
        try {
            return open.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen(Path path) {
        String key = CacheKey.normalize(path);
        lock.lock();
        try {
            return open.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int maxOpen() {
        return maxOpen;
    }

    // ---------------------------------------------------------------- helpers

    /** Must be called with lock held. */
    private void evictOverflow(List<ArchiveHandle> toClose) {
        Iterator<ArchiveHandle> it = open.values().iterator();
        while (open.size() > maxOpen && it.hasNext()) {
            ArchiveHandle eldest = it.next();
            it.remove();
            log.debug("Evicting archive handle {}", eldest.path());
            if (retire(eldest)) toClose.add(eldest);
        }
    }

    /** Must be called with lock held. Returns true if the handle can be closed now. */
    private static boolean retire(ArchiveHandle handle) {
        handle.retired = true;
        return handle.refCount == 0;
    }

    private void giveBack(ArchiveHandle handle) {
        boolean closeNow;
        lock.lock();
        try {
            handle.refCount--;
            closeNow = handle.retired && handle.refCount == 0;
        } finally {
            lock.unlock();
        }
        if (closeNow) handle.close();
    }

    // ---------------------------------------------------------------- lease

    /**
     * A borrowed archive handle. Reads go through the lease; closing it hands
     * the handle back to the pool.
     */
    public final class Lease implements AutoCloseable {

        private final ArchiveHandle handle;
        private final AtomicBoolean returned = new AtomicBoolean();

        private Lease(ArchiveHandle handle) {
            this.handle = handle;
        }

        public Path path() {
            return handle.path();
        }

        public Instant lastModified() {
            return handle.lastModified();
        }

        public List<String> members() {
            return handle.members();
        }

        public long memberSize(String name) throws DecodeException {
            return handle.memberSize(name);
        }

        public byte[] readMember(String name, long maxBytes) throws DecodeException {
            return handle.readMember(name, maxBytes);
        }

        ArchiveHandle handle() {
            return handle;
        }

        @Override
        public void close() {
            if (returned.compareAndSet(false, true)) {
                giveBack(handle);
            }
        }
    }
}
