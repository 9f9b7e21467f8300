package dev.nuclr.plugin.core.zip.viewer.archive;

import dev.nuclr.plugin.core.zip.viewer.DecodeException;
import dev.nuclr.plugin.core.zip.viewer.ErrorKind;
import dev.nuclr.plugin.core.zip.viewer.Sizes;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One open ZIP archive. Reads are serialised per handle; the pool decides
 * when the handle is closed.
 */
@Slf4j
public final class ArchiveHandle {

    private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    private final Path path;
    private final ZipFile zip;
    private final Instant lastModified;

    /** Serialises extraction on the underlying channel. */
    private final ReentrantLock readLock = new ReentrantLock();

    // Guarded by the owning pool's lock
    int refCount;
    boolean retired;
    private boolean closed;

    private ArchiveHandle(Path path, ZipFile zip, Instant lastModified) {
        this.path = path;
        this.zip = zip;
        this.lastModified = lastModified;
    }

    static ArchiveHandle open(Path path) throws ArchiveOpenException {
        if (!Files.exists(path)) {
            throw new ArchiveOpenException(path, ArchiveOpenException.Reason.NOT_FOUND,
                    "File not found: " + path, null);
        }
        if (Files.isDirectory(path)) {
            throw new ArchiveOpenException(path, ArchiveOpenException.Reason.NOT_AN_ARCHIVE,
                    "Not a file: " + path, null);
        }
        if (!Files.isReadable(path)) {
            throw new ArchiveOpenException(path, ArchiveOpenException.Reason.PERMISSION_DENIED,
                    "Permission denied: " + path, null);
        }
        try {
            Instant modified = Files.getLastModifiedTime(path).toInstant();
            ZipFile zip = ZipFile.builder().setPath(path).get();
            log.debug("Opened archive {}", path);
            return new ArchiveHandle(path, zip, modified);
        } catch (NoSuchFileException e) {
            throw new ArchiveOpenException(path, ArchiveOpenException.Reason.NOT_FOUND,
                    "File not found: " + path, e);
        } catch (AccessDeniedException e) {
            throw new ArchiveOpenException(path, ArchiveOpenException.Reason.PERMISSION_DENIED,
                    "Permission denied: " + path, e);
        } catch (IOException e) {
            throw new ArchiveOpenException(path, ArchiveOpenException.Reason.NOT_AN_ARCHIVE,
                    "Not a valid ZIP archive: " + path + " (" + e.getMessage() + ")", e);
        }
    }

    public Path path() {
        return path;
    }

    public Instant lastModified() {
        return lastModified;
    }

    /** File members in archive order, directories excluded. */
    public List<String> members() {
        readLock.lock();
        try {
            List<String> names = new ArrayList<>();
            for (ZipArchiveEntry entry : Collections.list(zip.getEntries())) {
                if (!entry.isDirectory()) names.add(entry.getName());
            }
            return names;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Declared uncompressed size of a member, or -1 when the archive does not
     * record it.
     */
    public long memberSize(String name) throws DecodeException {
        readLock.lock();
        try {
            return requireEntry(name).getSize();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Read one member fully. A member whose declared size exceeds
     * {@code maxBytes} is rejected without reading; one that inflates past
     * the limit is rejected rather than truncated.
     */
    public byte[] readMember(String name, long maxBytes) throws DecodeException {
        if (maxBytes <= 0) throw new IllegalArgumentException("maxBytes must be positive");
        readLock.lock();
        try {
            ZipArchiveEntry entry = requireEntry(name);
            long declared = entry.getSize();
            if (declared == 0) {
                throw new DecodeException(ErrorKind.MEMBER_EMPTY, "Image file empty: " + name);
            }
            if (declared > maxBytes) {
                throw tooLarge(name, declared, maxBytes);
            }

            int limit = (int) Math.min(maxBytes, MAX_ARRAY_SIZE);
            try (InputStream in = zip.getInputStream(entry)) {
                byte[] data = in.readNBytes(limit);
                if (in.read() != -1) {
                    throw tooLarge(name, (long) limit + 1, maxBytes);
                }
                if (data.length == 0) {
                    throw new DecodeException(ErrorKind.MEMBER_EMPTY, "Image file empty: " + name);
                }
                return data;
            } catch (IOException e) {
                throw new DecodeException(ErrorKind.ARCHIVE_INVALID,
                        "Cannot read '" + name + "' from " + path.getFileName() + ": " + e.getMessage(), e);
            }
        } finally {
            readLock.unlock();
        }
    }

    synchronized boolean isClosed() {
        return closed;
    }

    /** Called by the pool once no lease holds this handle. */
    synchronized void close() {
        if (closed) return;
        closed = true;
        try {
            zip.close();
            log.debug("Closed archive {}", path);
        } catch (IOException e) {
            log.warn("Error closing archive {}", path, e);
        }
    }

    private ZipArchiveEntry requireEntry(String name) throws DecodeException {
        ZipArchiveEntry entry = zip.getEntry(name);
        if (entry == null || entry.isDirectory()) {
            throw new DecodeException(ErrorKind.MEMBER_NOT_FOUND, "Member '" + name + "' not found");
        }
        return entry;
    }

    private static DecodeException tooLarge(String name, long size, long maxBytes) {
        return new DecodeException(ErrorKind.MEMBER_TOO_LARGE,
                "Too large (" + Sizes.format(size) + " > " + Sizes.format(maxBytes) + "): " + name);
    }
}
