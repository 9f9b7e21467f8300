package dev.nuclr.plugin.core.zip.viewer.archive;

import dev.nuclr.plugin.core.zip.viewer.Sizes;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides whether a ZIP archive contains only images.
 *
 * <p>Validity is all-or-nothing: the first non-image file disqualifies the
 * archive and the collected member list is dropped. Oversized archives and
 * archives with too many entries are rejected up front.
 */
@Slf4j
public class ArchiveScanner {

    public static final long DEFAULT_MAX_ARCHIVE_BYTES = 500 * Sizes.MB;
    public static final int  DEFAULT_MAX_ENTRIES       = 1000;

    private final long maxArchiveBytes;
    private final int maxEntries;

    public ArchiveScanner() {
        this(DEFAULT_MAX_ARCHIVE_BYTES, DEFAULT_MAX_ENTRIES);
    }

    public ArchiveScanner(long maxArchiveBytes, int maxEntries) {
        this.maxArchiveBytes = maxArchiveBytes;
        this.maxEntries = maxEntries;
    }

    /** Never throws; unreadable archives come back invalid. */
    public ArchiveInfo scan(Path path) {
        if (!Files.isRegularFile(path)) {
            return ArchiveInfo.invalid(path, null, -1, 0);
        }

        Instant modified;
        long size;
        try {
            modified = Files.getLastModifiedTime(path).toInstant();
            size = Files.size(path);
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", path, e.getMessage());
            return ArchiveInfo.invalid(path, null, -1, 0);
        }

        if (size > maxArchiveBytes) {
            log.debug("Skipping {}: {} exceeds {}", path, Sizes.format(size), Sizes.format(maxArchiveBytes));
            return ArchiveInfo.invalid(path, modified, size, 0);
        }

        int imageCount = 0;
        try (ZipFile zip = ZipFile.builder().setPath(path).get()) {
            List<ZipArchiveEntry> entries = Collections.list(zip.getEntries());
            if (entries.isEmpty() || entries.size() > maxEntries) {
                return ArchiveInfo.invalid(path, modified, size, 0);
            }

            List<String> members = new ArrayList<>();
            boolean hasFile = false;
            for (ZipArchiveEntry entry : entries) {
                if (entry.isDirectory()) continue;
                hasFile = true;
                if (!ImageExtensions.isImageFile(entry.getName())) {
                    log.debug("{} disqualified by non-image member {}", path.getFileName(), entry.getName());
                    return ArchiveInfo.invalid(path, modified, size, imageCount);
                }
                imageCount++;
                members.add(entry.getName());
            }
            if (!hasFile) {
                return ArchiveInfo.invalid(path, modified, size, 0);
            }

            members.sort(ImageExtensions.NATURAL_ORDER);
            return new ArchiveInfo(path, true, members, modified, size, imageCount);
        } catch (IOException e) {
            log.warn("Cannot read archive {}: {}", path, e.getMessage());
            return ArchiveInfo.invalid(path, modified, size, imageCount);
        }
    }

    /** Scan several archives, keeping only the valid ones, in input order. */
    public List<ArchiveInfo> scanAll(List<Path> paths) {
        List<ArchiveInfo> valid = new ArrayList<>();
        for (Path path : paths) {
            ArchiveInfo info = scan(path);
            if (info.valid()) valid.add(info);
        }
        return valid;
    }
}
