package dev.nuclr.plugin.core.zip.viewer.archive;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of validating one archive.
 *
 * @param members     image members in natural order; empty unless valid
 * @param lastModified null when the file could not be stat'ed
 * @param fileSize    -1 when the file could not be stat'ed
 */
public record ArchiveInfo(
        Path path,
        boolean valid,
        List<String> members,
        Instant lastModified,
        long fileSize,
        int imageCount) {

    public ArchiveInfo {
        members = List.copyOf(members);
    }

    static ArchiveInfo invalid(Path path, Instant lastModified, long fileSize, int imageCount) {
        return new ArchiveInfo(path, false, List.of(), lastModified, fileSize, imageCount);
    }

    /** The member shown as the archive's preview, if any. */
    public String firstMember() {
        return members.isEmpty() ? null : members.get(0);
    }
}
