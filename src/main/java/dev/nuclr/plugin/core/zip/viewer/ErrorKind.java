package dev.nuclr.plugin.core.zip.viewer;

/**
 * Why a load failed. Callers use the kind to pick user-facing text, never to
 * change control flow.
 */
public enum ErrorKind {
    ARCHIVE_NOT_FOUND("Archive not found"),
    ARCHIVE_INVALID("Cannot open ZIP"),
    ARCHIVE_PERMISSION_DENIED("Permission denied"),
    MEMBER_NOT_FOUND("Image not found in archive"),
    MEMBER_EMPTY("Image file empty"),
    MEMBER_TOO_LARGE("Image too large"),
    UNSUPPORTED_FORMAT("Invalid image format"),
    DECOMPRESSION_BOMB("Decompression bomb"),
    OUT_OF_MEMORY("Out of memory"),
    UNEXPECTED("Load error");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
