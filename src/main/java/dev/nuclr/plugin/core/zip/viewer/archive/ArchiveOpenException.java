package dev.nuclr.plugin.core.zip.viewer.archive;

import dev.nuclr.plugin.core.zip.viewer.ErrorKind;
import lombok.Getter;

import java.nio.file.Path;

/**
 * An archive could not be opened. The pool never retries; the next
 * {@link ArchiveHandlePool#acquire(Path)} tries afresh.
 */
@Getter
public class ArchiveOpenException extends Exception {

    public enum Reason {
        NOT_FOUND(ErrorKind.ARCHIVE_NOT_FOUND),
        NOT_AN_ARCHIVE(ErrorKind.ARCHIVE_INVALID),
        PERMISSION_DENIED(ErrorKind.ARCHIVE_PERMISSION_DENIED);

        private final ErrorKind errorKind;

        Reason(ErrorKind errorKind) {
            this.errorKind = errorKind;
        }

        public ErrorKind errorKind() {
            return errorKind;
        }
    }

    private final Path path;
    private final Reason reason;

    public ArchiveOpenException(Path path, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.reason = reason;
    }

    public ErrorKind errorKind() {
        return reason.errorKind();
    }
}
