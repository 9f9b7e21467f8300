package dev.nuclr.plugin.core.zip.viewer;

import lombok.Getter;

/**
 * A typed failure while reading or decoding one archive member.
 */
@Getter
public class DecodeException extends Exception {

    private final ErrorKind kind;

    public DecodeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DecodeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
