package dev.nuclr.plugin.core.zip.viewer.backend;

import java.awt.Dimension;
import java.awt.image.BufferedImage;

/**
 * Strategy interface for turning encoded image bytes into pixels.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface DecoderBackend {

    /** Human-readable name for logging. */
    String name();

    /** Return true if this backend can be used on the current system. */
    boolean isAvailable();

    /**
     * Decode the first frame of an encoded image.
     *
     * @param data encoded bytes of one archive member
     * @return decoded pixels, orientation not yet applied
     * @throws UnsupportedImageException if the data is not a format this backend reads
     * @throws Exception                 for I/O or codec errors
     */
    BufferedImage decode(byte[] data) throws Exception;

    /**
     * Pixel size read from the image header, without decoding pixels.
     * Returns null when the header cannot be read.
     */
    default Dimension probeSize(byte[] data) {
        return null;
    }

    /** Thrown when no reader recognises the data. */
    class UnsupportedImageException extends Exception {
        public UnsupportedImageException(String message) {
            super(message);
        }
    }
}
