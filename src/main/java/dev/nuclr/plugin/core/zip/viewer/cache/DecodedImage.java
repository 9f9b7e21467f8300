package dev.nuclr.plugin.core.zip.viewer.cache;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.util.Objects;

/**
 * A fully decoded image held by the cache.
 *
 * <p>The wrapped {@link BufferedImage} is shared between the cache and every
 * consumer and must be treated as read-only. Use {@link #copy()} for a private,
 * mutable copy.
 */
public final class DecodedImage {

    static final long FIXED_OVERHEAD_BYTES = 1024;

    private final BufferedImage image;
    private final int channels;
    private final int bytesPerChannel;
    private final long sourceBytes;

    public DecodedImage(BufferedImage image) {
        this(image, -1);
    }

    /**
     * @param sourceBytes size of the encoded member this image was decoded
     *                    from, or -1 when unknown
     */
    public DecodedImage(BufferedImage image, long sourceBytes) {
        this.image = Objects.requireNonNull(image, "image");
        this.sourceBytes = sourceBytes;
        ColorModel cm = image.getColorModel();
        this.channels = cm.getNumComponents();
        int bits = image.getSampleModel().getSampleSize(0);
        this.bytesPerChannel = Math.max(1, (bits + 7) / 8);
    }

    public BufferedImage image() {
        return image;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    public int channels() {
        return channels;
    }

    public int bytesPerChannel() {
        return bytesPerChannel;
    }

    /** Encoded size of the member behind this image, -1 when unknown. */
    public long sourceBytes() {
        return sourceBytes;
    }

    public boolean hasAlpha() {
        return image.getColorModel().hasAlpha();
    }

    /** L, LA, RGB or RGBA. */
    public String colorMode() {
        boolean alpha = hasAlpha();
        if (channels <= 2) return alpha ? "LA" : "L";
        return alpha ? "RGBA" : "RGB";
    }

    /** Approximate heap footprint: pixels times channels times sample width, plus overhead. */
    public long estimatedBytes() {
        return (long) width() * height() * channels * bytesPerChannel + FIXED_OVERHEAD_BYTES;
    }

    /** True when the pixel raster exists and has a usable size. */
    public boolean isMaterialized() {
        return image.getRaster() != null && width() > 0 && height() > 0;
    }

    public DecodedImage copy() {
        ColorModel cm = image.getColorModel();
        BufferedImage copy = new BufferedImage(cm, image.copyData(null), cm.isAlphaPremultiplied(), null);
        return new DecodedImage(copy, sourceBytes);
    }

    @Override
    public String toString() {
        return width() + "x" + height() + " " + colorMode();
    }
}
