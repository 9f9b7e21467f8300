package dev.nuclr.plugin.core.zip.viewer.backend;

import dev.nuclr.plugin.core.zip.viewer.DecodeException;
import dev.nuclr.plugin.core.zip.viewer.ErrorKind;
import dev.nuclr.plugin.core.zip.viewer.Sizes;
import dev.nuclr.plugin.core.zip.viewer.ViewerSettings;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey.Variant;
import dev.nuclr.plugin.core.zip.viewer.cache.DecodedImage;
import lombok.extern.slf4j.Slf4j;

import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Encoded bytes in, upright pixels out.
 *
 * <p>Steps: size checks, header probe against the pixel budget, backend
 * decode (with one retry on the portable backend), EXIF orientation, and an
 * optional aspect-preserving downscale. Holds no mutable state besides the
 * performance flag, so the same input always yields the same pixels.
 */
@Slf4j
public class ImageDecoder {

    /** Twice the 89.5 MP budget above which images are treated as decompression bombs. */
    public static final long DEFAULT_MAX_PIXELS = 178_956_970L;

    private final DecoderBackend backend;
    private final DecoderBackend fallback;
    private final long maxPixels;
    private volatile boolean performanceMode;

    public ImageDecoder() {
        this(new ImageIoBackend());
    }

    public ImageDecoder(DecoderBackend backend) {
        this(backend, DEFAULT_MAX_PIXELS);
    }

    public ImageDecoder(DecoderBackend backend, long maxPixels) {
        this.backend = backend;
        this.fallback = backend instanceof ImageIoBackend ? null : new ImageIoBackend();
        this.maxPixels = maxPixels;
    }

    /** Pick the backend once at startup, falling back to ImageIO when a CLI tool is missing. */
    public static ImageDecoder forSettings(ViewerSettings settings) {
        ImageDecoder decoder = new ImageDecoder(selectBackend(settings.getBackend()));
        decoder.setPerformanceMode(settings.isPerformanceMode());
        log.info("Image decoder backend: {}", decoder.backendName());
        return decoder;
    }

    static DecoderBackend selectBackend(ViewerSettings.Backend choice) {
        return switch (choice) {
            case IMAGEIO -> new ImageIoBackend();
            case AUTO -> {
                CliBackend cli = CliBackend.detect();
                yield cli != null ? cli : new ImageIoBackend();
            }
            case CLI_MAGICK -> {
                CliBackend cli = CliBackend.forTool(CliBackend.Tool.MAGICK);
                yield cli != null ? cli : new ImageIoBackend();
            }
            case CLI_GRAPHICSMAGICK -> {
                CliBackend cli = CliBackend.forTool(CliBackend.Tool.GRAPHICSMAGICK);
                yield cli != null ? cli : new ImageIoBackend();
            }
        };
    }

    public String backendName() {
        return backend.name();
    }

    public boolean isPerformanceMode() {
        return performanceMode;
    }

    public void setPerformanceMode(boolean performanceMode) {
        this.performanceMode = performanceMode;
    }

    // ------------------------------------------------------------ decode

    /**
     * Decode one member's bytes.
     *
     * @param data    encoded bytes
     * @param maxSize largest accepted input, in bytes
     * @param variant ORIGINAL for full resolution, otherwise the box to fit in
     */
    public DecodedImage decode(byte[] data, long maxSize, Variant variant) throws DecodeException {
        if (data == null || data.length == 0) {
            throw new DecodeException(ErrorKind.MEMBER_EMPTY, "Image file empty");
        }
        if (data.length > maxSize) {
            throw new DecodeException(ErrorKind.MEMBER_TOO_LARGE,
                    "Too large (" + Sizes.format(data.length) + " > " + Sizes.format(maxSize) + ")");
        }

        try {
            checkPixelBudget(probe(data));
            BufferedImage img = decodeWithFallback(data);
            checkPixelBudget(new Dimension(img.getWidth(), img.getHeight()));

            img = ImageOrientation.apply(normalize(img), ImageOrientation.read(data));
            DecodedImage decoded = new DecodedImage(img, data.length);
            return variant.isOriginal() ? decoded : resample(decoded, variant);
        } catch (OutOfMemoryError e) {
            log.warn("Out of memory decoding {} image", Sizes.format(data.length));
            throw new DecodeException(ErrorKind.OUT_OF_MEMORY, "Out of memory", e);
        }
    }

    /**
     * Derive a bounded variant from an already decoded image. The source is
     * not modified; ORIGINAL returns a copy.
     */
    public DecodedImage resample(DecodedImage source, Variant variant) {
        if (variant.isOriginal()) {
            return source.copy();
        }
        ImageResampler.Quality quality = performanceMode ? ImageResampler.Quality.FAST : ImageResampler.Quality.QUALITY;
        return new DecodedImage(ImageResampler.resample(source.image(), variant.width(), variant.height(), quality),
                source.sourceBytes());
    }

    // ------------------------------------------------------------ helpers

    private Dimension probe(byte[] data) {
        Dimension size = backend.probeSize(data);
        if (size == null && fallback != null) size = fallback.probeSize(data);
        return size;
    }

    private void checkPixelBudget(Dimension size) throws DecodeException {
        if (size == null) return;
        long pixels = (long) size.width * size.height;
        if (pixels > maxPixels) {
            throw new DecodeException(ErrorKind.DECOMPRESSION_BOMB,
                    "Decompression bomb: " + size.width + "x" + size.height + " exceeds " + maxPixels + " pixels");
        }
    }

    private BufferedImage decodeWithFallback(byte[] data) throws DecodeException {
        try {
            return backend.decode(data);
        } catch (Exception e) {
            if (fallback == null) {
                throw unsupported(e);
            }
            log.warn("{} failed ({}); falling back to {}", backend.name(), e.getMessage(), fallback.name());
        }
        try {
            return fallback.decode(data);
        } catch (Exception e) {
            throw unsupported(e);
        }
    }

    private static DecodeException unsupported(Exception e) {
        return new DecodeException(ErrorKind.UNSUPPORTED_FORMAT, "Invalid image format: " + e.getMessage(), e);
    }

    /** Indexed and custom layouts become packed RGB(A) so size estimates and drawing are uniform. */
    private static BufferedImage normalize(BufferedImage img) {
        int type = img.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_INT_ARGB
                || type == BufferedImage.TYPE_3BYTE_BGR || type == BufferedImage.TYPE_4BYTE_ABGR
                || type == BufferedImage.TYPE_BYTE_GRAY) {
            return img;
        }
        int target = img.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage converted = new BufferedImage(img.getWidth(), img.getHeight(), target);
        Graphics2D g2 = converted.createGraphics();
        try {
            g2.drawImage(img, 0, 0, null);
        } finally {
            g2.dispose();
        }
        return converted;
    }
}
