package dev.nuclr.plugin.core.zip.viewer.backend;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * EXIF orientation: reading the tag and undoing it on decoded pixels.
 * Values follow the TIFF spec, 1 (upright) to 8.
 */
@Slf4j
@UtilityClass
public class ImageOrientation {

    public static final int NORMAL = 1;

    /** Orientation tag of the encoded image, or {@link #NORMAL} when absent or unreadable. */
    public static int read(byte[] data) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(data));
            ExifIFD0Directory dir = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (dir == null || !dir.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                return NORMAL;
            }
            int value = dir.getInt(ExifIFD0Directory.TAG_ORIENTATION);
            return value >= 1 && value <= 8 ? value : NORMAL;
        } catch (ImageProcessingException | IOException | MetadataException e) {
            log.trace("No orientation metadata: {}", e.getMessage());
            return NORMAL;
        }
    }

    /** True when the orientation swaps width and height. */
    public static boolean swapsAxes(int orientation) {
        return orientation >= 5 && orientation <= 8;
    }

    /**
     * Return an upright copy of {@code src}. Orientation 1 (or anything out of
     * range) returns {@code src} itself.
     */
    public static BufferedImage apply(BufferedImage src, int orientation) {
        if (orientation <= NORMAL || orientation > 8) {
            return src;
        }
        int w = src.getWidth();
        int h = src.getHeight();
        boolean swap = swapsAxes(orientation);
        int dw = swap ? h : w;
        int dh = swap ? w : h;

        int[] in = src.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[in.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                out[destIndex(orientation, x, y, w, h, dw)] = in[y * w + x];
            }
        }

        int type = src.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage dst = new BufferedImage(dw, dh, type);
        dst.setRGB(0, 0, dw, dh, out, 0, dw);
        return dst;
    }

    private static int destIndex(int orientation, int x, int y, int w, int h, int dw) {
        return switch (orientation) {
            case 2 -> y * dw + (w - 1 - x);
            case 3 -> (h - 1 - y) * dw + (w - 1 - x);
            case 4 -> (h - 1 - y) * dw + x;
            case 5 -> x * dw + y;
            case 6 -> x * dw + (h - 1 - y);
            case 7 -> (w - 1 - x) * dw + (h - 1 - y);
            default -> (w - 1 - x) * dw + y;
        };
    }
}
