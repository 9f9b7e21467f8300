package dev.nuclr.plugin.core.zip.viewer.backend;

import lombok.experimental.UtilityClass;

import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Aspect-preserving downscaling. Never upscales.
 *
 * <p>FAST draws once with nearest-neighbour sampling. QUALITY halves the image
 * with bilinear steps until within 2x of the target, then finishes with one
 * bicubic pass. Both are deterministic.
 */
@UtilityClass
public class ImageResampler {

    public enum Quality {
        FAST, QUALITY
    }

    /** Size of {@code width x height} scaled to fit inside the box. */
    public static Dimension fitWithin(int width, int height, int maxWidth, int maxHeight) {
        double scale = Math.min((double) maxWidth / width, (double) maxHeight / height);
        if (scale >= 1.0) {
            return new Dimension(width, height);
        }
        int w = Math.max(1, (int) Math.round(width * scale));
        int h = Math.max(1, (int) Math.round(height * scale));
        return new Dimension(w, h);
    }

    /** A new image fitting inside the box. The source is never modified. */
    public static BufferedImage resample(BufferedImage src, int maxWidth, int maxHeight, Quality quality) {
        Dimension target = fitWithin(src.getWidth(), src.getHeight(), maxWidth, maxHeight);
        int type = src.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;

        if (target.width == src.getWidth() && target.height == src.getHeight()) {
            return draw(src, target.width, target.height, type, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
        }
        if (quality == Quality.FAST) {
            return draw(src, target.width, target.height, type, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
        }

        BufferedImage current = src;
        int w = src.getWidth();
        int h = src.getHeight();
        while (w / 2 >= target.width && h / 2 >= target.height) {
            w /= 2;
            h /= 2;
            current = draw(current, w, h, type, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        }
        return draw(current, target.width, target.height, type, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
    }

    private static BufferedImage draw(BufferedImage src, int w, int h, int type, Object interpolation) {
        BufferedImage dst = new BufferedImage(w, h, type);
        Graphics2D g2 = dst.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
            g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2.drawImage(src, 0, 0, w, h, null);
        } finally {
            g2.dispose();
        }
        return dst;
    }
}
