package dev.nuclr.plugin.core.zip.viewer.backend;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Portable decoding through javax.imageio.
 * Always available; no external tools required.
 */
@Slf4j
public class ImageIoBackend implements DecoderBackend {

    @Override
    public String name() {
        return "ImageIO";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public BufferedImage decode(byte[] data) throws Exception {
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(data));
        if (img == null) {
            throw new UnsupportedImageException("No ImageIO reader for this data");
        }
        log.trace("ImageIO decoded {}x{}", img.getWidth(), img.getHeight());
        return img;
    }

    @Override
    public Dimension probeSize(byte[] data) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            if (in == null) return null;
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) return null;
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.trace("Header probe failed: {}", e.getMessage());
            return null;
        }
    }
}
