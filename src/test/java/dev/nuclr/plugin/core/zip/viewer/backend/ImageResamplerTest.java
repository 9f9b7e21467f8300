package dev.nuclr.plugin.core.zip.viewer.backend;

import dev.nuclr.plugin.core.zip.viewer.TestArchives;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class ImageResamplerTest {

    @Test
    void fitWithin_scalesByTighterEdge() {
        assertThat(ImageResampler.fitWithin(1000, 500, 200, 200)).isEqualTo(new Dimension(200, 100));
        assertThat(ImageResampler.fitWithin(500, 1000, 200, 200)).isEqualTo(new Dimension(100, 200));
    }

    @Test
    void fitWithin_neverUpscales() {
        assertThat(ImageResampler.fitWithin(50, 40, 200, 200)).isEqualTo(new Dimension(50, 40));
    }

    @Test
    void fitWithin_keepsAtLeastOnePixel() {
        assertThat(ImageResampler.fitWithin(10_000, 1, 100, 100)).isEqualTo(new Dimension(100, 1));
    }

    @Test
    void bothQualities_hitTheTargetBox() {
        BufferedImage src = TestArchives.solid(640, 480, Color.MAGENTA);

        BufferedImage fast = ImageResampler.resample(src, 160, 160, ImageResampler.Quality.FAST);
        BufferedImage quality = ImageResampler.resample(src, 160, 160, ImageResampler.Quality.QUALITY);

        assertThat(fast.getWidth()).isEqualTo(160);
        assertThat(fast.getHeight()).isEqualTo(120);
        assertThat(quality.getWidth()).isEqualTo(160);
        assertThat(quality.getHeight()).isEqualTo(120);
        assertThat(quality.getRGB(80, 60)).isEqualTo(Color.MAGENTA.getRGB());
    }

    @Test
    void alwaysReturnsNewImage() {
        BufferedImage src = TestArchives.solid(20, 20, Color.GRAY);

        BufferedImage same = ImageResampler.resample(src, 100, 100, ImageResampler.Quality.QUALITY);

        assertThat(same).isNotSameAs(src);
        assertThat(same.getWidth()).isEqualTo(20);
    }
}
