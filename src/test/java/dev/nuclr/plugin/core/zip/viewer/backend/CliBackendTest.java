package dev.nuclr.plugin.core.zip.viewer.backend;

import dev.nuclr.plugin.core.zip.viewer.TestArchives;
import dev.nuclr.plugin.core.zip.viewer.ViewerSettings;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CliBackendTest {

    @Test
    void missingTool_fallsBackToImageIo() {
        for (ViewerSettings.Backend choice : ViewerSettings.Backend.values()) {
            DecoderBackend backend = ImageDecoder.selectBackend(choice);
            assertThat(backend).isNotNull();
            assertThat(backend.isAvailable()).isTrue();
        }
    }

    @Test
    void namesCarryTheTool() {
        assertThat(new CliBackend(CliBackend.Tool.MAGICK).name()).isEqualTo("CLI/MAGICK");
        assertThat(new CliBackend(CliBackend.Tool.GRAPHICSMAGICK).name()).isEqualTo("CLI/GRAPHICSMAGICK");
    }

    @Test
    void installedTool_convertsPng() throws Exception {
        CliBackend backend = CliBackend.detect();
        assumeTrue(backend != null, "no ImageMagick or GraphicsMagick on PATH");

        BufferedImage img = backend.decode(TestArchives.png(12, 7, Color.PINK));

        assertThat(img.getWidth()).isEqualTo(12);
        assertThat(img.getHeight()).isEqualTo(7);
    }
}
