package dev.nuclr.plugin.core.zip.viewer.backend;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Optional decoding through an external converter: ImageMagick (magick) or
 * GraphicsMagick (gm). Reads formats ImageIO does not ship with, such as
 * WebP, AVIF and HEIC. The converter writes PNG, which ImageIO then reads.
 */
@Slf4j
public class CliBackend implements DecoderBackend {

    public enum Tool {
        MAGICK("magick", "-version"),
        GRAPHICSMAGICK("gm", "version");

        final String exe;
        final String versionArg;

        Tool(String exe, String versionArg) {
            this.exe = exe;
            this.versionArg = versionArg;
        }
    }

    private final Tool tool;

    CliBackend(Tool tool) {
        this.tool = tool;
    }

    /**
     * Detect the first available CLI tool in preference order.
     * Returns null if no tool is found.
     */
    public static CliBackend detect() {
        for (Tool t : Tool.values()) {
            if (probe(t)) {
                log.info("Image CLI backend detected: {} ({})", t.name(), t.exe);
                return new CliBackend(t);
            }
        }
        return null;
    }

    /**
     * Create a backend for a specific tool. Returns null if it is not installed.
     */
    public static CliBackend forTool(Tool tool) {
        return probe(tool) ? new CliBackend(tool) : null;
    }

    // ------------------------------------------------------------------ probe

    private static boolean probe(Tool tool) {
        try {
            ProcessBuilder pb = new ProcessBuilder(tool.exe, tool.versionArg);
            pb.redirectErrorStream(true);
            Process p = pb.start();
            p.getInputStream().transferTo(OutputStream.nullOutputStream());
            return p.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ------------------------------------------------- DecoderBackend impl

    @Override
    public String name() {
        return "CLI/" + tool.name();
    }

    @Override
    public boolean isAvailable() {
        return probe(tool);
    }

    @Override
    public BufferedImage decode(byte[] data) throws Exception {
        Path in = Files.createTempFile("nuclr-zip-in-", ".img");
        Path out = Files.createTempFile("nuclr-zip-out-", ".png");
        try {
            Files.write(in, data);
            convert(in, out);
            BufferedImage img = ImageIO.read(out.toFile());
            if (img == null) throw new UnsupportedImageException(tool.exe + " produced an unreadable image");
            return img;
        } finally {
            deleteQuietly(in);
            deleteQuietly(out);
        }
    }

    // ---------------------------------------------------------------- helpers

    private void convert(Path in, Path out) throws Exception {
        // [0] selects the first frame of animated or multi-page input
        String source = in + "[0]";
        String target = "png:" + out;
        List<String> cmd = new ArrayList<>();
        switch (tool) {
            case MAGICK         -> cmd.addAll(List.of(tool.exe, source, target));
            case GRAPHICSMAGICK -> cmd.addAll(List.of(tool.exe, "convert", source, target));
            default             -> throw new IllegalStateException("Unknown tool: " + tool);
        }

        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectErrorStream(true);
        Process p = pb.start();
        String output = new String(p.getInputStream().readAllBytes());
        int exitCode = p.waitFor();
        if (exitCode != 0) {
            throw new UnsupportedImageException(tool.exe + " exited with " + exitCode + ": " + output.trim());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
