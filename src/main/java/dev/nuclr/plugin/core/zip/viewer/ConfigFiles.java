package dev.nuclr.plugin.core.zip.viewer;

import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Where nuclr keeps per-user configuration, and how a properties file is
 * written there without leaving a half-written file behind.
 */
@UtilityClass
class ConfigFiles {

    static final String APP_DIR = "nuclr";

    /** The nuclr config directory for the running user and platform. */
    static Path userConfigDir() {
        return userConfigDir(System.getProperty("os.name", ""), System.getenv(), System.getProperty("user.home"));
    }

    /**
     * Windows: %APPDATA%\nuclr. macOS: ~/Library/Application Support/nuclr.
     * Elsewhere: $XDG_CONFIG_HOME/nuclr or ~/.config/nuclr. A missing or blank
     * variable falls back to the home directory.
     */
    static Path userConfigDir(String osName, Map<String, String> env, String userHome) {
        String os = osName.toLowerCase(Locale.ROOT);
        Path home = Path.of(userHome);
        if (os.startsWith("windows")) {
            return baseOr(env.get("APPDATA"), home).resolve(APP_DIR);
        }
        if (os.startsWith("mac")) {
            return home.resolve("Library").resolve("Application Support").resolve(APP_DIR);
        }
        return baseOr(env.get("XDG_CONFIG_HOME"), home.resolve(".config")).resolve(APP_DIR);
    }

    /**
     * Store {@code props} into {@code target} through a temp file in the same
     * directory, replacing the target in one move where the file system allows.
     */
    static void storeAtomically(Properties props, Path target, String comment) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                props.store(out, comment);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static Path baseOr(String value, Path fallback) {
        return value == null || value.isBlank() ? fallback : Path.of(value);
    }
}
