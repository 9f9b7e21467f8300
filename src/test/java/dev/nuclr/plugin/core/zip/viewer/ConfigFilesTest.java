package dev.nuclr.plugin.core.zip.viewer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigFilesTest {

    private static final String HOME = "/home/reader";

    @TempDir
    Path tempDir;

    @Test
    void windows_usesAppData() {
        Path dir = ConfigFiles.userConfigDir("Windows 11", Map.of("APPDATA", "/roaming"), HOME);

        assertThat(dir).isEqualTo(Path.of("/roaming", "nuclr"));
    }

    @Test
    void windowsWithoutAppData_fallsBackToHome() {
        Path dir = ConfigFiles.userConfigDir("Windows 10", Map.of("APPDATA", " "), HOME);

        assertThat(dir).isEqualTo(Path.of(HOME, "nuclr"));
    }

    @Test
    void mac_usesApplicationSupport() {
        Path dir = ConfigFiles.userConfigDir("Mac OS X", Map.of("XDG_CONFIG_HOME", "/ignored"), HOME);

        assertThat(dir).isEqualTo(Path.of(HOME, "Library", "Application Support", "nuclr"));
    }

    @Test
    void linux_prefersXdgConfigHome() {
        assertThat(ConfigFiles.userConfigDir("Linux", Map.of("XDG_CONFIG_HOME", "/xdg"), HOME))
                .isEqualTo(Path.of("/xdg", "nuclr"));
        assertThat(ConfigFiles.userConfigDir("Linux", Map.of(), HOME))
                .isEqualTo(Path.of(HOME, ".config", "nuclr"));
    }

    @Test
    void storeAtomically_createsDirectoriesAndLeavesNoTempFile() throws Exception {
        Path target = tempDir.resolve("nested").resolve("settings.properties");
        Properties props = new Properties();
        props.setProperty("zip.quickView.workers", "3");

        ConfigFiles.storeAtomically(props, target, "test");
        props.setProperty("zip.quickView.workers", "4");
        ConfigFiles.storeAtomically(props, target, "test");

        Properties reloaded = new Properties();
        try (InputStream in = Files.newInputStream(target)) {
            reloaded.load(in);
        }
        assertThat(reloaded.getProperty("zip.quickView.workers")).isEqualTo("4");
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files).containsExactly(target);
        }
    }
}
