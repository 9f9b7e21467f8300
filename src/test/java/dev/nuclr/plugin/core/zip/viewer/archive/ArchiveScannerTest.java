package dev.nuclr.plugin.core.zip.viewer.archive;

import dev.nuclr.plugin.core.zip.viewer.TestArchives;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArchiveScannerTest {

    @TempDir
    Path tempDir;

    private final ArchiveScanner scanner = new ArchiveScanner();

    @Test
    void imageOnlyArchive_isValidAndNaturallySorted() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("page10.png", TestArchives.png(4, 4, Color.RED));
        entries.put("page2.png", TestArchives.png(4, 4, Color.RED));
        entries.put("page1.jpg", TestArchives.jpeg(4, 4, Color.RED));
        Path zip = TestArchives.zip(tempDir.resolve("comic.zip"), entries);

        ArchiveInfo info = scanner.scan(zip);

        assertThat(info.valid()).isTrue();
        assertThat(info.members()).containsExactly("page1.jpg", "page2.png", "page10.png");
        assertThat(info.imageCount()).isEqualTo(3);
        assertThat(info.firstMember()).isEqualTo("page1.jpg");
        assertThat(info.fileSize()).isEqualTo(Files.size(zip));
        assertThat(info.lastModified()).isNotNull();
    }

    @Test
    void directoriesAreIgnored() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("chapter1/", new byte[0]);
        entries.put("chapter1/01.png", TestArchives.png(4, 4, Color.RED));
        Path zip = TestArchives.zip(tempDir.resolve("nested.zip"), entries);

        ArchiveInfo info = scanner.scan(zip);

        assertThat(info.valid()).isTrue();
        assertThat(info.members()).containsExactly("chapter1/01.png");
    }

    @Test
    void singleNonImageMember_invalidatesWholeArchive() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("01.png", TestArchives.png(4, 4, Color.RED));
        entries.put("readme.txt", "hello".getBytes());
        entries.put("02.png", TestArchives.png(4, 4, Color.RED));
        Path zip = TestArchives.zip(tempDir.resolve("mixed.zip"), entries);

        ArchiveInfo info = scanner.scan(zip);

        assertThat(info.valid()).isFalse();
        assertThat(info.members()).isEmpty();
    }

    @Test
    void tooManyEntries_isInvalid() throws Exception {
        ArchiveScanner strict = new ArchiveScanner(ArchiveScanner.DEFAULT_MAX_ARCHIVE_BYTES, 2);
        Path zip = TestArchives.pages(tempDir.resolve("many.zip"), 3);

        assertThat(strict.scan(zip).valid()).isFalse();
    }

    @Test
    void oversizedArchive_isInvalid() throws Exception {
        Path zip = TestArchives.pages(tempDir.resolve("pages.zip"), 2);
        ArchiveScanner tiny = new ArchiveScanner(10, ArchiveScanner.DEFAULT_MAX_ENTRIES);

        ArchiveInfo info = tiny.scan(zip);

        assertThat(info.valid()).isFalse();
        assertThat(info.fileSize()).isEqualTo(Files.size(zip));
    }

    @Test
    void unreadableInputs_comeBackInvalid() throws Exception {
        Path notZip = Files.writeString(tempDir.resolve("fake.zip"), "plain text");

        assertThat(scanner.scan(notZip).valid()).isFalse();
        assertThat(scanner.scan(tempDir.resolve("missing.zip")).valid()).isFalse();
        assertThat(scanner.scan(tempDir).valid()).isFalse();
    }

    @Test
    void scanAll_keepsValidArchivesInOrder() throws Exception {
        Path b = TestArchives.pages(tempDir.resolve("b.zip"), 1);
        Path bad = Files.writeString(tempDir.resolve("bad.zip"), "nope");
        Path a = TestArchives.pages(tempDir.resolve("a.zip"), 1);

        List<ArchiveInfo> valid = scanner.scanAll(List.of(b, bad, a));

        assertThat(valid).extracting(ArchiveInfo::path).containsExactly(b, a);
    }
}
