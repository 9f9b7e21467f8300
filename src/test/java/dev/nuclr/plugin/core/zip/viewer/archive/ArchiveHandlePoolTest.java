package dev.nuclr.plugin.core.zip.viewer.archive;

import dev.nuclr.plugin.core.zip.viewer.DecodeException;
import dev.nuclr.plugin.core.zip.viewer.ErrorKind;
import dev.nuclr.plugin.core.zip.viewer.TestArchives;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveHandlePoolTest {

    @TempDir
    Path tempDir;

    private ArchiveHandlePool pool;

    @BeforeEach
    void setUp() {
        pool = new ArchiveHandlePool(2);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void acquire_reusesOpenHandle() throws Exception {
        Path zip = TestArchives.pages(tempDir.resolve("a.zip"), 3);

        ArchiveHandle first;
        try (ArchiveHandlePool.Lease lease = pool.acquire(zip)) {
            first = lease.handle();
            assertThat(lease.members()).containsExactly("page1.png", "page2.png", "page3.png");
        }
        try (ArchiveHandlePool.Lease lease = pool.acquire(zip)) {
            assertThat(lease.handle()).isSameAs(first);
        }
        assertThat(pool.openCount()).isEqualTo(1);
    }

    @Test
    void exceedingBound_closesLeastRecentlyUsed() throws Exception {
        Path a = TestArchives.pages(tempDir.resolve("a.zip"), 1);
        Path b = TestArchives.pages(tempDir.resolve("b.zip"), 1);
        Path c = TestArchives.pages(tempDir.resolve("c.zip"), 1);

        ArchiveHandle handleA;
        try (ArchiveHandlePool.Lease lease = pool.acquire(a)) {
            handleA = lease.handle();
        }
        pool.acquire(b).close();
        pool.acquire(c).close();

        assertThat(pool.openCount()).isEqualTo(2);
        assertThat(pool.isOpen(a)).isFalse();
        assertThat(pool.isOpen(b)).isTrue();
        assertThat(pool.isOpen(c)).isTrue();
        assertThat(handleA.isClosed()).isTrue();
    }

    @Test
    void evictedHandle_staysOpenUntilLeaseReturned() throws Exception {
        Path a = TestArchives.pages(tempDir.resolve("a.zip"), 2);
        Path b = TestArchives.pages(tempDir.resolve("b.zip"), 1);
        Path c = TestArchives.pages(tempDir.resolve("c.zip"), 1);

        ArchiveHandlePool.Lease leaseA = pool.acquire(a);
        pool.acquire(b).close();
        pool.acquire(c).close();

        assertThat(pool.isOpen(a)).isFalse();
        assertThat(leaseA.handle().isClosed()).isFalse();
        assertThat(leaseA.readMember("page2.png", 1_000_000)).isNotEmpty();

        leaseA.close();
        assertThat(leaseA.handle().isClosed()).isTrue();
    }

    @Test
    void leaseClose_isIdempotent() throws Exception {
        Path a = TestArchives.pages(tempDir.resolve("a.zip"), 1);
        ArchiveHandlePool.Lease lease = pool.acquire(a);
        ArchiveHandlePool.Lease other = pool.acquire(a);

        lease.close();
        lease.close();
        pool.release(a);

        assertThat(other.handle().isClosed()).isFalse();
        other.close();
        assertThat(other.handle().isClosed()).isTrue();
    }

    @Test
    void release_closesAndForgets() throws Exception {
        Path a = TestArchives.pages(tempDir.resolve("a.zip"), 1);
        ArchiveHandle handle;
        try (ArchiveHandlePool.Lease lease = pool.acquire(a)) {
            handle = lease.handle();
        }

        pool.release(a);

        assertThat(pool.isOpen(a)).isFalse();
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void closeAll_closesEverything() throws Exception {
        pool.acquire(TestArchives.pages(tempDir.resolve("a.zip"), 1)).close();
        pool.acquire(TestArchives.pages(tempDir.resolve("b.zip"), 1)).close();

        pool.closeAll();

        assertThat(pool.openCount()).isZero();
    }

    @Test
    void missingArchive_failsWithNotFound() {
        Path missing = tempDir.resolve("missing.zip");

        assertThatThrownBy(() -> pool.acquire(missing))
                .isInstanceOf(ArchiveOpenException.class)
                .satisfies(e -> {
                    ArchiveOpenException ex = (ArchiveOpenException) e;
                    assertThat(ex.getReason()).isEqualTo(ArchiveOpenException.Reason.NOT_FOUND);
                    assertThat(ex.errorKind()).isEqualTo(ErrorKind.ARCHIVE_NOT_FOUND);
                });
        assertThat(pool.openCount()).isZero();
    }

    @Test
    void notAZip_failsWithNotAnArchive() throws IOException {
        Path bogus = Files.writeString(tempDir.resolve("bogus.zip"), "this is not a zip file");

        assertThatThrownBy(() -> pool.acquire(bogus))
                .isInstanceOf(ArchiveOpenException.class)
                .extracting(e -> ((ArchiveOpenException) e).getReason())
                .isEqualTo(ArchiveOpenException.Reason.NOT_AN_ARCHIVE);
    }

    @Test
    void directory_failsWithNotAnArchive() {
        assertThatThrownBy(() -> pool.acquire(tempDir))
                .isInstanceOf(ArchiveOpenException.class)
                .extracting(e -> ((ArchiveOpenException) e).errorKind())
                .isEqualTo(ErrorKind.ARCHIVE_INVALID);
    }

    @Test
    void readMember_enforcesSizeLimit() throws Exception {
        byte[] png = TestArchives.png(64, 64, Color.RED);
        Path zip = TestArchives.zip(tempDir.resolve("big.zip"), Map.of("big.png", png));

        try (ArchiveHandlePool.Lease lease = pool.acquire(zip)) {
            assertThatThrownBy(() -> lease.readMember("big.png", png.length - 1))
                    .isInstanceOf(DecodeException.class)
                    .extracting(e -> ((DecodeException) e).getKind())
                    .isEqualTo(ErrorKind.MEMBER_TOO_LARGE);
            assertThat(lease.readMember("big.png", png.length)).isEqualTo(png);
            assertThat(lease.memberSize("big.png")).isEqualTo(png.length);
        }
    }

    @Test
    void readMember_reportsEmptyAndMissingMembers() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("empty.png", new byte[0]);
        entries.put("ok.png", TestArchives.png(4, 4, Color.BLUE));
        Path zip = TestArchives.zip(tempDir.resolve("mixed.zip"), entries);

        try (ArchiveHandlePool.Lease lease = pool.acquire(zip)) {
            assertThatThrownBy(() -> lease.readMember("empty.png", 1000))
                    .isInstanceOf(DecodeException.class)
                    .extracting(e -> ((DecodeException) e).getKind())
                    .isEqualTo(ErrorKind.MEMBER_EMPTY);
            assertThatThrownBy(() -> lease.readMember("nope.png", 1000))
                    .isInstanceOf(DecodeException.class)
                    .extracting(e -> ((DecodeException) e).getKind())
                    .isEqualTo(ErrorKind.MEMBER_NOT_FOUND);
        }
    }

    @Test
    void nonPositiveBound_isRejected() {
        assertThatThrownBy(() -> new ArchiveHandlePool(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
