package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import dev.nuclr.plugin.core.zip.viewer.cache.EvictionPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ZipViewerEngineTest {

    @TempDir
    Path tempDir;

    private ViewerSettings settings;
    private ZipViewerEngine engine;
    private Path archive;

    @BeforeEach
    void setUp() throws Exception {
        settings = ViewerSettings.load(tempDir.resolve("settings.properties"));
        settings.set(ViewerSettings.KEY_WORKERS, "2");
        archive = TestArchives.pages(tempDir.resolve("book.zip"), 4);
        // Drain on the publishing thread; no event dispatch thread in tests
        engine = new ZipViewerEngine(settings, Runnable::run);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void viewerLoad_reachesTheExpectingCursor() throws Exception {
        BlockingQueue<LoadResult> shown = new LinkedBlockingQueue<>();
        ConsumerCursor viewer = engine.router().register(new ConsumerCursor("viewer", shown::add));

        viewer.expect(CacheKey.original(archive, "page2.png"));
        engine.loadForViewer(archive, "page2.png").result().get(5, TimeUnit.SECONDS);

        LoadResult result = shown.poll(5, TimeUnit.SECONDS);
        assertThat(result).isNotNull();
        assertThat(result.success()).isTrue();
        assertThat(result.image().width()).isEqualTo(42);
    }

    @Test
    void galleryThumbnail_isCachedUnderItsOwnKey() throws Exception {
        LoadResult result = engine.loadGalleryThumbnail(archive, "page1.png").result().get(5, TimeUnit.SECONDS);

        assertThat(result.success()).isTrue();
        assertThat(result.key().variant().width()).isEqualTo(settings.getGalleryThumbSize());
        assertThat(engine.cache().contains(result.key())).isTrue();
    }

    @Test
    void previewThumbnail_usesModeDependentSize() throws Exception {
        LoadResult result = engine.loadThumbnail(archive, "page3.png").result().get(5, TimeUnit.SECONDS);

        assertThat(result.key().variant()).isEqualTo(engine.thumbnailVariant());
        assertThat(engine.thumbnailVariant().width()).isEqualTo(280);
    }

    @Test
    void galleryPreview_isBoundedButNotUpscaled() throws Exception {
        LoadResult result = engine.loadGalleryPreview(archive, "page4.png").result().get(5, TimeUnit.SECONDS);

        assertThat(result.key().variant().width()).isEqualTo(480);
        assertThat(result.image().width()).isEqualTo(44);
        assertThat(engine.cache().contains(result.key())).isFalse();
    }

    @Test
    void applySettings_followsPerformanceModeAndPolicy() {
        assertThat(engine.cache().capacity()).isEqualTo(50);

        settings.setPerformanceMode(true);
        settings.setCachePolicy(EvictionPolicy.LFU);
        engine.applySettings();

        assertThat(engine.cache().capacity()).isEqualTo(25);
        assertThat(engine.cache().policy()).isEqualTo(EvictionPolicy.LFU);
        assertThat(engine.decoder().isPerformanceMode()).isTrue();
        assertThat(engine.thumbnailVariant().width()).isEqualTo(180);
    }

    @Test
    void clearCache_dropsImagesAndClosesArchives() throws Exception {
        engine.loadForViewer(archive, "page1.png").result().get(5, TimeUnit.SECONDS);
        assertThat(engine.cache().size()).isEqualTo(1);
        assertThat(engine.archives().isOpen(archive)).isTrue();

        engine.clearCache();

        assertThat(engine.cache().size()).isZero();
        assertThat(engine.archives().openCount()).isZero();
    }

    @Test
    void invalidateArchive_forgetsOnlyThatArchive() throws Exception {
        Path other = TestArchives.pages(tempDir.resolve("other.zip"), 1);
        engine.loadForViewer(archive, "page1.png").result().get(5, TimeUnit.SECONDS);
        engine.loadForViewer(other, "page1.png").result().get(5, TimeUnit.SECONDS);

        int removed = engine.invalidateArchive(archive);

        assertThat(removed).isEqualTo(1);
        assertThat(engine.cache().contains(CacheKey.original(other, "page1.png"))).isTrue();
        assertThat(engine.archives().isOpen(archive)).isFalse();
    }

    @Test
    void preloadAround_warmsNeighbours() throws Exception {
        List<String> members = engine.scan(archive).members();

        int queued = engine.preloadAround(archive, members, 0, 1);

        assertThat(queued).isEqualTo(2);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (engine.preloader().pendingCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(engine.cache().contains(CacheKey.original(archive, "page2.png"))).isTrue();
        assertThat(engine.cache().contains(CacheKey.original(archive, "page3.png"))).isTrue();
    }

    @Test
    void nextThumbnailPreload_isOffInPerformanceMode() {
        List<String> members = engine.scan(archive).members();
        settings.setPerformanceMode(true);

        assertThat(engine.preloadNextThumbnail(archive, members, 0)).isZero();
    }

    @Test
    void scanAll_listsOnlyValidArchives() throws Exception {
        Path broken = Files.writeString(tempDir.resolve("broken.zip"), "nope");

        assertThat(engine.scanAll(List.of(archive, broken))).hasSize(1);
    }
}
