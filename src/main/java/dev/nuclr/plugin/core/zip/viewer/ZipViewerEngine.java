package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.archive.ArchiveHandlePool;
import dev.nuclr.plugin.core.zip.viewer.archive.ArchiveInfo;
import dev.nuclr.plugin.core.zip.viewer.archive.ArchiveScanner;
import dev.nuclr.plugin.core.zip.viewer.backend.ImageDecoder;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey.Variant;
import dev.nuclr.plugin.core.zip.viewer.cache.CacheStore;
import lombok.extern.slf4j.Slf4j;

import javax.swing.SwingUtilities;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Owns one cache, one handle pool, one decoder, one loader and one result
 * router for the lifetime of a viewer session, all configured from
 * {@link ViewerSettings}.
 */
@Slf4j
public class ZipViewerEngine implements AutoCloseable {

    private final ViewerSettings settings;
    private final CacheStore cache;
    private final ArchiveHandlePool archives;
    private final ImageDecoder decoder;
    private final ResultRouter router;
    private final ImageLoadService loader;
    private final PreloadScheduler preloader;
    private final ArchiveScanner scanner;

    /** Engine delivering results on the Swing event dispatch thread. */
    public ZipViewerEngine(ViewerSettings settings) {
        this(settings, SwingUtilities::invokeLater);
    }

    /**
     * @param deliveryExecutor where routed results are drained; null leaves
     *                         draining to the caller
     */
    public ZipViewerEngine(ViewerSettings settings, Executor deliveryExecutor) {
        this.settings = settings;
        this.cache = new CacheStore(settings.getCacheCapacity(), settings.getCachePolicy(),
                settings.getCacheMaxMemoryBytes(),
                (key, image) -> log.trace("Evicted {}", key));
        this.archives = new ArchiveHandlePool(settings.getMaxOpenArchives());
        this.decoder = ImageDecoder.forSettings(settings);
        this.router = new ResultRouter(deliveryExecutor);
        this.loader = new ImageLoadService(cache, archives, decoder, settings.getWorkers(), router::publish);
        this.preloader = new PreloadScheduler(loader, cache, settings.getPreloadMaxQueued());
        this.scanner = new ArchiveScanner();

        log.info("ZIP viewer engine started: backend={}, workers={}, cache={} ({}), performanceMode={}",
                decoder.backendName(), settings.getWorkers(), cache.capacity(), cache.policy(),
                settings.isPerformanceMode());
    }

    // ------------------------------------------------------------ requests

    /** Full-resolution image for the viewer window. */
    public LoadHandle loadForViewer(Path archive, String member) {
        return loader.submit(LoadRequest.original(archive, member, settings.getMaxViewerLoadBytes()));
    }

    /** Preview-panel thumbnail at the configured size. */
    public LoadHandle loadThumbnail(Path archive, String member) {
        return loader.submit(LoadRequest.of(archive, member, settings.getMaxThumbnailLoadBytes(),
                thumbnailVariant()));
    }

    /** Gallery cell; cached under its own key so scrolling back is free. */
    public LoadHandle loadGalleryThumbnail(Path archive, String member) {
        int size = settings.getGalleryThumbSize();
        return loader.submit(LoadRequest.of(archive, member, settings.getMaxThumbnailLoadBytes(),
                Variant.thumbnail(size, size)).withStoreVariant(true));
    }

    /** Larger gallery preview of the selected cell. */
    public LoadHandle loadGalleryPreview(Path archive, String member) {
        int size = settings.getGalleryPreviewSize();
        return loader.submit(LoadRequest.of(archive, member, settings.getMaxViewerLoadBytes(),
                Variant.resized(size, size)));
    }

    /** Queue viewer neighbours of {@code index}, travelling in {@code direction}. */
    public int preloadAround(Path archive, List<String> members, int index, int direction) {
        return preloader.schedule(archive, members, index, direction, PreloadScheduler.depthFor(settings),
                Variant.ORIGINAL, settings.getMaxViewerLoadBytes());
    }

    /** Preview-panel hint: warm the next member's thumbnail when enabled. */
    public int preloadNextThumbnail(Path archive, List<String> members, int index) {
        if (!settings.isPreloadNextThumbnail() || settings.isPerformanceMode()) return 0;
        return preloader.schedule(archive, members, index, 1, 1, thumbnailVariant(),
                settings.getMaxThumbnailLoadBytes());
    }

    public Variant thumbnailVariant() {
        int size = settings.getThumbnailSize();
        return Variant.thumbnail(size, size);
    }

    public ArchiveInfo scan(Path archive) {
        return scanner.scan(archive);
    }

    public List<ArchiveInfo> scanAll(List<Path> archivesToScan) {
        return scanner.scanAll(archivesToScan);
    }

    // ---------------------------------------------------------- maintenance

    /** Re-read capacity, policy and decoder mode after a settings change. */
    public void applySettings() {
        cache.resize(settings.getCacheCapacity());
        if (cache.policy() != settings.getCachePolicy()) {
            cache.setPolicy(settings.getCachePolicy());
        }
        decoder.setPerformanceMode(settings.isPerformanceMode());
        log.info("Settings applied: cache={} ({}), performanceMode={}",
                cache.capacity(), cache.policy(), settings.isPerformanceMode());
    }

    /** Drop every cached image and close every pooled archive. */
    public void clearCache() {
        preloader.cancelPending();
        cache.clear();
        archives.closeAll();
        log.info("Image cache cleared");
    }

    /** Forget an archive that changed on disk: its images and its open handle. */
    public int invalidateArchive(Path archive) {
        archives.release(archive);
        return cache.invalidate(CacheKey.normalize(archive));
    }

    @Override
    public void close() {
        preloader.cancelPending();
        loader.close();
        archives.close();
        log.info("ZIP viewer engine stopped");
    }

    // -------------------------------------------------------------- access

    public ViewerSettings settings() {
        return settings;
    }

    public CacheStore cache() {
        return cache;
    }

    public ArchiveHandlePool archives() {
        return archives;
    }

    public ImageDecoder decoder() {
        return decoder;
    }

    public ResultRouter router() {
        return router;
    }

    public ImageLoadService loader() {
        return loader;
    }

    public PreloadScheduler preloader() {
        return preloader;
    }
}
