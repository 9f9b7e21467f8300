package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.EvictionPolicy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings store for the ZIP image viewer, backed by a .properties file.
 *
 * <p>Every size-like setting has a normal and a performance-mode value; the
 * effective getters pick one according to {@link #isPerformanceMode()}.
 * Instances are created by the application root and passed to whoever needs
 * them.
 */
@Slf4j
public final class ViewerSettings {

    public static final String KEY_PERFORMANCE_MODE        = "zip.quickView.performanceMode";
    public static final String KEY_CACHE_POLICY            = "zip.quickView.cache.policy";
    public static final String KEY_CACHE_ITEMS             = "zip.quickView.cache.maxItems";
    public static final String KEY_CACHE_ITEMS_PERF        = "zip.quickView.cache.maxItemsPerformance";
    public static final String KEY_CACHE_MEMORY_MB         = "zip.quickView.cache.maxMemoryMb";
    public static final String KEY_THUMBNAIL_SIZE          = "zip.quickView.thumbnailSize";
    public static final String KEY_THUMBNAIL_SIZE_PERF     = "zip.quickView.thumbnailSizePerformance";
    public static final String KEY_GALLERY_THUMB_SIZE      = "zip.quickView.gallery.thumbSize";
    public static final String KEY_GALLERY_PREVIEW_SIZE    = "zip.quickView.gallery.previewSize";
    public static final String KEY_THUMBNAIL_LOAD_MB       = "zip.quickView.maxThumbnailLoadMb";
    public static final String KEY_THUMBNAIL_LOAD_MB_PERF  = "zip.quickView.maxThumbnailLoadMbPerformance";
    public static final String KEY_VIEWER_LOAD_MB          = "zip.quickView.maxViewerLoadMb";
    public static final String KEY_VIEWER_LOAD_MB_PERF     = "zip.quickView.maxViewerLoadMbPerformance";
    public static final String KEY_PRELOAD_NEIGHBORS       = "zip.quickView.preload.neighbors";
    public static final String KEY_PRELOAD_NEIGHBORS_PERF  = "zip.quickView.preload.neighborsPerformance";
    public static final String KEY_PRELOAD_NEXT_THUMBNAIL  = "zip.quickView.preload.nextThumbnail";
    public static final String KEY_PRELOAD_MAX_QUEUED      = "zip.quickView.preload.maxQueued";
    public static final String KEY_WORKERS                 = "zip.quickView.workers";
    public static final String KEY_MAX_OPEN_ARCHIVES       = "zip.quickView.maxOpenArchives";
    public static final String KEY_BACKEND                 = "zip.quickView.backend";

    static final String SETTINGS_FILE_NAME = "zip-quick-viewer.properties";

    public enum Backend {
        IMAGEIO, AUTO, CLI_MAGICK, CLI_GRAPHICSMAGICK
    }

    private static final boolean        DEFAULT_PERFORMANCE_MODE      = false;
    private static final EvictionPolicy DEFAULT_CACHE_POLICY          = EvictionPolicy.LRU;
    private static final int            DEFAULT_CACHE_ITEMS           = 50;
    private static final int            DEFAULT_CACHE_ITEMS_PERF      = 25;
    private static final int            DEFAULT_CACHE_MEMORY_MB       = 200;
    private static final int            DEFAULT_THUMBNAIL_SIZE        = 280;
    private static final int            DEFAULT_THUMBNAIL_SIZE_PERF   = 180;
    private static final int            DEFAULT_GALLERY_THUMB_SIZE    = 220;
    private static final int            DEFAULT_GALLERY_PREVIEW_SIZE  = 480;
    private static final int            DEFAULT_THUMBNAIL_LOAD_MB     = 10;
    private static final int            DEFAULT_THUMBNAIL_LOAD_MB_PERF = 3;
    private static final int            DEFAULT_VIEWER_LOAD_MB        = 100;
    private static final int            DEFAULT_VIEWER_LOAD_MB_PERF   = 30;
    private static final int            DEFAULT_PRELOAD_NEIGHBORS     = 2;
    private static final int            DEFAULT_PRELOAD_NEIGHBORS_PERF = 1;
    private static final boolean        DEFAULT_PRELOAD_NEXT_THUMBNAIL = true;
    private static final int            DEFAULT_PRELOAD_MAX_QUEUED    = 3;
    private static final int            DEFAULT_MAX_OPEN_ARCHIVES     = 10;
    private static final Backend        DEFAULT_BACKEND               = Backend.IMAGEIO;

    private static final int MIN_IMAGE_SIZE = 32;
    private static final int MAX_IMAGE_SIZE = 4096;
    private static final int MAX_WORKERS    = 32;

    private final Properties props = new Properties();
    private final Path file;

    private ViewerSettings(Path file) {
        this.file = file;
    }

    /** Defaults only, never persisted. */
    public static ViewerSettings defaults() {
        return new ViewerSettings(null);
    }

    /** Load from an explicit file; missing file means defaults. */
    public static ViewerSettings load(Path file) {
        ViewerSettings settings = new ViewerSettings(file);
        settings.read();
        return settings;
    }

    /** Load from the platform user config directory. */
    public static ViewerSettings loadUserSettings() {
        return load(userSettingsFile());
    }

    // --- Getters ---

    public boolean isPerformanceMode() {
        return getBoolean(KEY_PERFORMANCE_MODE, DEFAULT_PERFORMANCE_MODE);
    }

    public EvictionPolicy getCachePolicy() {
        try {
            return EvictionPolicy.valueOf(props.getProperty(KEY_CACHE_POLICY, DEFAULT_CACHE_POLICY.name()));
        } catch (IllegalArgumentException e) {
            return DEFAULT_CACHE_POLICY;
        }
    }

    /** Cache capacity for the current mode. */
    public int getCacheCapacity() {
        return isPerformanceMode()
                ? getInt(KEY_CACHE_ITEMS_PERF, DEFAULT_CACHE_ITEMS_PERF, 1, 1000)
                : getInt(KEY_CACHE_ITEMS, DEFAULT_CACHE_ITEMS, 1, 1000);
    }

    public long getCacheMaxMemoryBytes() {
        return getInt(KEY_CACHE_MEMORY_MB, DEFAULT_CACHE_MEMORY_MB, 16, 16 * 1024) * Sizes.MB;
    }

    /** Edge length of preview thumbnails for the current mode. */
    public int getThumbnailSize() {
        return isPerformanceMode()
                ? getInt(KEY_THUMBNAIL_SIZE_PERF, DEFAULT_THUMBNAIL_SIZE_PERF, MIN_IMAGE_SIZE, MAX_IMAGE_SIZE)
                : getInt(KEY_THUMBNAIL_SIZE, DEFAULT_THUMBNAIL_SIZE, MIN_IMAGE_SIZE, MAX_IMAGE_SIZE);
    }

    public int getGalleryThumbSize() {
        return getInt(KEY_GALLERY_THUMB_SIZE, DEFAULT_GALLERY_THUMB_SIZE, MIN_IMAGE_SIZE, MAX_IMAGE_SIZE);
    }

    public int getGalleryPreviewSize() {
        return getInt(KEY_GALLERY_PREVIEW_SIZE, DEFAULT_GALLERY_PREVIEW_SIZE, MIN_IMAGE_SIZE, MAX_IMAGE_SIZE);
    }

    /** Largest member accepted for thumbnail loads in the current mode. */
    public long getMaxThumbnailLoadBytes() {
        int mb = isPerformanceMode()
                ? getInt(KEY_THUMBNAIL_LOAD_MB_PERF, DEFAULT_THUMBNAIL_LOAD_MB_PERF, 1, 1024)
                : getInt(KEY_THUMBNAIL_LOAD_MB, DEFAULT_THUMBNAIL_LOAD_MB, 1, 1024);
        return mb * Sizes.MB;
    }

    /** Largest member accepted for full-resolution loads in the current mode. */
    public long getMaxViewerLoadBytes() {
        int mb = isPerformanceMode()
                ? getInt(KEY_VIEWER_LOAD_MB_PERF, DEFAULT_VIEWER_LOAD_MB_PERF, 1, 2047)
                : getInt(KEY_VIEWER_LOAD_MB, DEFAULT_VIEWER_LOAD_MB, 1, 2047);
        return mb * Sizes.MB;
    }

    /** How many neighbours in each direction the viewer preloads. */
    public int getPreloadNeighbors() {
        return isPerformanceMode()
                ? getInt(KEY_PRELOAD_NEIGHBORS_PERF, DEFAULT_PRELOAD_NEIGHBORS_PERF, 0, 10)
                : getInt(KEY_PRELOAD_NEIGHBORS, DEFAULT_PRELOAD_NEIGHBORS, 0, 10);
    }

    public boolean isPreloadNextThumbnail() {
        return getBoolean(KEY_PRELOAD_NEXT_THUMBNAIL, DEFAULT_PRELOAD_NEXT_THUMBNAIL);
    }

    public int getPreloadMaxQueued() {
        return getInt(KEY_PRELOAD_MAX_QUEUED, DEFAULT_PRELOAD_MAX_QUEUED, 1, 16);
    }

    public int getWorkers() {
        int fallback = Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors() + 4);
        return getInt(KEY_WORKERS, fallback, 1, MAX_WORKERS);
    }

    public int getMaxOpenArchives() {
        return getInt(KEY_MAX_OPEN_ARCHIVES, DEFAULT_MAX_OPEN_ARCHIVES, 1, 100);
    }

    public Backend getBackend() {
        try {
            return Backend.valueOf(props.getProperty(KEY_BACKEND, DEFAULT_BACKEND.name()));
        } catch (IllegalArgumentException e) {
            return DEFAULT_BACKEND;
        }
    }

    public Path getFile() {
        return file;
    }

    // --- Setters (also persist) ---

    public synchronized void setPerformanceMode(boolean enabled) {
        props.setProperty(KEY_PERFORMANCE_MODE, String.valueOf(enabled));
        save();
    }

    public synchronized void setCachePolicy(EvictionPolicy policy) {
        props.setProperty(KEY_CACHE_POLICY, policy.name());
        save();
    }

    public synchronized void setBackend(Backend backend) {
        props.setProperty(KEY_BACKEND, backend.name());
        save();
    }

    /** Raw override, mainly for wiring and tests. Not clamped until read. */
    public synchronized void set(String key, String value) {
        props.setProperty(key, value);
        save();
    }

    // --- Helpers ---

    private int getInt(String key, int defaultValue, int min, int max) {
        try {
            int raw = Integer.parseInt(props.getProperty(key, String.valueOf(defaultValue)).trim());
            return Math.min(Math.max(raw, min), max);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        return Boolean.parseBoolean(props.getProperty(key, String.valueOf(defaultValue)).trim());
    }

    // --- Persistence ---

    private void read() {
        if (file == null || !Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not load ZIP viewer settings, using defaults: {}", e.getMessage());
        }
    }

    private void save() {
        if (file == null) return;
        try {
            ConfigFiles.storeAtomically(props, file, "Nuclr ZIP Image Viewer settings");
        } catch (IOException e) {
            log.warn("Could not save ZIP viewer settings to {}: {}", file, e.getMessage());
        }
    }

    static Path userSettingsFile() {
        return ConfigFiles.userConfigDir().resolve(SETTINGS_FILE_NAME);
    }
}
