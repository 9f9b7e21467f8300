package dev.nuclr.plugin.core.zip.viewer;

import lombok.experimental.UtilityClass;

import java.util.Locale;

@UtilityClass
public class Sizes {

    public static final long KB = 1024;
    public static final long MB = KB * 1024;
    public static final long GB = MB * 1024;

    /** Human-readable byte count: 512 B, 1.5 KB, 3.2 MB. */
    public static String format(long bytes) {
        if (bytes < KB) return bytes + " B";
        if (bytes < MB) return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KB);
        if (bytes < GB) return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MB);
        return String.format(Locale.ROOT, "%.1f GB", bytes / (double) GB);
    }
}
