package dev.nuclr.plugin.core.zip.viewer.archive;

import lombok.experimental.UtilityClass;

import java.util.Comparator;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class ImageExtensions {

    public static final Set<String> SUPPORTED = Set.of(
            ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".tif", ".tiff", ".webp", ".ico");

    private static final Pattern CHUNK_PATTERN = Pattern.compile("(\\d+)|(\\D+)");

    /**
     * Orders "page2.png" before "page10.png": digit runs compare numerically,
     * everything else case-insensitively.
     */
    public static final Comparator<String> NATURAL_ORDER = ImageExtensions::compareNaturally;

    public static boolean isImageFile(String name) {
        if (name == null || name.isEmpty() || name.endsWith("/")) {
            return false;
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return SUPPORTED.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    private static int compareNaturally(String s1, String s2) {
        Matcher m1 = CHUNK_PATTERN.matcher(s1);
        Matcher m2 = CHUNK_PATTERN.matcher(s2);
        while (m1.find() && m2.find()) {
            String part1 = m1.group();
            String part2 = m2.group();
            int cmp;
            if (m1.group(1) != null && m2.group(1) != null) {
                cmp = compareDigits(part1, part2);
            } else {
                cmp = part1.compareToIgnoreCase(part2);
            }
            if (cmp != 0) return cmp;
        }
        return Integer.compare(s1.length(), s2.length());
    }

    private static int compareDigits(String a, String b) {
        String x = stripLeadingZeros(a);
        String y = stripLeadingZeros(b);
        if (x.length() != y.length()) return Integer.compare(x.length(), y.length());
        return x.compareTo(y);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') i++;
        return digits.substring(i);
    }
}
