package dev.nuclr.plugin.core.zip.viewer.cache;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies one decoded representation of one archive member.
 * Key: (archivePath, memberName, variant).
 *
 * <p>Keys that differ only in {@link Variant} share the same source bytes.
 */
public record CacheKey(String archivePath, String memberName, Variant variant) {

    public CacheKey {
        Objects.requireNonNull(archivePath, "archivePath");
        Objects.requireNonNull(memberName, "memberName");
        Objects.requireNonNull(variant, "variant");
    }

    public static CacheKey of(Path archive, String memberName, Variant variant) {
        return new CacheKey(normalize(archive), memberName, variant);
    }

    public static CacheKey original(Path archive, String memberName) {
        return of(archive, memberName, Variant.ORIGINAL);
    }

    public static String normalize(Path archive) {
        return archive.toAbsolutePath().normalize().toString();
    }

    /** Same member, full resolution. */
    public CacheKey toOriginal() {
        return variant.isOriginal() ? this : new CacheKey(archivePath, memberName, Variant.ORIGINAL);
    }

    public boolean belongsTo(String normalizedArchivePath) {
        return archivePath.equals(normalizedArchivePath);
    }

    @Override
    public String toString() {
        return archivePath + "!" + memberName + "@" + variant;
    }

    // ------------------------------------------------------------------ variant

    public enum Kind {
        ORIGINAL, THUMBNAIL, RESIZED
    }

    /**
     * A decoded representation. Bounded variants fit inside width x height,
     * preserving the aspect ratio.
     */
    public record Variant(Kind kind, int width, int height) {

        public static final Variant ORIGINAL = new Variant(Kind.ORIGINAL, 0, 0);

        public Variant {
            Objects.requireNonNull(kind, "kind");
            if (kind == Kind.ORIGINAL) {
                width = 0;
                height = 0;
            } else if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Bounded variant needs a positive size: " + width + "x" + height);
            }
        }

        public static Variant thumbnail(int width, int height) {
            return new Variant(Kind.THUMBNAIL, width, height);
        }

        public static Variant resized(int width, int height) {
            return new Variant(Kind.RESIZED, width, height);
        }

        public boolean isOriginal() {
            return kind == Kind.ORIGINAL;
        }

        @Override
        public String toString() {
            return isOriginal() ? "original" : kind.name().toLowerCase() + "(" + width + "x" + height + ")";
        }
    }
}
