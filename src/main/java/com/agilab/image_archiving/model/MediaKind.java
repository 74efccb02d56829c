package com.agilab.image_archiving.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Kind of media detected from a file extension at discovery time.
 */
public enum MediaKind {
    IMAGE,
    VIDEO,
    RAW,
    /** A compressed image sitting next to a RAW file with the same base name. */
    THUMBNAIL;

    public static final Set<String> RAW_EXTENSIONS = Set.of(
            "crw", "cr2", "cr3", "raf", "rwl", "mrw", "nef", "nrw", "orf",
            "raw", "rw2", "pef", "srw", "arw", "sr2", "dng");

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "tif", "tiff", "heic", "heif", "gif", "bmp", "webp");

    public static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "mp4", "mov", "avi", "mkv", "m4v", "mts", "m2ts", "3gp", "wmv", "mpg", "mpeg");

    public static final String DNG_EXTENSION = "dng";

    /**
     * Classifies an extension (without the dot, any case). Empty for unsupported types.
     */
    public static Optional<MediaKind> fromExtension(String extension) {
        var ext = extension.toLowerCase(Locale.ROOT);
        if (RAW_EXTENSIONS.contains(ext)) {
            return Optional.of(RAW);
        }
        if (IMAGE_EXTENSIONS.contains(ext)) {
            return Optional.of(IMAGE);
        }
        if (VIDEO_EXTENSIONS.contains(ext)) {
            return Optional.of(VIDEO);
        }
        return Optional.empty();
    }

    /**
     * RAW files other than DNG are eligible for conversion.
     */
    public static boolean isConvertible(String extension) {
        var ext = extension.toLowerCase(Locale.ROOT);
        return RAW_EXTENSIONS.contains(ext) && !DNG_EXTENSION.equals(ext);
    }
}
