package com.agilab.image_archiving.planning;

import com.agilab.image_archiving.model.CaptureMetadata;
import com.agilab.image_archiving.model.MediaKind;
import com.agilab.image_archiving.model.SourceFile;
import com.agilab.image_archiving.model.TargetLocation;
import com.agilab.image_archiving.planning.SequenceRegistry.BucketKey;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives where a file goes in the archive:
 * {@code <root>/<yyyyMMdd>_<project>/<make>_<model>_<ext>/<yyyyMMdd>-<HHmm>_<project>_<seq>.<ext>}.
 * <p>
 * Sequence numbers come from the shared {@link SequenceRegistry}; numbers whose file already exists on disk
 * are skipped, so earlier runs are never overwritten.
 */
@Slf4j
public class PathPlanner {

    public static final String UNKNOWN_DATE = "unknown-date";
    static final String THUMBNAIL_FOLDER = "thmb";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmm");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");

    private final Path destinationRoot;
    private final SequenceRegistry registry;
    private final boolean reserveConvertedSibling;

    /**
     * @param reserveConvertedSibling when true, a slot of a convertible RAW file is only free if the DNG
     *                                it will be converted to does not exist either
     */
    public PathPlanner(Path destinationRoot, SequenceRegistry registry, boolean reserveConvertedSibling) {
        this.destinationRoot = destinationRoot;
        this.registry = registry;
        this.reserveConvertedSibling = reserveConvertedSibling;
    }

    public TargetLocation plan(SourceFile file, CaptureMetadata metadata, String projectName) {
        var project = sanitize(projectName, false);
        var captureTime = metadata.findCaptureTime();
        var date = captureTime.map(DATE::format).orElse(UNKNOWN_DATE);
        var dateMinute = captureTime.map(PathPlanner::dateMinute).orElse(UNKNOWN_DATE);

        var directory = destinationRoot
                .resolve(date + "_" + project)
                .resolve(subfolder(file, metadata));
        var checkSibling = reserveConvertedSibling && file.isConvertible();

        var key = new BucketKey(directory, dateMinute, project);
        var sequence = registry.reserve(key, candidate -> {
            var location = new TargetLocation(directory, fileName(dateMinute, project, candidate, file.extension()),
                    candidate);
            var free = isFree(location, checkSibling);
            if (!free) {
                log.debug("Slot taken, skipping: {}", location.path());
            }
            return free;
        });
        return new TargetLocation(directory, fileName(dateMinute, project, sequence, file.extension()), sequence);
    }

    static String subfolder(SourceFile file, CaptureMetadata metadata) {
        var make = sanitizeOr(metadata.make(), CaptureMetadata.UNKNOWN_MAKE);
        var model = sanitizeOr(withoutMakePrefix(metadata.make(), metadata.model()), CaptureMetadata.UNKNOWN_MODEL);
        var suffix = file.kind() == MediaKind.THUMBNAIL ? THUMBNAIL_FOLDER : file.extension();
        return make + "_" + model + "_" + suffix;
    }

    static String fileName(String dateMinute, String project, int sequence, String extension) {
        return String.format("%s_%s_%03d.%s", dateMinute, project, sequence, extension);
    }

    private static String dateMinute(LocalDateTime time) {
        return DATE.format(time) + "-" + TIME.format(time);
    }

    /**
     * Cameras often repeat the make in the model ("Canon" / "Canon EOS 5D").
     */
    static String withoutMakePrefix(String make, String model) {
        if (StringUtils.isBlank(make) || StringUtils.isBlank(model)) {
            return model;
        }
        var trimmedMake = make.trim();
        var trimmedModel = model.trim();
        if (trimmedModel.length() > trimmedMake.length() && StringUtils.startsWithIgnoreCase(trimmedModel, trimmedMake)) {
            return trimmedModel.substring(trimmedMake.length()).trim();
        }
        return trimmedModel;
    }

    private static String sanitizeOr(String value, String fallback) {
        var sanitized = cameraSegment(value);
        return sanitized.isEmpty() ? fallback : sanitized;
    }

    /**
     * One make or model segment: lower-cased, whitespace removed, so {@code _} only separates segments
     * ("EOS 5D" becomes "eos5d").
     */
    static String cameraSegment(String value) {
        if (value == null) {
            return "";
        }
        var cleaned = DISALLOWED.matcher(value).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a directory name is one of the archive's {@code <yyyyMMdd>_<project>} directories for the project.
     */
    public static boolean isProjectDirectory(String directoryName, String projectName) {
        var project = Pattern.quote(sanitize(projectName, false));
        return directoryName.matches("(\\d{8}|" + UNKNOWN_DATE + ")_" + project);
    }

    /**
     * Whitespace runs become underscores; characters filesystems reject are dropped.
     */
    static String sanitize(String value, boolean lowerCase) {
        if (value == null) {
            return "";
        }
        var cleaned = DISALLOWED.matcher(value.trim()).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned.trim()).replaceAll("_");
        cleaned = REPEATED_UNDERSCORES.matcher(cleaned).replaceAll("_");
        return lowerCase ? cleaned.toLowerCase(Locale.ROOT) : cleaned;
    }

    private static boolean isFree(TargetLocation location, boolean checkSibling) {
        if (Files.exists(location.path())) {
            return false;
        }
        return !checkSibling || !Files.exists(location.withExtension(MediaKind.DNG_EXTENSION));
    }
}
