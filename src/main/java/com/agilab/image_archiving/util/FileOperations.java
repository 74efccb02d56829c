package com.agilab.image_archiving.util;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import com.agilab.image_archiving.model.MediaKind;
import com.agilab.image_archiving.model.SourceFile;
import com.agilab.image_archiving.planning.PathPlanner;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Component
public class FileOperations {

    private final RetryTemplate retryTemplate;
    private final ImageArchiverProperties properties;

    public FileOperations(@Qualifier("placementRetryTemplate") RetryTemplate retryTemplate,
                          ImageArchiverProperties properties) {
        this.retryTemplate = retryTemplate;
        this.properties = properties;
    }

    /**
     * Lists the supported media files of a directory, sorted by path.
     * Files already in the archive are never inputs: a destination nested inside the source is skipped
     * entirely, and when both are the same directory its {@code <date>_<project>} directories are skipped.
     */
    public List<SourceFile> findSourceFiles(Path sourceDirectory, Path destinationDirectory, String projectName,
                                            boolean recursive) throws IOException {
        var exclude = Pattern.compile(properties.getExcludePattern());
        var source = sourceDirectory.toAbsolutePath().normalize();
        var destination = destinationDirectory.toAbsolutePath().normalize();

        List<Path> candidates;
        try (Stream<Path> files = recursive ? Files.walk(source) : Files.list(source)) {
            candidates = files
                    .filter(Files::isRegularFile)
                    .filter(file -> !isArchived(file, source, destination, projectName))
                    .filter(file -> isNotExcluded(file, exclude))
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.toList());
        }

        var classified = new ArrayList<SourceFile>(candidates.size());
        for (var file : candidates) {
            classify(file).ifPresentOrElse(classified::add,
                    () -> log.debug("Skipping unsupported file type: {}", file));
        }
        return markThumbnails(classified);
    }

    private static boolean isArchived(Path file, Path source, Path destination, String projectName) {
        if (!file.startsWith(destination)) {
            return false;
        }
        if (!destination.equals(source)) {
            return true;
        }
        var relative = destination.relativize(file);
        return relative.getNameCount() > 1
                && PathPlanner.isProjectDirectory(relative.getName(0).toString(), projectName);
    }

    private static boolean isNotExcluded(Path file, Pattern exclude) {
        var excluded = exclude.matcher(file.getFileName().toString()).matches();
        if (excluded) {
            log.debug("Excluding file: {}", file);
        }
        return !excluded;
    }

    public static Optional<SourceFile> classify(Path file) {
        var extension = extensionOf(file);
        return MediaKind.fromExtension(extension)
                .map(kind -> new SourceFile(file, kind, extension));
    }

    /**
     * A compressed image with the same base name as a RAW file in the same directory is that RAW's thumbnail.
     */
    private static List<SourceFile> markThumbnails(List<SourceFile> files) {
        Set<String> rawKeys = new HashSet<>();
        for (var file : files) {
            if (file.kind() == MediaKind.RAW) {
                rawKeys.add(baseNameKey(file.path()));
            }
        }
        return files.stream()
                .map(file -> file.kind() == MediaKind.IMAGE && rawKeys.contains(baseNameKey(file.path()))
                        ? new SourceFile(file.path(), MediaKind.THUMBNAIL, file.extension())
                        : file)
                .toList();
    }

    private static String baseNameKey(Path file) {
        var baseName = FilenameUtils.getBaseName(file.getFileName().toString()).toLowerCase(Locale.ROOT);
        return file.getParent() + "/" + baseName;
    }

    /**
     * Moves (or copies, when keeping originals) a file into the archive, retrying transient I/O failures.
     * Never replaces an existing target: a {@link java.nio.file.FileAlreadyExistsException} is thrown at once.
     */
    public Path placeFileWithRetry(Path source, Path target, boolean keepOriginal) throws IOException {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying placement of {} (attempt {})", source, context.getRetryCount() + 1);
            }
            return keepOriginal ? copyFile(source, target) : moveFile(source, target);
        });
    }

    /**
     * Moves without replacing. Across file stores Files.move copies and deletes the source.
     */
    public static Path moveFile(Path source, Path target) throws IOException {
        return Files.move(source, target);
    }

    public static Path copyFile(Path source, Path target) throws IOException {
        return Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
    }

    /**
     * Lower-cased extension without the dot, empty when there is none.
     */
    public static String extensionOf(Path file) {
        var name = file.getFileName().toString();
        if (name.startsWith(".") && name.indexOf('.', 1) < 0) {
            return "";
        }
        return FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);
    }
}
