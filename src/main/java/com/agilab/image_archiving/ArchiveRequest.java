package com.agilab.image_archiving;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parameters of one archive run.
 */
public record ArchiveRequest(Path sourceDirectory,
                             Path destinationDirectory,
                             String projectName,
                             int concurrency,
                             boolean recursive,
                             boolean dryRun,
                             boolean convertRaw,
                             boolean keepOriginals) {

    private static final Pattern DATED_PROJECT_DIRECTORY = Pattern.compile("^(\\d{8})_(.+)$");

    public ArchiveRequest {
        Objects.requireNonNull(sourceDirectory, "sourceDirectory");
        Objects.requireNonNull(destinationDirectory, "destinationDirectory");
        if (StringUtils.isBlank(projectName)) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
    }

    public static ArchiveRequest from(ImageArchiverProperties properties) {
        var source = Paths.get(properties.getSourceDirectory()).toAbsolutePath().normalize();
        var destination = StringUtils.isBlank(properties.getDestinationDirectory())
                ? source
                : Paths.get(properties.getDestinationDirectory()).toAbsolutePath().normalize();
        var project = StringUtils.isBlank(properties.getProjectName())
                ? deriveProjectName(source)
                : properties.getProjectName().trim();
        return new ArchiveRequest(source, destination, project, properties.getConcurrency(),
                properties.isRecursive(), properties.isDryRun(), properties.isConvertRaw(),
                properties.isKeepOriginals());
    }

    /**
     * Photo folders are usually named {@code YYYYMMDD_project}; anything else is used as the project name as is.
     */
    public static String deriveProjectName(Path sourceDirectory) {
        var fileName = sourceDirectory.getFileName();
        if (fileName == null) {
            return null;
        }
        var name = fileName.toString();
        var matcher = DATED_PROJECT_DIRECTORY.matcher(name);
        return matcher.matches() ? matcher.group(2) : name;
    }
}
