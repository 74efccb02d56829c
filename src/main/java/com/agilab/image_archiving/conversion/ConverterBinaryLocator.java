package com.agilab.image_archiving.conversion;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the converter binary: a configured path is used as is, a bare name is looked up on the PATH.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConverterBinaryLocator {

    private final ImageArchiverProperties properties;

    public Optional<Path> locate() {
        var configured = properties.getConverter().getBinary();
        if (StringUtils.isBlank(configured)) {
            return Optional.empty();
        }
        if (configured.contains("/") || configured.contains(File.separator)) {
            var path = Paths.get(configured);
            return isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        return searchPath(configured, System.getenv("PATH"));
    }

    static Optional<Path> searchPath(String binaryName, String pathVariable) {
        if (StringUtils.isBlank(pathVariable)) {
            return Optional.empty();
        }
        var candidates = SystemUtils.IS_OS_WINDOWS && !binaryName.toLowerCase().endsWith(".exe")
                ? List.of(binaryName, binaryName + ".exe")
                : List.of(binaryName);
        for (var directory : pathVariable.split(File.pathSeparator)) {
            if (directory.isBlank()) {
                continue;
            }
            for (var candidate : candidates) {
                var path = Paths.get(directory, candidate);
                if (isExecutable(path)) {
                    log.debug("Found {} on PATH: {}", binaryName, path);
                    return Optional.of(path);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
