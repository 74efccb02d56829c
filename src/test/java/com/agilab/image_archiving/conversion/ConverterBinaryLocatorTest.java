package com.agilab.image_archiving.conversion;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ConverterBinaryLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void searchPath_shouldFindExecutableInPathDirectories() throws IOException {
        // Given
        var empty = Files.createDirectories(tempDir.resolve("empty"));
        var bin = Files.createDirectories(tempDir.resolve("bin"));
        var dnglab = executable(bin.resolve("dnglab"));

        // When
        var found = ConverterBinaryLocator.searchPath("dnglab", empty + File.pathSeparator + bin);

        // Then
        assertThat(found).hasValue(dnglab);
    }

    @Test
    void searchPath_shouldIgnoreNonExecutableFiles() throws IOException {
        Files.writeString(tempDir.resolve("dnglab"), "not executable");

        assertThat(ConverterBinaryLocator.searchPath("dnglab", tempDir.toString())).isEmpty();
        assertThat(ConverterBinaryLocator.searchPath("dnglab", null)).isEmpty();
    }

    @Test
    void locate_shouldUseConfiguredPathAsIs() throws IOException {
        var properties = new ImageArchiverProperties();
        var dnglab = executable(tempDir.resolve("dnglab-1.0"));
        properties.getConverter().setBinary(dnglab.toString());

        assertThat(new ConverterBinaryLocator(properties).locate()).hasValue(dnglab);

        properties.getConverter().setBinary(tempDir.resolve("missing").toString());
        assertThat(new ConverterBinaryLocator(properties).locate()).isEmpty();
    }

    private static Path executable(Path path) throws IOException {
        Files.writeString(path, "#!/bin/sh\nexit 0\n");
        Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxr-xr-x"));
        return path;
    }
}
