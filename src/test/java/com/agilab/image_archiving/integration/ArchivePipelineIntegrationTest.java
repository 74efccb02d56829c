package com.agilab.image_archiving.integration;

import com.agilab.image_archiving.ArchivePipeline;
import com.agilab.image_archiving.ArchiveRequest;
import com.agilab.image_archiving.config.ImageArchiverProperties;
import com.agilab.image_archiving.model.FailureKind;
import com.agilab.image_archiving.model.ProcessingOutcome;
import com.agilab.image_archiving.report.ReportWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the wired pipeline against stand-in exiftool and dnglab scripts.
 */
@SpringBootTest
@EnabledOnOs({OS.LINUX, OS.MAC})
@TestPropertySource(properties = {
        "image-archiver.run-on-startup=false",
        "image-archiver.retry-delay=PT0.01S",
        "image-archiver.converter.transient-retry-delay=PT0.01S"
})
class ArchivePipelineIntegrationTest {

    private static final String FAKE_EXIFTOOL = """
            #!/bin/sh
            printf '['
            sep=''
            skip=0
            for arg in "$@"; do
              if [ "$skip" = 1 ]; then skip=0; continue; fi
              case "$arg" in
                -charset) skip=1 ;;
                -*) ;;
                *) printf '%s{"SourceFile": "%s", "EXIF:DateTimeOriginal": "2023:06:01 14:05:33", "EXIF:Make": "Canon", "EXIF:Model": "Canon EOS 5D"}' "$sep" "$arg"
                   sep=',' ;;
              esac
            done
            printf ']\\n'
            """;

    private static final String FAKE_DNGLAB = """
            #!/bin/sh
            for last in "$@"; do source="$target"; target="$last"; done
            if grep -q invalid "$source"; then
              echo "invalid file" >&2
              exit 1
            fi
            printf 'DNG' > "$target"
            """;

    @Autowired
    private ArchivePipeline pipeline;

    @Autowired
    private ImageArchiverProperties properties;

    @Autowired
    private ReportWriter reportWriter;

    @Autowired
    private ObjectMapper objectMapper;

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path archive;

    @BeforeEach
    void setUp() throws IOException {
        var tools = Files.createDirectories(tempDir.resolve("tools"));
        properties.getMetadataTool().setBinary(script(tools.resolve("exiftool"), FAKE_EXIFTOOL).toString());
        properties.getConverter().setBinary(script(tools.resolve("dnglab"), FAKE_DNGLAB).toString());

        sourceDir = Files.createDirectories(tempDir.resolve("20230601_trip"));
        archive = tempDir.resolve("archive");
    }

    @Test
    void shouldArchiveAndConvertFilesEndToEnd() throws Exception {
        // Given
        var first = Files.writeString(sourceDir.resolve("IMG_0001.CR2"), "raw");
        var broken = Files.writeString(sourceDir.resolve("IMG_0002.CR2"), "invalid raw");
        var jpeg = Files.writeString(sourceDir.resolve("DSC_0003.jpg"), "jpeg");
        var request = new ArchiveRequest(sourceDir, archive, "trip", 1, false, false, true, false);

        // When
        var report = pipeline.run(request);

        // Then
        var canonRaw = archive.resolve("20230601_trip/canon_eos5d_cr2");
        assertThat(report.size()).isEqualTo(3);
        assertThat(report.get(first).orElseThrow().outcome()).isEqualTo(ProcessingOutcome.RENAMED_AND_CONVERTED);
        assertThat(canonRaw.resolve("20230601-1405_trip_001.cr2")).hasContent("raw");
        assertThat(canonRaw.resolve("20230601-1405_trip_001.dng")).hasContent("DNG");

        var failed = report.get(broken).orElseThrow();
        assertThat(failed.failureKind()).isEqualTo(FailureKind.CONVERSION_FAILED);
        assertThat(failed.reason()).isEqualTo("invalid file");
        assertThat(canonRaw.resolve("20230601-1405_trip_002.cr2")).exists();

        assertThat(report.get(jpeg).orElseThrow().target())
                .isEqualTo(archive.resolve("20230601_trip/canon_eos5d_jpg/20230601-1405_trip_001.jpg"));
        assertThat(sourceDir).isEmptyDirectory();
    }

    @Test
    void shouldWriteJsonReport() throws Exception {
        // Given
        Files.writeString(sourceDir.resolve("IMG_0001.CR2"), "raw");
        var reportFile = tempDir.resolve("report.json");

        // When
        var report = pipeline.run(new ArchiveRequest(sourceDir, archive, "trip", 2, false, false, true, false));
        reportWriter.write(report, reportFile);

        // Then
        var json = objectMapper.readTree(reportFile.toFile());
        assertThat(json.get("summary").get("RENAMED_AND_CONVERTED").asInt()).isEqualTo(1);
        assertThat(json.get("files").get(0).get("converted").asText()).endsWith("20230601-1405_trip_001.dng");
    }

    @Test
    void shouldKeepRenamingWhenConverterIsMissing() throws Exception {
        // Given
        properties.getConverter().setBinary(tempDir.resolve("tools/no-such-dnglab").toString());
        var raw = Files.writeString(sourceDir.resolve("IMG_0001.CR2"), "raw");

        // When
        var report = pipeline.run(new ArchiveRequest(sourceDir, archive, "trip", 2, false, false, true, false));

        // Then
        var result = report.get(raw).orElseThrow();
        assertThat(result.failureKind()).isEqualTo(FailureKind.TOOL_MISSING);
        assertThat(result.target()).exists();
        assertThat(report.findConversionAbortReason()).isPresent();
    }

    private static Path script(Path path, String content) throws IOException {
        Files.writeString(path, content);
        Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxr-xr-x"));
        return path;
    }
}
