package com.agilab.image_archiving.metadata;

import com.agilab.image_archiving.config.ImageArchiverProperties;
import com.agilab.image_archiving.exception.MetadataToolException;
import com.agilab.image_archiving.exception.ProcessTimeoutException;
import com.agilab.image_archiving.exception.ToolUnavailableException;
import com.agilab.image_archiving.model.CaptureMetadata;
import com.agilab.image_archiving.model.ExtractionFailure;
import com.agilab.image_archiving.model.MetadataResult;
import com.agilab.image_archiving.process.ProcessExecutor;
import com.agilab.image_archiving.process.ProcessExecutor.ProcessResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads capture metadata with one ExifTool invocation per batch:
 * {@code exiftool -json -G -charset filename=utf8 -<tags> <files>}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExifToolMetadataExtractor implements MetadataExtractor {

    static final String SOURCE_FILE = "SourceFile";
    static final String ERROR = "ExifTool:Error";
    static final List<String> DATE_TAGS = List.of("EXIF:DateTimeOriginal", "EXIF:CreateDate", "QuickTime:CreateDate");
    static final List<String> MAKE_TAGS = List.of("EXIF:Make", "QuickTime:Make");
    static final List<String> MODEL_TAGS = List.of("EXIF:Model", "QuickTime:Model");

    private static final String PROCESS_NAME = "exiftool";
    private static final String ZERO_DATE = "0000:00:00 00:00:00";
    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private final ProcessExecutor processExecutor;
    private final ImageArchiverProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Map<Path, MetadataResult> extract(List<Path> paths) throws InterruptedException {
        if (paths.isEmpty()) {
            return Map.of();
        }
        var tool = properties.getMetadataTool();
        var contextInfo = "metadata batch of " + paths.size();

        ProcessResult result;
        try {
            result = processExecutor.execute(buildCommand(paths), contextInfo, tool.getTimeout(), PROCESS_NAME);
        } catch (ToolUnavailableException e) {
            throw new MetadataToolException("Metadata tool cannot be invoked: " + e.getMessage(), e);
        } catch (ProcessTimeoutException e) {
            log.error("[{}] {}", contextInfo, e.getMessage());
            return failAll(paths, e.getMessage());
        } catch (IOException e) {
            log.error("[{}] Metadata tool failed", contextInfo, e);
            return failAll(paths, "metadata tool failed: " + e.getMessage());
        }

        if (!result.isSuccess()) {
            // exiftool exits 1 when any file of the batch had an error; the JSON is still complete
            log.debug("[{}] {} exited with code {}", contextInfo, PROCESS_NAME, result.exitCode());
        }
        return toResults(paths, result);
    }

    private List<String> buildCommand(List<Path> paths) {
        var command = new ArrayList<String>();
        command.add(properties.getMetadataTool().getBinary());
        command.add("-json");
        command.add("-G");
        command.add("-charset");
        command.add("filename=utf8");
        for (var tag : DATE_TAGS) {
            command.add("-" + tag);
        }
        for (var tag : MAKE_TAGS) {
            command.add("-" + tag);
        }
        for (var tag : MODEL_TAGS) {
            command.add("-" + tag);
        }
        for (var path : paths) {
            command.add(path.toString());
        }
        return command;
    }

    private Map<Path, MetadataResult> toResults(List<Path> paths, ProcessResult result) {
        Map<Path, JsonNode> records;
        try {
            records = parseRecords(result.stdout());
        } catch (JsonProcessingException e) {
            log.error("Unparseable metadata tool output for {} files", paths.size(), e);
            return failAll(paths, "unparseable metadata tool output");
        }

        var results = new LinkedHashMap<Path, MetadataResult>();
        for (var path : paths) {
            var record = records.get(normalize(path));
            if (record == null) {
                var detail = result.firstStderrLine();
                results.put(path, new ExtractionFailure(StringUtils.isBlank(detail)
                        ? "no metadata record returned"
                        : "no metadata record returned: " + detail));
            } else if (record.hasNonNull(ERROR)) {
                results.put(path, new ExtractionFailure(record.get(ERROR).asText()));
            } else {
                results.put(path, toMetadata(path, record));
            }
        }
        return results;
    }

    private Map<Path, JsonNode> parseRecords(String stdout) throws JsonProcessingException {
        var records = new HashMap<Path, JsonNode>();
        if (StringUtils.isBlank(stdout)) {
            return records;
        }
        for (var record : objectMapper.readTree(stdout)) {
            var sourceFile = record.path(SOURCE_FILE).asText(null);
            if (sourceFile != null) {
                records.put(normalize(Paths.get(sourceFile)), record);
            }
        }
        return records;
    }

    private CaptureMetadata toMetadata(Path path, JsonNode record) {
        return new CaptureMetadata(
                parseCaptureTime(path, firstText(record, DATE_TAGS)),
                firstText(record, MAKE_TAGS),
                firstText(record, MODEL_TAGS));
    }

    private static String firstText(JsonNode record, List<String> tags) {
        for (var tag : tags) {
            var value = record.path(tag).asText("").trim();
            if (!value.isEmpty() && !ZERO_DATE.equals(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Parses {@code yyyy:MM:dd HH:mm:ss}, ignoring sub-second and time zone suffixes.
     */
    static LocalDateTime parseCaptureTime(Path path, String value) {
        if (value == null || value.length() < 19) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.substring(0, 19), EXIF_DATE);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring malformed capture date '{}' of {}", value, path);
            return null;
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private static Map<Path, MetadataResult> failAll(List<Path> paths, String reason) {
        var results = new LinkedHashMap<Path, MetadataResult>();
        paths.forEach(path -> results.put(path, new ExtractionFailure(reason)));
        return results;
    }
}
