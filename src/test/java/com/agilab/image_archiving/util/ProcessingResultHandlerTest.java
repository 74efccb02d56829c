package com.agilab.image_archiving.util;

import com.agilab.image_archiving.model.FailureKind;
import com.agilab.image_archiving.model.FinalReport;
import com.agilab.image_archiving.model.MediaKind;
import com.agilab.image_archiving.model.ProcessingResult;
import com.agilab.image_archiving.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingResultHandlerTest {

    private static final SourceFile RAW = new SourceFile(Path.of("/photos/IMG_0001.CR2"), MediaKind.RAW, "cr2");

    private final ProcessingResultHandler resultHandler = new ProcessingResultHandler();

    @Test
    void testDescribe_Renamed() {
        var result = ProcessingResult.renamed(RAW, Path.of("/archive/20230601-1405_trip_001.cr2"));

        var description = resultHandler.describe(result);
        assertTrue(description.startsWith("Renamed"));
        assertTrue(description.contains("20230601-1405_trip_001.cr2"));
    }

    @Test
    void testDescribe_RenamedAndConverted() {
        var result = ProcessingResult.renamedAndConverted(RAW, Path.of("/archive/x_001.cr2"),
                Path.of("/archive/x_001.dng"));

        var description = resultHandler.describe(result);
        assertTrue(description.contains("converted to /archive/x_001.dng"));
    }

    @Test
    void testDescribe_Planned() {
        var description = resultHandler.describe(ProcessingResult.planned(RAW, Path.of("/archive/x_001.cr2")));

        assertTrue(description.startsWith("Would rename"));
    }

    @Test
    void testDescribe_Failed() {
        var result = ProcessingResult.failed(RAW, FailureKind.CONVERSION_FAILED, "invalid file");

        var description = resultHandler.describe(result);
        assertTrue(description.contains("Failed to process"));
        assertTrue(description.contains("invalid file"));
        assertTrue(description.contains("CONVERSION_FAILED"));
    }

    @Test
    void testLogging_DoesNotThrow() {
        var failure = ProcessingResult.failed(RAW, FailureKind.TOOL_MISSING, "dnglab not found");
        var report = new FinalReport(Map.of(RAW.path(), failure), Instant.now(), Instant.now(), true,
                "dnglab not found");

        assertDoesNotThrow(() -> resultHandler.logResult(failure));
        assertDoesNotThrow(() -> resultHandler.logSummary(report));
    }
}
