package com.agilab.image_archiving.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@ConfigurationProperties(prefix = "image-archiver")
@Data
@Component
public class ImageArchiverProperties {
    private String sourceDirectory = ".";
    private String destinationDirectory; // defaults to the source directory
    private String projectName; // derived from a YYYYMMDD_project source directory when blank
    private int concurrency = 4;
    private boolean recursive = false;
    private boolean dryRun = false;
    private boolean convertRaw = true;
    private boolean keepOriginals = false;
    private String excludePattern = "^(\\..*|~.*|.*\\.tmp|Thumbs\\.db|Adobe Bridge Cache.*)$";
    private String reportFile;
    private int retryAttempts = 3;
    private Duration retryDelay = Duration.ofMillis(500);
    private int maxPlacementAttempts = 5;
    private Duration terminationTimeout = Duration.ofSeconds(30);
    private MetadataTool metadataTool = new MetadataTool();
    private Converter converter = new Converter();

    @Data
    public static class MetadataTool {
        private String binary = "exiftool";
        private int batchSize = 50;
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Converter {
        private String binary = "dnglab";
        private Duration timeout = Duration.ofMinutes(10);
        private String compression = "lossless";
        private boolean embedPreview = false;
        private int transientRetryAttempts = 1;
        private Duration transientRetryDelay = Duration.ofSeconds(1);
        private String transientErrorPattern =
                "(?i)resource temporarily unavailable|EAGAIN|too many open files|cannot allocate memory";
    }
}
