package com.agilab.image_archiving.config;

import com.agilab.image_archiving.exception.TransientConversionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.Map;

/**
 * Bean configuration for archiving components.
 */
@Configuration
public class ImageArchiverBeans {

    /**
     * RetryTemplate for moving files into the archive.
     * Retries on IOException, except when the target already exists: that is a collision, solved by re-planning.
     */
    @Bean
    public RetryTemplate placementRetryTemplate(ImageArchiverProperties properties) {
        var policy = new SimpleRetryPolicy(properties.getRetryAttempts(),
                Map.of(IOException.class, true,
                        FileAlreadyExistsException.class, false,
                        NoSuchFileException.class, false), true);
        return RetryTemplate.builder()
                .customPolicy(policy)
                .fixedBackoff(Math.max(1, properties.getRetryDelay().toMillis()))
                .build();
    }

    /**
     * RetryTemplate for converter invocations that failed with a transient error.
     * Content errors are never retried.
     */
    @Bean
    public RetryTemplate conversionRetryTemplate(ImageArchiverProperties properties) {
        var converter = properties.getConverter();
        return RetryTemplate.builder()
                .maxAttempts(converter.getTransientRetryAttempts() + 1)
                .fixedBackoff(Math.max(1, converter.getTransientRetryDelay().toMillis()))
                .retryOn(TransientConversionException.class)
                .build();
    }

    /**
     * Reads ExifTool's JSON and writes the run report; instants are written as ISO-8601 strings.
     */
    @Bean
    public ObjectMapper archiveObjectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        return objectMapper;
    }
}
