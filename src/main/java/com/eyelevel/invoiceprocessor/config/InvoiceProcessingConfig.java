package com.eyelevel.invoiceprocessor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

/**
 * Binds application properties under the "app.processing" prefix. These values bound the
 * retry budget, the stuck-job threshold and the fan-out limits of the invoice pipeline.
 */
@Data
@ConfigurationProperties(prefix = "app.processing")
public class InvoiceProcessingConfig {

    /**
     * Maximum number of analysis attempts before a document is left in a terminal failed state.
     */
    private int maxRetries = 3;

    /**
     * Age, in minutes, after which a non-terminal document is considered stuck by the janitor.
     */
    private long stuckThresholdMinutes = 10;

    /**
     * Page size used when the poller walks the documents with a job in flight.
     */
    private int pollBatchSize = 100;

    /**
     * Confidence at which a result could skip human review. Never applied: every successful
     * analysis lands in NEEDS_REVIEW.
     */
    private double autoVerifyConfidence = 95.0;

    private Upload upload = new Upload();
    private BatchRefresh batchRefresh = new BatchRefresh();
    private Analysis analysis = new Analysis();

    @Data
    public static class RetryConfig {
        private int attempts = 2;
        private long delayMs = 500;
    }

    @Data
    public static class Upload {
        private long maxFileSizeBytes = 20L * 1024 * 1024;
        private int maxSessionFiles = 25;
        private Set<String> allowedMimeTypes = Set.of("application/pdf", "image/jpeg", "image/png");
    }

    @Data
    public static class BatchRefresh {
        private int maxIds = 20;
        private int concurrency = 5;
    }

    @Data
    public static class Analysis {
        private RetryConfig retry = new RetryConfig();
    }
}
