package com.eyelevel.invoiceprocessor.dto.batch;

import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * Per-id outcome of a batch refresh. Status fields are absent for ids that were not found.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchRefreshResult(
        UUID id,
        BatchRefreshAction action,
        ProcessingStatus processingStatus,
        ReviewStatus reviewStatus,
        String message
) {

    public static BatchRefreshResult notFound(UUID id) {
        return new BatchRefreshResult(id, BatchRefreshAction.SKIPPED_NOT_FOUND, null, null, null);
    }

    public static BatchRefreshResult error(UUID id, String message) {
        return new BatchRefreshResult(id, BatchRefreshAction.ERROR, null, null, message);
    }
}
