package com.eyelevel.invoiceprocessor.dto.status;

import com.eyelevel.invoiceprocessor.dto.lifecycle.ExtractedDocumentResponse;
import com.eyelevel.invoiceprocessor.model.FailureCategory;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import com.eyelevel.invoiceprocessor.model.SourceType;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

import java.net.URL;
import java.time.LocalDateTime;
import java.util.UUID;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Current state of a document, with its extracted invoice when one exists.")
public record DocumentStatusResponse(
        UUID id,
        String organisationId,
        String locationId,
        SourceType sourceType,
        String fileName,
        String mimeType,
        Long fileSizeBytes,
        UUID uploadBatchId,
        ProcessingStatus processingStatus,
        ReviewStatus reviewStatus,
        int attemptCount,
        LocalDateTime lastAttemptAt,
        FailureCategory failureCategory,
        String failureReason,
        Double confidenceScore,
        LocalDateTime deletedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        @Schema(description = "Short-lived pre-signed URL to the stored file; absent when it could not be generated.")
        URL downloadUrl,
        ExtractedDocumentResponse extractedDocument
) {
}
