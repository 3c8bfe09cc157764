package com.eyelevel.invoiceprocessor.service.status;

import com.eyelevel.invoiceprocessor.dto.lifecycle.ExtractedDocumentResponse;
import com.eyelevel.invoiceprocessor.dto.status.DocumentStatusResponse;
import com.eyelevel.invoiceprocessor.exception.NotFoundException;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.repository.ExtractedDocumentRepository;
import com.eyelevel.invoiceprocessor.service.reconciliation.AnalysisReconciliationService;
import com.eyelevel.invoiceprocessor.service.reconciliation.ReconciliationOutcome;
import com.eyelevel.invoiceprocessor.service.s3.S3StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URL;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentStatusService {

    private final DocumentRecordRepository documentRecordRepository;
    private final ExtractedDocumentRepository extractedDocumentRepository;
    private final AnalysisReconciliationService reconciliationService;
    private final S3StorageService s3StorageService;

    /**
     * Returns the document's current state. A document that is {@code ANALYZING} is reconciled with
     * the provider first, so the caller sees a finished result without waiting for the poller.
     *
     * @throws NotFoundException if the document is missing, deleted or owned by another organisation.
     */
    public DocumentStatusResponse pollStatus(final String organisationId, final UUID documentId) {
        DocumentRecord record = loadLive(organisationId, documentId);
        if (record.getProcessingStatus() == ProcessingStatus.ANALYZING) {
            final ReconciliationOutcome outcome = reconciliationService.reconcile(documentId);
            log.debug("On-demand reconciliation of document {} finished with {}.", documentId, outcome);
            record = loadLive(organisationId, documentId);
        }
        return toResponse(record);
    }

    public DocumentStatusResponse toResponse(final DocumentRecord record) {
        final ExtractedDocumentResponse extracted = extractedDocumentRepository
                .findByDocumentRecordId(record.getId())
                .map(ExtractedDocumentResponse::from)
                .orElse(null);
        return DocumentStatusResponse.builder()
                                     .id(record.getId())
                                     .organisationId(record.getOrganisationId())
                                     .locationId(record.getLocationId())
                                     .sourceType(record.getSourceType())
                                     .fileName(record.getFileName())
                                     .mimeType(record.getMimeType())
                                     .fileSizeBytes(record.getFileSizeBytes())
                                     .uploadBatchId(record.getUploadBatchId())
                                     .processingStatus(record.getProcessingStatus())
                                     .reviewStatus(record.getReviewStatus())
                                     .attemptCount(record.getAttemptCount())
                                     .lastAttemptAt(record.getLastAttemptAt())
                                     .failureCategory(record.getFailureCategory())
                                     .failureReason(record.getFailureReason())
                                     .confidenceScore(record.getConfidenceScore())
                                     .deletedAt(record.getDeletedAt())
                                     .createdAt(record.getCreatedAt())
                                     .updatedAt(record.getUpdatedAt())
                                     .downloadUrl(downloadUrl(record))
                                     .extractedDocument(extracted)
                                     .build();
    }

    private URL downloadUrl(final DocumentRecord record) {
        if (record.getStorageKey() == null || record.getProcessingStatus() == ProcessingStatus.UPLOADING) {
            return null;
        }
        try {
            return s3StorageService.generatePresignedDownloadUrl(record.getStorageKey());
        } catch (RuntimeException e) {
            log.warn("Could not generate a download URL for document {}: {}", record.getId(), e.getMessage());
            return null;
        }
    }

    private DocumentRecord loadLive(final String organisationId, final UUID documentId) {
        return documentRecordRepository.findByIdAndOrganisationIdAndDeletedAtIsNull(documentId, organisationId)
                                       .orElseThrow(() -> NotFoundException.document(documentId));
    }
}
