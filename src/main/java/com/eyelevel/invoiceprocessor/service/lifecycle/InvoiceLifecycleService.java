package com.eyelevel.invoiceprocessor.service.lifecycle;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.dto.lifecycle.BulkOperationResponse;
import com.eyelevel.invoiceprocessor.dto.lifecycle.ExtractedDocumentResponse;
import com.eyelevel.invoiceprocessor.dto.lifecycle.VerifyRequest;
import com.eyelevel.invoiceprocessor.dto.status.DocumentStatusResponse;
import com.eyelevel.invoiceprocessor.exception.ErrorCode;
import com.eyelevel.invoiceprocessor.exception.InvalidStateException;
import com.eyelevel.invoiceprocessor.exception.NotFoundException;
import com.eyelevel.invoiceprocessor.exception.RetryExhaustedException;
import com.eyelevel.invoiceprocessor.exception.ValidationException;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ExtractedDocument;
import com.eyelevel.invoiceprocessor.model.LineItem;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import com.eyelevel.invoiceprocessor.repository.AnalysisResultRepository;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.repository.ExtractedDocumentRepository;
import com.eyelevel.invoiceprocessor.service.asynctask.AsyncTaskManager;
import com.eyelevel.invoiceprocessor.service.s3.S3StorageService;
import com.eyelevel.invoiceprocessor.service.status.DocumentStatusService;
import com.eyelevel.invoiceprocessor.service.submission.UploadValidationService;
import com.eyelevel.invoiceprocessor.service.supplier.SupplierDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * User-driven changes to a document after submission: retries, file replacement, review and
 * deletion. Every operation is scoped to the caller's organisation; a record owned by another
 * organisation is reported as not found.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceLifecycleService {

    private final DocumentRecordRepository documentRecordRepository;
    private final ExtractedDocumentRepository extractedDocumentRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final SupplierDirectory supplierDirectory;
    private final S3StorageService s3StorageService;
    private final UploadValidationService uploadValidationService;
    private final AsyncTaskManager asyncTaskManager;
    private final DocumentStatusService documentStatusService;
    private final InvoiceProcessingConfig processingConfig;

    /**
     * Sends a failed document back for analysis.
     *
     * @throws InvalidStateException   if the document is not {@code ANALYSIS_FAILED}.
     * @throws RetryExhaustedException if no attempts are left; the record is not changed.
     */
    @Transactional
    public DocumentStatusResponse retry(final String organisationId, final UUID documentId) {
        final DocumentRecord record = loadLive(organisationId, documentId);
        if (record.getProcessingStatus() != ProcessingStatus.ANALYSIS_FAILED) {
            throw new InvalidStateException("Only failed documents can be retried; document " + documentId + " is "
                                                    + record.getProcessingStatus() + ".");
        }
        if (record.getAttemptCount() >= processingConfig.getMaxRetries()) {
            throw new RetryExhaustedException(processingConfig.getMaxRetries());
        }
        record.clearFailure();
        record.setAnalysisJobId(null);
        record.setProcessingStatus(ProcessingStatus.PENDING_ANALYSIS);
        final DocumentRecord saved = documentRecordRepository.save(record);
        asyncTaskManager.scheduleAnalysisStartAfterCommit(documentId);
        log.info("Manual retry requested for document {} (attempts so far: {}).", documentId, record.getAttemptCount());
        return documentStatusService.toResponse(saved);
    }

    /**
     * Swaps the stored file and starts over: attempts, results and review state are reset.
     */
    @Transactional
    public DocumentStatusResponse replaceFile(final String organisationId, final UUID documentId,
                                              final String fileName, final String mimeType, final byte[] content) {
        uploadValidationService.validateFile(fileName, mimeType, content == null ? 0 : content.length);
        final DocumentRecord record = loadLive(organisationId, documentId);

        final String storageKey = S3StorageService.constructDocumentKey(organisationId);
        s3StorageService.upload(storageKey, content, mimeType);

        extractedDocumentRepository.findByDocumentRecordId(documentId).ifPresent(extractedDocumentRepository::delete);
        final int removedResults = analysisResultRepository.deleteAllByDocumentRecordId(documentId);

        record.setFileName(fileName);
        record.setMimeType(mimeType);
        record.setFileSizeBytes((long) content.length);
        record.setStorageKey(storageKey);
        record.setAttemptCount(0);
        record.setLastAttemptAt(null);
        record.setAnalysisJobId(null);
        record.setConfidenceScore(null);
        record.clearFailure();
        record.setReviewStatus(ReviewStatus.NONE);
        record.setProcessingStatus(ProcessingStatus.PENDING_ANALYSIS);
        final DocumentRecord saved = documentRecordRepository.save(record);
        asyncTaskManager.scheduleAnalysisStartAfterCommit(documentId);
        log.info("Replaced file of document {} with '{}' ({} previous analysis result(s) removed).", documentId,
                 fileName, removedResults);
        return documentStatusService.toResponse(saved);
    }

    /**
     * Confirms the extracted invoice. All input is checked before anything is changed; a repeated
     * call overwrites the previous verification.
     *
     * @throws ValidationException if a selected line item belongs to another document, the supplier
     *                             id is unknown, or no supplier is given.
     */
    @Transactional
    public ExtractedDocumentResponse verify(final String organisationId, final UUID documentId,
                                            final VerifyRequest request) {
        final DocumentRecord record = loadLive(organisationId, documentId);
        final ExtractedDocument document = loadExtracted(documentId);

        final Set<Long> ownItemIds = document.getLineItems().stream().map(LineItem::getId).collect(Collectors.toSet());
        final List<Long> selected = request.getSelectedLineItemIds();
        if (selected != null) {
            final List<Long> foreign = selected.stream().filter(id -> !ownItemIds.contains(id)).toList();
            if (!foreign.isEmpty()) {
                throw new ValidationException(ErrorCode.INVALID_LINE_ITEM_SELECTION,
                                              "Line items " + foreign + " do not belong to document " + documentId
                                                      + ".");
            }
        }

        if (request.getSupplierId() != null) {
            if (!supplierDirectory.supplierExists(request.getSupplierId(), organisationId)) {
                throw new ValidationException(ErrorCode.INVALID_SUPPLIER_ID,
                                              "Supplier " + request.getSupplierId() + " does not exist.");
            }
        } else if (!StringUtils.hasText(request.getSupplierName())) {
            throw new ValidationException(ErrorCode.SUPPLIER_REQUIRED,
                                          "Either 'supplierId' or 'supplierName' is required.");
        }

        final UUID supplierId = request.getSupplierId() != null
                ? request.getSupplierId()
                : supplierDirectory.findOrCreateSupplier(request.getSupplierName(), organisationId);
        document.setSupplierId(supplierId);
        if (StringUtils.hasText(request.getSupplierName())) {
            document.setSupplierName(request.getSupplierName().trim());
        }

        if (selected != null) {
            final Set<Long> keep = Set.copyOf(selected);
            final int before = document.getLineItems().size();
            document.getLineItems().removeIf(item -> !keep.contains(item.getId()));
            log.debug("Verification of document {} removed {} unselected line item(s).", documentId,
                      before - document.getLineItems().size());
        }
        if (request.getTotal() != null) {
            document.setTotal(request.getTotal());
        }
        if (request.getInvoiceDate() != null) {
            document.setInvoiceDate(request.getInvoiceDate());
        }
        document.setVerified(true);
        final ExtractedDocument saved = extractedDocumentRepository.save(document);

        record.setReviewStatus(ReviewStatus.VERIFIED);
        documentRecordRepository.save(record);

        if (request.isCreateAlias() && StringUtils.hasText(request.getAliasName())) {
            supplierDirectory.createAlias(supplierId, request.getAliasName(), organisationId);
        }
        log.info("Document {} verified against supplier {}.", documentId, supplierId);
        return ExtractedDocumentResponse.from(saved);
    }

    /**
     * @throws InvalidStateException with {@code NOT_VERIFIED} if the document is not verified.
     */
    @Transactional
    public DocumentStatusResponse revertVerification(final String organisationId, final UUID documentId) {
        final DocumentRecord record = loadLive(organisationId, documentId);
        if (record.getReviewStatus() != ReviewStatus.VERIFIED) {
            throw new InvalidStateException(ErrorCode.NOT_VERIFIED, "Document " + documentId + " is not verified.");
        }
        extractedDocumentRepository.findByDocumentRecordId(documentId).ifPresent(document -> {
            document.setVerified(false);
            extractedDocumentRepository.save(document);
        });
        record.setReviewStatus(ReviewStatus.NEEDS_REVIEW);
        final DocumentRecord saved = documentRecordRepository.save(record);
        log.info("Verification of document {} reverted.", documentId);
        return documentStatusService.toResponse(saved);
    }

    /**
     * Gives a failed document an extracted invoice to fill in by hand. Returns the existing one if
     * there is already one. The processing status stays {@code ANALYSIS_FAILED}.
     */
    @Transactional
    public ExtractedDocumentResponse createManualEntry(final String organisationId, final UUID documentId) {
        final DocumentRecord record = loadLive(organisationId, documentId);
        if (record.getProcessingStatus() != ProcessingStatus.ANALYSIS_FAILED) {
            throw new InvalidStateException("Manual entry is only available for failed documents; document "
                                                    + documentId + " is " + record.getProcessingStatus() + ".");
        }
        final ExtractedDocument document = extractedDocumentRepository.findByDocumentRecordId(documentId)
                .orElseGet(() -> {
                    log.info("Creating manual entry for document {}.", documentId);
                    return extractedDocumentRepository.save(ExtractedDocument.builder()
                                                                             .documentRecordId(documentId)
                                                                             .organisationId(organisationId)
                                                                             .build());
                });
        if (record.getReviewStatus() == ReviewStatus.NONE) {
            record.setReviewStatus(ReviewStatus.NEEDS_REVIEW);
            documentRecordRepository.save(record);
        }
        return ExtractedDocumentResponse.from(document);
    }

    @Transactional
    public void delete(final String organisationId, final UUID documentId) {
        final DocumentRecord record = loadLive(organisationId, documentId);
        record.setDeletedAt(LocalDateTime.now());
        documentRecordRepository.save(record);
        log.info("Document {} soft-deleted.", documentId);
    }

    @Transactional
    public BulkOperationResponse bulkDelete(final String organisationId, final List<UUID> ids) {
        final Set<UUID> requested = new LinkedHashSet<>(ids);
        final List<UUID> eligible = documentRecordRepository.findAllByIdInAndOrganisationId(requested, organisationId)
                                                            .stream()
                                                            .filter(r -> !r.isDeleted())
                                                            .map(DocumentRecord::getId)
                                                            .toList();
        final int affected = eligible.isEmpty() ? 0
                : documentRecordRepository.softDeleteAll(eligible, organisationId, LocalDateTime.now());
        log.info("Bulk delete for organisation {}: {} requested, {} deleted.", organisationId, requested.size(),
                 affected);
        return new BulkOperationResponse(requested.size(), affected, skipped(requested, eligible));
    }

    /**
     * @throws NotFoundException if the document does not exist or is not deleted.
     */
    @Transactional
    public DocumentStatusResponse restore(final String organisationId, final UUID documentId) {
        final DocumentRecord record = documentRecordRepository.findByIdAndOrganisationId(documentId, organisationId)
                                                              .filter(DocumentRecord::isDeleted)
                                                              .orElseThrow(() -> new NotFoundException(
                                                                      "Document " + documentId
                                                                              + " not found or not deleted."));
        record.setDeletedAt(null);
        final DocumentRecord saved = documentRecordRepository.save(record);
        log.info("Document {} restored.", documentId);
        return documentStatusService.toResponse(saved);
    }

    @Transactional
    public BulkOperationResponse bulkRestore(final String organisationId, final List<UUID> ids) {
        final Set<UUID> requested = new LinkedHashSet<>(ids);
        final List<UUID> eligible = documentRecordRepository.findAllByIdInAndOrganisationId(requested, organisationId)
                                                            .stream()
                                                            .filter(DocumentRecord::isDeleted)
                                                            .map(DocumentRecord::getId)
                                                            .toList();
        final int affected = eligible.isEmpty() ? 0
                : documentRecordRepository.restoreAll(eligible, organisationId, LocalDateTime.now());
        log.info("Bulk restore for organisation {}: {} requested, {} restored.", organisationId, requested.size(),
                 affected);
        return new BulkOperationResponse(requested.size(), affected, skipped(requested, eligible));
    }

    /**
     * Removes the document, its extracted invoice and every stored analysis result. Works on deleted
     * and live documents alike. The stored file is left in place.
     */
    @Transactional
    public void hardDelete(final String organisationId, final UUID documentId) {
        final DocumentRecord record = documentRecordRepository.findByIdAndOrganisationId(documentId, organisationId)
                                                              .orElseThrow(() -> NotFoundException.document(
                                                                      documentId));
        extractedDocumentRepository.findByDocumentRecordId(documentId).ifPresent(extractedDocumentRepository::delete);
        analysisResultRepository.deleteAllByDocumentRecordId(documentId);
        documentRecordRepository.delete(record);
        log.warn("Document {} permanently deleted (storage key {}).", documentId, record.getStorageKey());
    }

    private DocumentRecord loadLive(final String organisationId, final UUID documentId) {
        return documentRecordRepository.findByIdAndOrganisationIdAndDeletedAtIsNull(documentId, organisationId)
                                       .orElseThrow(() -> NotFoundException.document(documentId));
    }

    private ExtractedDocument loadExtracted(final UUID documentId) {
        return extractedDocumentRepository.findByDocumentRecordId(documentId)
                                          .orElseThrow(() -> new InvalidStateException(
                                                  ErrorCode.EXTRACTED_DOCUMENT_MISSING,
                                                  "Document " + documentId + " has no extracted invoice to verify."));
    }

    private static List<UUID> skipped(final Set<UUID> requested, final List<UUID> eligible) {
        final List<UUID> skipped = new ArrayList<>(requested);
        skipped.removeAll(eligible);
        return skipped;
    }
}
