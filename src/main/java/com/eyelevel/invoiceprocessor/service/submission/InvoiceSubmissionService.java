package com.eyelevel.invoiceprocessor.service.submission;

import com.eyelevel.invoiceprocessor.dto.status.DocumentStatusResponse;
import com.eyelevel.invoiceprocessor.dto.submission.UploadSessionEntry;
import com.eyelevel.invoiceprocessor.dto.submission.UploadSessionFile;
import com.eyelevel.invoiceprocessor.dto.submission.UploadSessionResponse;
import com.eyelevel.invoiceprocessor.exception.ErrorCode;
import com.eyelevel.invoiceprocessor.exception.InvalidStateException;
import com.eyelevel.invoiceprocessor.exception.NotFoundException;
import com.eyelevel.invoiceprocessor.exception.PipelineStage;
import com.eyelevel.invoiceprocessor.exception.PipelineStageException;
import com.eyelevel.invoiceprocessor.exception.StorageException;
import com.eyelevel.invoiceprocessor.exception.ValidationException;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.SourceType;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStarter;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisStartOutcome;
import com.eyelevel.invoiceprocessor.service.asynctask.AsyncTaskManager;
import com.eyelevel.invoiceprocessor.service.s3.S3StorageService;
import com.eyelevel.invoiceprocessor.service.status.DocumentStatusService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for new invoice files, either uploaded directly or through a pre-signed session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceSubmissionService {

    private final DocumentRecordRepository documentRecordRepository;
    private final S3StorageService s3StorageService;
    private final UploadValidationService uploadValidationService;
    private final AnalysisJobStarter analysisJobStarter;
    private final AsyncTaskManager asyncTaskManager;
    private final DocumentStatusService documentStatusService;

    /**
     * Stores the file, creates its record and starts analysis before returning. Not transactional:
     * each stage commits on its own and a failure reports the stage it reached.
     *
     * @throws ValidationException    if the file fails validation; nothing is stored.
     * @throws PipelineStageException if storage, record creation or the job start fails.
     */
    public DocumentStatusResponse submit(final String organisationId, final String locationId, final String fileName,
                                         final String mimeType, final byte[] content) {
        uploadValidationService.validateFile(fileName, mimeType, content == null ? 0 : content.length);
        log.info("Direct submission of '{}' ({} bytes) for organisation {}, location {}.", fileName, content.length,
                 organisationId, locationId);

        final String storageKey = S3StorageService.constructDocumentKey(organisationId);
        try {
            s3StorageService.upload(storageKey, content, mimeType);
        } catch (StorageException e) {
            throw new PipelineStageException(PipelineStage.STORAGE, null, null,
                                             "Failed to store the file; nothing was saved.", e);
        }

        final DocumentRecord record;
        try {
            record = documentRecordRepository.saveAndFlush(DocumentRecord.builder()
                                                                         .organisationId(organisationId)
                                                                         .locationId(locationId)
                                                                         .sourceType(SourceType.UPLOAD)
                                                                         .fileName(fileName)
                                                                         .mimeType(mimeType)
                                                                         .fileSizeBytes((long) content.length)
                                                                         .storageKey(storageKey)
                                                                         .processingStatus(
                                                                                 ProcessingStatus.PENDING_ANALYSIS)
                                                                         .build());
        } catch (DataAccessException e) {
            log.error("Record creation failed after storing '{}'; object {} is orphaned.", fileName, storageKey, e);
            throw new PipelineStageException(PipelineStage.RECORD_CREATE, null, null,
                                             "The file was stored but its record could not be created.", e);
        }

        final AnalysisStartOutcome outcome = analysisJobStarter.startAnalysis(record.getId());
        if (outcome.result() == AnalysisStartOutcome.Result.FAILED) {
            throw new PipelineStageException(PipelineStage.ANALYSIS_START, record.getId(), outcome.providerErrorCode(),
                                             "The document was saved but analysis could not be started: "
                                                     + outcome.message(), null);
        }

        return documentStatusService.toResponse(documentRecordRepository.findById(record.getId()).orElse(record));
    }

    /**
     * Creates one {@code UPLOADING} record per file, sharing a batch id, and returns a pre-signed PUT
     * URL for each.
     */
    @Transactional
    public UploadSessionResponse createUploadSession(final String organisationId, final String locationId,
                                                     final List<UploadSessionFile> files) {
        if (CollectionUtils.isEmpty(files)) {
            throw new ValidationException(ErrorCode.INVALID_FILE, "At least one file is required.");
        }
        uploadValidationService.validateSessionSize(files.size());
        files.forEach(f -> uploadValidationService.validateFile(f.fileName(), f.mimeType(),
                                                                f.fileSizeBytes() == null ? 0 : f.fileSizeBytes()));

        final UUID uploadBatchId = UUID.randomUUID();
        final long expiresInSeconds = s3StorageService.getPresignedUrlDurationSeconds();
        final List<UploadSessionEntry> entries = new ArrayList<>();
        for (UploadSessionFile file : files) {
            final String storageKey = S3StorageService.constructDocumentKey(organisationId, file.fileName());
            final DocumentRecord record = documentRecordRepository.save(DocumentRecord.builder()
                    .organisationId(organisationId)
                    .locationId(locationId)
                    .sourceType(SourceType.UPLOAD)
                    .fileName(file.fileName())
                    .mimeType(file.mimeType())
                    .fileSizeBytes(file.fileSizeBytes())
                    .storageKey(storageKey)
                    .uploadBatchId(uploadBatchId)
                    .processingStatus(ProcessingStatus.UPLOADING)
                    .build());
            entries.add(new UploadSessionEntry(record.getId(), file.fileName(),
                                               s3StorageService.generatePresignedUploadUrl(storageKey,
                                                                                           file.mimeType()),
                                               expiresInSeconds));
        }
        log.info("Opened upload session {} with {} file(s) for organisation {}, location {}.", uploadBatchId,
                 entries.size(), organisationId, locationId);
        return new UploadSessionResponse(uploadBatchId, entries);
    }

    /**
     * Confirms that the client finished a pre-signed upload. The record becomes
     * {@code PENDING_ANALYSIS} immediately; the job starts once this transaction commits.
     *
     * @throws InvalidStateException if the record is not {@code UPLOADING}.
     */
    @Transactional
    public DocumentStatusResponse completeUpload(final String organisationId, final UUID documentId) {
        final DocumentRecord record = documentRecordRepository
                .findByIdAndOrganisationIdAndDeletedAtIsNull(documentId, organisationId)
                .orElseThrow(() -> NotFoundException.document(documentId));
        if (record.getProcessingStatus() != ProcessingStatus.UPLOADING || record.getStorageKey() == null) {
            throw new InvalidStateException("Document " + documentId + " is " + record.getProcessingStatus()
                                                    + " and cannot be completed.");
        }
        record.setProcessingStatus(ProcessingStatus.PENDING_ANALYSIS);
        final DocumentRecord saved = documentRecordRepository.save(record);
        asyncTaskManager.scheduleAnalysisStartAfterCommit(documentId);
        log.info("Upload of document {} completed; analysis will start after commit.", documentId);
        return documentStatusService.toResponse(saved);
    }
}
