package com.eyelevel.invoiceprocessor.service.document;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.FailureCategory;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-record state transitions, each committed in its own transaction.
 * <p>
 * Every method re-reads the record and re-checks the precondition it was selected on, so a
 * transition computed from a stale scan is dropped instead of overwriting newer state. A method
 * returns {@code false} when the record no longer qualifies.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentRecordAtomicService {

    private final DocumentRecordRepository documentRecordRepository;
    private final InvoiceProcessingConfig processingConfig;

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<DocumentRecord> findLive(final UUID documentId) {
        return documentRecordRepository.findById(documentId).filter(r -> !r.isDeleted());
    }

    /**
     * Records a successful job start: {@code PENDING_ANALYSIS -> ANALYZING} with the provider's handle.
     * <p>
     * Only a janitor restart of a stale pending record counts against the attempt budget; starts from
     * submission, upload completion, manual retry and file replacement do not.
     *
     * @param countAttempt whether this start consumes an attempt
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markAnalysisStarted(final UUID documentId, final String analysisJobId,
                                       final boolean countAttempt) {
        final Optional<DocumentRecord> pending = findInState(documentId, ProcessingStatus.PENDING_ANALYSIS);
        if (pending.isEmpty()) {
            log.warn("Document {} left PENDING_ANALYSIS while job {} was starting; the job result will be ignored.",
                     documentId, analysisJobId);
            return false;
        }
        final DocumentRecord record = pending.get();
        record.setProcessingStatus(ProcessingStatus.ANALYZING);
        record.setAnalysisJobId(analysisJobId);
        if (countAttempt) {
            record.setAttemptCount(record.getAttemptCount() + 1);
        }
        record.setLastAttemptAt(LocalDateTime.now());
        record.clearFailure();
        documentRecordRepository.save(record);
        log.info("Document {} is now ANALYZING under job {} (attempt {}/{}).", documentId, analysisJobId,
                 record.getAttemptCount(), processingConfig.getMaxRetries());
        return true;
    }

    /**
     * Records a failed job start: {@code PENDING_ANALYSIS -> ANALYSIS_FAILED / START_FAILED}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markStartFailed(final UUID documentId, final String errorMessage) {
        final Optional<DocumentRecord> pending = findInState(documentId, ProcessingStatus.PENDING_ANALYSIS);
        if (pending.isEmpty()) {
            return false;
        }
        final DocumentRecord record = pending.get();
        record.setAttemptCount(record.getAttemptCount() + 1);
        record.setLastAttemptAt(LocalDateTime.now());
        record.markFailed(FailureCategory.START_FAILED,
                          String.format("Failed to start analysis (attempt %d/%d): %s", record.getAttemptCount(),
                                        processingConfig.getMaxRetries(), errorMessage));
        documentRecordRepository.save(record);
        log.warn("Document {} failed to start analysis (attempt {}/{}): {}", documentId, record.getAttemptCount(),
                 processingConfig.getMaxRetries(), errorMessage);
        return true;
    }

    /**
     * Fails a pending record whose attempt budget is already used up.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markRetryExhausted(final UUID documentId) {
        final Optional<DocumentRecord> pending = findInState(documentId, ProcessingStatus.PENDING_ANALYSIS);
        if (pending.isEmpty()) {
            return false;
        }
        final DocumentRecord record = pending.get();
        record.markFailed(FailureCategory.RETRY_EXHAUSTED,
                          String.format("Maximum analysis attempts (%d) reached.", processingConfig.getMaxRetries()));
        documentRecordRepository.save(record);
        log.warn("Document {} exhausted its {} analysis attempts.", documentId, processingConfig.getMaxRetries());
        return true;
    }

    /**
     * Janitor bucket 1. Fails a record stuck in {@code ANALYZING} since before the cutoff. The job
     * handle is kept for audit.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failStuckAnalysis(final UUID documentId, final LocalDateTime cutoff) {
        final Optional<DocumentRecord> stuck = findStale(documentId, ProcessingStatus.ANALYZING, cutoff);
        if (stuck.isEmpty()) {
            return false;
        }
        final DocumentRecord record = stuck.get();
        final int maxRetries = processingConfig.getMaxRetries();
        if (record.getAttemptCount() >= maxRetries) {
            record.markFailed(FailureCategory.RETRY_EXHAUSTED,
                              String.format("Stuck in ANALYZING for more than %d minutes after %d attempts.",
                                            processingConfig.getStuckThresholdMinutes(), record.getAttemptCount()));
        } else {
            record.setAttemptCount(record.getAttemptCount() + 1);
            record.markFailed(FailureCategory.STUCK,
                              String.format("Stuck in ANALYZING for more than %d minutes (attempt %d/%d).",
                                            processingConfig.getStuckThresholdMinutes(), record.getAttemptCount(),
                                            maxRetries));
        }
        documentRecordRepository.save(record);
        log.warn("Document {} was stuck in ANALYZING under job {}; marked {} with {} attempt(s).", documentId,
                 record.getAnalysisJobId(), record.getFailureCategory(), record.getAttemptCount());
        return true;
    }

    /**
     * Janitor bucket 2. Puts a failed record with attempts left back into {@code PENDING_ANALYSIS}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean requeueFailed(final UUID documentId, final LocalDateTime cutoff) {
        final Optional<DocumentRecord> failed = findStale(documentId, ProcessingStatus.ANALYSIS_FAILED, cutoff)
                .filter(r -> r.getAttemptCount() < processingConfig.getMaxRetries());
        if (failed.isEmpty()) {
            return false;
        }
        final DocumentRecord record = failed.get();
        record.setProcessingStatus(ProcessingStatus.PENDING_ANALYSIS);
        record.setAttemptCount(record.getAttemptCount() + 1);
        record.setLastAttemptAt(LocalDateTime.now());
        record.setAnalysisJobId(null);
        record.clearFailure();
        documentRecordRepository.save(record);
        log.info("Document {} requeued for analysis (attempt {}/{}).", documentId, record.getAttemptCount(),
                 processingConfig.getMaxRetries());
        return true;
    }

    /**
     * Janitor bucket 3, budget exhausted branch.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failExhaustedPending(final UUID documentId, final LocalDateTime cutoff) {
        final Optional<DocumentRecord> pending = findStale(documentId, ProcessingStatus.PENDING_ANALYSIS, cutoff);
        if (pending.isEmpty()) {
            return false;
        }
        final DocumentRecord record = pending.get();
        record.markFailed(FailureCategory.RETRY_EXHAUSTED,
                          String.format("Stuck in PENDING_ANALYSIS for more than %d minutes after %d attempts.",
                                        processingConfig.getStuckThresholdMinutes(), record.getAttemptCount()));
        documentRecordRepository.save(record);
        log.warn("Document {} stuck in PENDING_ANALYSIS with no attempts left; marked RETRY_EXHAUSTED.", documentId);
        return true;
    }

    private Optional<DocumentRecord> findInState(final UUID documentId, final ProcessingStatus status) {
        return documentRecordRepository.findById(documentId)
                                       .filter(r -> !r.isDeleted())
                                       .filter(r -> r.getProcessingStatus() == status);
    }

    private Optional<DocumentRecord> findStale(final UUID documentId, final ProcessingStatus status,
                                               final LocalDateTime cutoff) {
        return findInState(documentId, status).filter(r -> r.getUpdatedAt() != null
                && r.getUpdatedAt().isBefore(cutoff));
    }
}
