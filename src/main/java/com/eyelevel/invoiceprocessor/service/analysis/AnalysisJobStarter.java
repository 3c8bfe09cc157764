package com.eyelevel.invoiceprocessor.service.analysis;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.exception.AnalysisProviderException;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.service.document.DocumentRecordAtomicService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

/**
 * Starts the external analysis job for a record in {@code PENDING_ANALYSIS}. Used by direct
 * submission, upload completion, manual retry, file replacement and the janitor.
 * <p>
 * Runs outside any caller transaction: the provider call is made first and the outcome is then
 * written by {@link DocumentRecordAtomicService} in a transaction of its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisJobStarter {

    private final DocumentRecordAtomicService atomicService;
    private final DocumentAnalysisClient analysisClient;
    private final InvoiceProcessingConfig processingConfig;

    public AnalysisStartOutcome startAnalysis(final UUID documentId) {
        return startAnalysis(documentId, false);
    }

    /**
     * Starts analysis for a stale pending record on behalf of the janitor; a successful start
     * consumes an attempt.
     */
    public AnalysisStartOutcome restartStalePending(final UUID documentId) {
        return startAnalysis(documentId, true);
    }

    private AnalysisStartOutcome startAnalysis(final UUID documentId, final boolean countAttempt) {
        final Optional<DocumentRecord> found = atomicService.findLive(documentId);
        if (found.isEmpty()) {
            log.info("Skipping analysis start for document {}: not found or deleted.", documentId);
            return AnalysisStartOutcome.skipped("Document not found or deleted.");
        }
        final DocumentRecord record = found.get();
        if (record.getProcessingStatus() != ProcessingStatus.PENDING_ANALYSIS) {
            log.info("Skipping analysis start for document {}: status is {}.", documentId,
                     record.getProcessingStatus());
            return AnalysisStartOutcome.skipped("Document is " + record.getProcessingStatus() + ".");
        }
        if (record.getAttemptCount() >= processingConfig.getMaxRetries()) {
            atomicService.markRetryExhausted(documentId);
            return AnalysisStartOutcome.failed(null, "Maximum analysis attempts (" + processingConfig.getMaxRetries()
                    + ") already reached.");
        }
        if (!StringUtils.hasText(record.getStorageKey())) {
            final String message = "Document has no stored file.";
            atomicService.markStartFailed(documentId, message);
            return AnalysisStartOutcome.failed(null, message);
        }

        final String jobId;
        try {
            jobId = analysisClient.startJob(record.getStorageKey());
        } catch (AnalysisProviderException e) {
            log.error("Analysis start failed for document {} (provider error code: {}).", documentId,
                      e.getProviderErrorCode(), e);
            atomicService.markStartFailed(documentId, e.getMessage());
            return AnalysisStartOutcome.failed(e.getProviderErrorCode(), e.getMessage());
        }

        if (!atomicService.markAnalysisStarted(documentId, jobId, countAttempt)) {
            return AnalysisStartOutcome.skipped("Document changed state while the job was starting.");
        }
        return AnalysisStartOutcome.started(jobId);
    }
}
