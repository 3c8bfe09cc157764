package com.eyelevel.invoiceprocessor.service.reconciliation;

import com.eyelevel.invoiceprocessor.exception.AnalysisProviderException;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStatus;
import com.eyelevel.invoiceprocessor.service.analysis.DocumentAnalysisClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Asks the provider about one in-flight job and applies a terminal result. Shared by the scheduled
 * poller, the single-document status poll and the batch refresh.
 * <p>
 * The provider call runs outside any transaction; only the write in {@link AnalysisResultRecorder}
 * is transactional.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisReconciliationService {

    private final DocumentRecordRepository documentRecordRepository;
    private final DocumentAnalysisClient analysisClient;
    private final AnalysisResultRecorder resultRecorder;

    public ReconciliationOutcome reconcile(final UUID documentId) {
        final Optional<DocumentRecord> found = documentRecordRepository.findById(documentId);
        if (found.isEmpty() || !isAwaitingResult(found.get())) {
            return ReconciliationOutcome.NOT_ELIGIBLE;
        }
        final String jobId = found.get().getAnalysisJobId();

        final AnalysisJobStatus status;
        try {
            status = analysisClient.getJobStatus(jobId);
        } catch (AnalysisProviderException e) {
            log.warn("Could not fetch status of job {} for document {} (provider error code: {}): {}", jobId,
                     documentId, e.getProviderErrorCode(), e.getMessage());
            return ReconciliationOutcome.PROVIDER_ERROR;
        }

        switch (status.state()) {
            case SUCCEEDED:
                return resultRecorder.recordSuccess(documentId, jobId, status)
                        ? ReconciliationOutcome.COMPLETED
                        : ReconciliationOutcome.NOT_ELIGIBLE;
            case FAILED:
                return resultRecorder.recordFailure(documentId, jobId, status)
                        ? ReconciliationOutcome.FAILED
                        : ReconciliationOutcome.NOT_ELIGIBLE;
            case RUNNING:
                log.debug("Job {} for document {} is still running.", jobId, documentId);
                return ReconciliationOutcome.STILL_RUNNING;
            default:
                log.warn("Job {} for document {} returned unrecognised status '{}'; leaving it as is.", jobId,
                         documentId, status.providerStatus());
                return ReconciliationOutcome.UNKNOWN_STATUS;
        }
    }

    static boolean isAwaitingResult(final DocumentRecord record) {
        return !record.isDeleted()
                && record.getProcessingStatus() == ProcessingStatus.ANALYZING
                && record.getAnalysisJobId() != null;
    }
}
