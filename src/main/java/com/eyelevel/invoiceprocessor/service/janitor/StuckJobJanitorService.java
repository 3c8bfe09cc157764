package com.eyelevel.invoiceprocessor.service.janitor;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStarter;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisStartOutcome;
import com.eyelevel.invoiceprocessor.service.document.DocumentRecordAtomicService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Recovers documents that stopped moving through the pipeline.
 * <ol>
 *     <li>ANALYZING for longer than the threshold: failed, as STUCK or RETRY_EXHAUSTED.</li>
 *     <li>ANALYSIS_FAILED with attempts left: requeued to PENDING_ANALYSIS.</li>
 *     <li>PENDING_ANALYSIS for longer than the threshold: started directly, or failed as
 *     RETRY_EXHAUSTED when the next attempt would exceed the budget.</li>
 * </ol>
 * All three buckets are selected before any is processed, so a record requeued in this pass is only
 * started by a later one. Each record is handled in its own transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StuckJobJanitorService {

    private final DocumentRecordRepository documentRecordRepository;
    private final DocumentRecordAtomicService atomicService;
    private final AnalysisJobStarter analysisJobStarter;
    private final InvoiceProcessingConfig processingConfig;

    public JanitorRunSummary runJanitorPass() {
        final int maxRetries = processingConfig.getMaxRetries();
        final LocalDateTime cutoff = LocalDateTime.now().minusMinutes(processingConfig.getStuckThresholdMinutes());
        log.info("Janitor pass: looking for documents idle since before {}.", cutoff);

        final List<UUID> stuckAnalyzing = documentRecordRepository.findStaleIds(ProcessingStatus.ANALYZING, cutoff);
        final List<UUID> retryableFailed = documentRecordRepository.findRetryableFailedIds(cutoff, maxRetries);
        final List<UUID> stuckPending = documentRecordRepository.findStaleIds(ProcessingStatus.PENDING_ANALYSIS,
                                                                               cutoff);

        int errors = 0;

        int stuckAnalyzingFailed = 0;
        for (UUID id : stuckAnalyzing) {
            try {
                if (atomicService.failStuckAnalysis(id, cutoff)) {
                    stuckAnalyzingFailed++;
                }
            } catch (RuntimeException e) {
                errors++;
                log.error("Janitor could not fail stuck ANALYZING document {}.", id, e);
            }
        }

        int failedRequeued = 0;
        for (UUID id : retryableFailed) {
            try {
                if (atomicService.requeueFailed(id, cutoff)) {
                    failedRequeued++;
                }
            } catch (RuntimeException e) {
                errors++;
                log.error("Janitor could not requeue failed document {}.", id, e);
            }
        }

        int stuckPendingStarted = 0;
        int stuckPendingFailed = 0;
        for (UUID id : stuckPending) {
            try {
                final Optional<DocumentRecord> record = atomicService.findLive(id);
                if (record.isEmpty()) {
                    continue;
                }
                if (record.get().getAttemptCount() + 1 > maxRetries) {
                    if (atomicService.failExhaustedPending(id, cutoff)) {
                        stuckPendingFailed++;
                    }
                    continue;
                }
                final AnalysisStartOutcome outcome = analysisJobStarter.restartStalePending(id);
                if (outcome.isStarted()) {
                    stuckPendingStarted++;
                } else if (outcome.result() == AnalysisStartOutcome.Result.FAILED) {
                    stuckPendingFailed++;
                    log.warn("Janitor could not start analysis for document {} (provider error code: {}): {}", id,
                             outcome.providerErrorCode(), outcome.message());
                }
            } catch (RuntimeException e) {
                errors++;
                log.error("Janitor could not start analysis for stuck PENDING_ANALYSIS document {}.", id, e);
            }
        }

        final JanitorRunSummary summary = new JanitorRunSummary(stuckAnalyzing.size(), stuckAnalyzingFailed,
                                                                retryableFailed.size(), failedRequeued,
                                                                stuckPending.size(), stuckPendingStarted,
                                                                stuckPendingFailed, errors);
        if (summary.totalFound() == 0) {
            log.debug("Janitor pass finished with nothing to recover.");
        } else {
            log.info("Janitor pass finished: {}", summary);
        }
        return summary;
    }
}
