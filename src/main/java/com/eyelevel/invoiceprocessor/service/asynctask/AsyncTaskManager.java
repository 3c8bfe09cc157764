package com.eyelevel.invoiceprocessor.service.asynctask;

import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStarter;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisStartOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * Schedules analysis job starts that must only run once the transaction which moved the record
 * into {@code PENDING_ANALYSIS} has committed. Callbacks run on the managed application pool.
 */
@Slf4j
@Service
public class AsyncTaskManager {

    private final AnalysisJobStarter analysisJobStarter;
    private final AsyncTaskExecutor taskExecutor;

    public AsyncTaskManager(AnalysisJobStarter analysisJobStarter,
                            @Qualifier("applicationTaskExecutor") AsyncTaskExecutor taskExecutor) {
        this.analysisJobStarter = analysisJobStarter;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Starts analysis for the document after the current transaction commits. Without an active
     * transaction the start is submitted right away. A failed start is already recorded on the
     * document and the janitor picks it up later, so the caller is never notified.
     *
     * @param documentId The document to start analysis for.
     */
    public void scheduleAnalysisStartAfterCommit(final UUID documentId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            submitStart(documentId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                log.info("DB transaction committed for document ID: {}. Scheduling analysis start.", documentId);
                submitStart(documentId);
            }
        });
    }

    private void submitStart(final UUID documentId) {
        taskExecutor.execute(() -> {
            try {
                final AnalysisStartOutcome outcome = analysisJobStarter.startAnalysis(documentId);
                log.info("Async analysis start for document {} finished with {}.", documentId, outcome.result());
            } catch (RuntimeException e) {
                log.error("Async analysis start for document {} failed unexpectedly.", documentId, e);
            }
        });
    }
}
