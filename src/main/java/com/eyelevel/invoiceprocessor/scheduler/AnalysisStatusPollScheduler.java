package com.eyelevel.invoiceprocessor.scheduler;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.service.reconciliation.AnalysisReconciliationService;
import com.eyelevel.invoiceprocessor.service.reconciliation.ReconciliationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Polls the analysis provider for every document with a job in flight and applies finished
 * results. Each pass walks the whole in-flight set in id-ordered pages of {@code pollBatchSize}.
 * A pass that is still running when the next tick fires makes that tick a no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisStatusPollScheduler {

    private final DocumentRecordRepository documentRecordRepository;
    private final AnalysisReconciliationService reconciliationService;
    private final InvoiceProcessingConfig processingConfig;
    private final NonReentrantRunGuard runGuard = new NonReentrantRunGuard();

    @Scheduled(cron = "${app.scheduler.ocr-status-poll}")
    public void pollInFlightJobs() {
        if (!runGuard.runExclusively(this::runPollPass)) {
            log.debug("Previous analysis status poll still running; skipping this tick.");
        }
    }

    void runPollPass() {
        final PageRequest page = PageRequest.of(0, processingConfig.getPollBatchSize());
        final Map<ReconciliationOutcome, Integer> counts = new EnumMap<>(ReconciliationOutcome.class);
        int polled = 0;
        int errors = 0;

        List<UUID> ids = loadPage(null, page);
        while (!CollectionUtils.isEmpty(ids)) {
            for (UUID id : ids) {
                polled++;
                try {
                    counts.merge(reconciliationService.reconcile(id), 1, Integer::sum);
                } catch (RuntimeException e) {
                    errors++;
                    log.error("Reconciliation of document {} failed.", id, e);
                }
            }
            if (ids.size() < page.getPageSize()) {
                break;
            }
            ids = loadPage(ids.get(ids.size() - 1), page);
        }

        if (polled == 0) {
            log.debug("No documents awaiting analysis results.");
            return;
        }
        log.info("Finished analysis status poll of {} document(s): {} (errors: {}).", polled, counts, errors);
    }

    /**
     * Loads the page of in-flight ids after {@code afterId}, or the first page when it is null.
     * A failing scan ends the pass with an empty page.
     */
    private List<UUID> loadPage(final UUID afterId, final PageRequest page) {
        try {
            return afterId == null
                    ? documentRecordRepository.findIdsAwaitingAnalysisResult(page)
                    : documentRecordRepository.findIdsAwaitingAnalysisResultAfter(afterId, page);
        } catch (RuntimeException e) {
            log.error("Could not load documents awaiting analysis results; ending this pass.", e);
            return List.of();
        }
    }
}
