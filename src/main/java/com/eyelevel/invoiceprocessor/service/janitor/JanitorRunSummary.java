package com.eyelevel.invoiceprocessor.service.janitor;

/**
 * Counts from one janitor pass.
 *
 * @param stuckAnalyzingFound   records stuck in ANALYZING when the pass started
 * @param stuckAnalyzingFailed  of those, moved to ANALYSIS_FAILED
 * @param failedFound           retryable failed records when the pass started
 * @param failedRequeued        of those, moved back to PENDING_ANALYSIS
 * @param stuckPendingFound     records stuck in PENDING_ANALYSIS when the pass started
 * @param stuckPendingStarted   of those, with a job started
 * @param stuckPendingFailed    of those, failed on start or for exhausted attempts
 * @param errors                records whose handling threw
 */
public record JanitorRunSummary(int stuckAnalyzingFound,
                                int stuckAnalyzingFailed,
                                int failedFound,
                                int failedRequeued,
                                int stuckPendingFound,
                                int stuckPendingStarted,
                                int stuckPendingFailed,
                                int errors) {

    public int totalFound() {
        return stuckAnalyzingFound + failedFound + stuckPendingFound;
    }
}
