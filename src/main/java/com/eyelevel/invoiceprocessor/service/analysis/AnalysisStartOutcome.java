package com.eyelevel.invoiceprocessor.service.analysis;

/**
 * Result of one attempt to start an analysis job.
 *
 * @param result            what happened
 * @param analysisJobId     provider job handle, only set when {@code result} is {@code STARTED}
 * @param providerErrorCode provider error code for a failed start, when the provider returned one
 * @param message           human-readable detail for failed or skipped starts
 */
public record AnalysisStartOutcome(Result result, String analysisJobId, String providerErrorCode, String message) {

    public enum Result {
        STARTED,
        FAILED,
        /** The record was no longer eligible; nothing was changed. */
        SKIPPED
    }

    public static AnalysisStartOutcome started(String analysisJobId) {
        return new AnalysisStartOutcome(Result.STARTED, analysisJobId, null, null);
    }

    public static AnalysisStartOutcome failed(String providerErrorCode, String message) {
        return new AnalysisStartOutcome(Result.FAILED, null, providerErrorCode, message);
    }

    public static AnalysisStartOutcome skipped(String message) {
        return new AnalysisStartOutcome(Result.SKIPPED, null, null, message);
    }

    public boolean isStarted() {
        return result == Result.STARTED;
    }
}
