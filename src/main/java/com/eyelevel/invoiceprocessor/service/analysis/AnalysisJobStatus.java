package com.eyelevel.invoiceprocessor.service.analysis;

import com.eyelevel.invoiceprocessor.service.analysis.parsing.ParsedInvoice;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of an analysis job as reported by the provider.
 *
 * @param state          decoded job state
 * @param providerStatus the provider's raw status string, for logging
 * @param statusMessage  the provider's explanation, typically only present on failure
 * @param parsed         extracted invoice; only present when {@code state} is {@code SUCCEEDED}
 * @param rawPayload     provider payload flattened into plain maps; only present on success
 */
public record AnalysisJobStatus(AnalysisJobState state,
                                String providerStatus,
                                String statusMessage,
                                ParsedInvoice parsed,
                                List<Map<String, Object>> rawPayload) {

    public static AnalysisJobStatus running(String providerStatus) {
        return new AnalysisJobStatus(AnalysisJobState.RUNNING, providerStatus, null, null, null);
    }

    public static AnalysisJobStatus failed(String providerStatus, String statusMessage) {
        return new AnalysisJobStatus(AnalysisJobState.FAILED, providerStatus, statusMessage, null, null);
    }

    public static AnalysisJobStatus unknown(String providerStatus) {
        return new AnalysisJobStatus(AnalysisJobState.UNKNOWN, providerStatus, null, null, null);
    }

    public static AnalysisJobStatus succeeded(String providerStatus, ParsedInvoice parsed,
                                              List<Map<String, Object>> rawPayload) {
        return new AnalysisJobStatus(AnalysisJobState.SUCCEEDED, providerStatus, null, parsed, rawPayload);
    }
}
