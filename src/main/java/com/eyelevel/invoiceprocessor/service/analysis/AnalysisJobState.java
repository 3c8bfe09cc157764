package com.eyelevel.invoiceprocessor.service.analysis;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Provider-neutral status of an external analysis job, decoded once at the client boundary.
 */
@Getter
@AllArgsConstructor
public enum AnalysisJobState {
    RUNNING("in_progress"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private static final Map<String, AnalysisJobState> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(AnalysisJobState::getValue, Function.identity()));

    private final String value;

    /**
     * Converts a provider status string into its enum constant. A partial success still produced
     * an extraction and counts as {@link #SUCCEEDED}; anything unrecognised maps to {@link #UNKNOWN}
     * so that newer provider statuses never trigger a transition.
     *
     * @param providerStatus The raw status reported by the provider, may be {@code null}.
     *
     * @return The matching state, or {@code UNKNOWN} as a fallback.
     */
    public static AnalysisJobState fromProviderStatus(final String providerStatus) {
        if (providerStatus == null) {
            return UNKNOWN;
        }
        final String normalized = providerStatus.trim().toLowerCase(Locale.ROOT);
        if ("partial_success".equals(normalized)) {
            return SUCCEEDED;
        }
        return VALUE_MAP.getOrDefault(normalized, UNKNOWN);
    }
}
