package com.eyelevel.invoiceprocessor.service.analysis;

import com.eyelevel.invoiceprocessor.exception.AnalysisProviderException;

/**
 * Black-box job API of the document-analysis provider. Calls are at-least-once and the provider
 * may be unreachable at any time.
 */
public interface DocumentAnalysisClient {

    /**
     * Starts an analysis job for a stored document.
     *
     * @param storageKey object storage key of the document.
     *
     * @return the provider's job handle.
     *
     * @throws AnalysisProviderException if the provider refuses the job or cannot be reached.
     */
    String startJob(String storageKey);

    /**
     * Fetches the current state of a job and, when it succeeded, its parsed payload.
     *
     * @throws AnalysisProviderException if the status cannot be fetched.
     */
    AnalysisJobStatus getJobStatus(String jobHandle);
}
