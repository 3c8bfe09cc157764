package com.eyelevel.invoiceprocessor.model;

/**
 * Why a document ended up in {@link ProcessingStatus#ANALYSIS_FAILED}.
 */
public enum FailureCategory {
    /**
     * The analysis provider refused or could not be reached when starting the job.
     */
    START_FAILED,

    /**
     * The provider accepted the job and later reported it as failed.
     */
    PROVIDER_REJECTED,

    /**
     * No provider signal arrived within the stuck threshold.
     */
    STUCK,

    /**
     * The attempt budget is spent; only an operator action can bring the document back.
     */
    RETRY_EXHAUSTED
}
