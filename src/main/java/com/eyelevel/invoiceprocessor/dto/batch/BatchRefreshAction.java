package com.eyelevel.invoiceprocessor.dto.batch;

public enum BatchRefreshAction {
    /** The provider was asked for the job status. */
    CHECKED,
    /** Not in the organisation and location, or deleted. */
    SKIPPED_NOT_FOUND,
    /** No analysis job in flight. */
    SKIPPED_NOT_PROCESSING,
    ERROR
}
