package com.eyelevel.invoiceprocessor.model;

/**
 * Automatic pipeline state of a {@link DocumentRecord}.
 */
public enum ProcessingStatus {
    /**
     * Record created for a presigned upload; the client has not confirmed the upload yet.
     */
    UPLOADING,

    /**
     * File is stored and waiting for an analysis job to be started.
     */
    PENDING_ANALYSIS,

    /**
     * An analysis job is in flight; the record carries its job handle.
     */
    ANALYZING,

    ANALYSIS_COMPLETE,

    ANALYSIS_FAILED
}
