package com.eyelevel.invoiceprocessor.exception;

/**
 * Step of the direct submission path at which a failure happened.
 */
public enum PipelineStage {
    STORAGE,
    RECORD_CREATE,
    ANALYSIS_START
}
