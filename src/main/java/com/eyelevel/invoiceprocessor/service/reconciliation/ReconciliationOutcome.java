package com.eyelevel.invoiceprocessor.service.reconciliation;

public enum ReconciliationOutcome {
    /** Not ANALYZING, no job handle, deleted or missing. */
    NOT_ELIGIBLE,
    STILL_RUNNING,
    UNKNOWN_STATUS,
    COMPLETED,
    FAILED,
    /** The provider could not be asked; the next pass tries again. */
    PROVIDER_ERROR
}
