package com.eyelevel.invoiceprocessor.dto.status;

public enum DocumentListFilter {
    ALL,
    /** Awaiting human review. */
    PENDING,
    REVIEWED,
    DELETED
}
