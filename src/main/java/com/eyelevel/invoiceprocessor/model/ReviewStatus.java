package com.eyelevel.invoiceprocessor.model;

/**
 * Human sign-off state, independent of {@link ProcessingStatus}.
 */
public enum ReviewStatus {
    NONE,
    NEEDS_REVIEW,
    VERIFIED
}
