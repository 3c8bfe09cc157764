package com.eyelevel.invoiceprocessor.exception;

/**
 * Stable error codes returned to API callers alongside the human-readable message.
 */
public enum ErrorCode {
    DOCUMENT_NOT_FOUND,
    INVALID_STATE,
    NOT_VERIFIED,
    EXTRACTED_DOCUMENT_MISSING,
    RETRY_EXHAUSTED,
    INVALID_LINE_ITEM_SELECTION,
    INVALID_SUPPLIER_ID,
    SUPPLIER_REQUIRED,
    EMPTY_BATCH,
    BATCH_TOO_LARGE,
    TOO_MANY_FILES,
    UNSUPPORTED_MEDIA_TYPE,
    FILE_TOO_LARGE,
    INVALID_FILE,
    STORAGE_FAILURE,
    PIPELINE_STAGE_FAILED,
    PROVIDER_UNAVAILABLE
}
