package com.eyelevel.invoiceprocessor.model;

/**
 * Indicates how a document entered the system.
 */
public enum SourceType {
    /**
     * Uploaded by a user, either directly or through a presigned upload session.
     */
    UPLOAD,

    /**
     * Received as an attachment of a forwarded email.
     */
    EMAIL,

    /**
     * Pulled in as an attachment of a bill synced from an accounting system.
     */
    ACCOUNTING_SYNC
}
