package com.eyelevel.invoiceprocessor.exception;

import java.io.Serial;
import java.util.UUID;

/**
 * The document does not exist, belongs to another organisation, or is soft-deleted where the
 * operation requires a live record.
 */
public class NotFoundException extends InvoiceProcessingException {

    @Serial
    private static final long serialVersionUID = -3051703506470244006L;

    public NotFoundException(String message) {
        super(ErrorCode.DOCUMENT_NOT_FOUND, message);
    }

    public static NotFoundException document(UUID documentId) {
        return new NotFoundException("Document " + documentId + " not found.");
    }
}
