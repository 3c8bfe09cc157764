package com.eyelevel.invoiceprocessor.exception;

import java.io.Serial;

/**
 * Caller-supplied input is invalid. Raised before any state is mutated.
 */
public class ValidationException extends InvoiceProcessingException {

    @Serial
    private static final long serialVersionUID = 7265839023381950842L;

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
