package com.eyelevel.invoiceprocessor.exception;

import java.io.Serial;

/**
 * The requested transition is not allowed from the document's current state.
 */
public class InvalidStateException extends InvoiceProcessingException {

    @Serial
    private static final long serialVersionUID = -1432018874622081263L;

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
