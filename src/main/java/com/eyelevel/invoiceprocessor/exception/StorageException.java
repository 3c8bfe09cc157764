package com.eyelevel.invoiceprocessor.exception;

import java.io.Serial;

public class StorageException extends InvoiceProcessingException {

    @Serial
    private static final long serialVersionUID = 5120398477416203651L;

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_FAILURE, message, cause);
    }
}
