package com.eyelevel.invoiceprocessor.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors surfaced synchronously to callers of the pipeline. Each carries a stable
 * {@link ErrorCode}.
 */
@Getter
public class InvoiceProcessingException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 2604512209174430318L;

    private final ErrorCode errorCode;

    public InvoiceProcessingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public InvoiceProcessingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
