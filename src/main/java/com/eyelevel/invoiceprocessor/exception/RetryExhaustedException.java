package com.eyelevel.invoiceprocessor.exception;

import java.io.Serial;

/**
 * The document has used its whole analysis attempt budget.
 */
public class RetryExhaustedException extends InvoiceProcessingException {

    @Serial
    private static final long serialVersionUID = 1L;

    public RetryExhaustedException(int maxRetries) {
        super(ErrorCode.RETRY_EXHAUSTED, "Maximum analysis attempts (" + maxRetries + ") already reached.");
    }
}
