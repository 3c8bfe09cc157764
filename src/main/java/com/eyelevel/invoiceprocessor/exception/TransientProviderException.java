package com.eyelevel.invoiceprocessor.exception;

import java.io.Serial;

/**
 * Network failure, timeout or throttling while talking to the analysis provider. Never a terminal
 * state on its own: the next scheduled pass tries again.
 */
public class TransientProviderException extends AnalysisProviderException {

    @Serial
    private static final long serialVersionUID = 3362214907116252417L;

    public TransientProviderException(String message, String providerErrorCode, Throwable cause) {
        super(message, providerErrorCode, cause);
    }
}
