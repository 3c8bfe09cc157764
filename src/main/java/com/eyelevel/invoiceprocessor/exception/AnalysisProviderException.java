package com.eyelevel.invoiceprocessor.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * A call to the document-analysis provider failed. {@code providerErrorCode} carries the provider's
 * own error code when one was returned.
 */
@Getter
public class AnalysisProviderException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -8203305216570981372L;

    private final String providerErrorCode;

    public AnalysisProviderException(String message, String providerErrorCode, Throwable cause) {
        super(message, cause);
        this.providerErrorCode = providerErrorCode;
    }
}
