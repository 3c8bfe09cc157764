package com.eyelevel.invoiceprocessor.exception;

import lombok.Getter;

import java.io.Serial;
import java.util.UUID;

/**
 * A direct submission failed part-way. The stage tells the caller how far the submission got:
 * nothing persisted for {@link PipelineStage#STORAGE}, an orphaned object for
 * {@link PipelineStage#RECORD_CREATE}, and a failed record for {@link PipelineStage#ANALYSIS_START}.
 */
@Getter
public class PipelineStageException extends InvoiceProcessingException {

    @Serial
    private static final long serialVersionUID = -6098123359122270951L;

    private final PipelineStage stage;
    private final transient UUID documentId;
    private final String providerErrorCode;

    public PipelineStageException(PipelineStage stage, UUID documentId, String providerErrorCode, String message,
                                  Throwable cause) {
        super(ErrorCode.PIPELINE_STAGE_FAILED, message, cause);
        this.stage = stage;
        this.documentId = documentId;
        this.providerErrorCode = providerErrorCode;
    }
}
