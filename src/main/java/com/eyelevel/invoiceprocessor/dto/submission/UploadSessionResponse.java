package com.eyelevel.invoiceprocessor.dto.submission;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(description = "Pre-signed upload targets for every file of a session, sharing one batch id.")
public record UploadSessionResponse(
        UUID uploadBatchId,
        List<UploadSessionEntry> entries
) {
}
