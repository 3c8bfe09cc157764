package com.eyelevel.invoiceprocessor.dto.submission;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

@Schema(description = "Request to open a pre-signed upload session for one or more files.")
public record UploadSessionRequest(
        @ArraySchema(schema = @Schema(implementation = UploadSessionFile.class), maxItems = 25)
        @NotEmpty(message = "At least one file is required.")
        List<@Valid UploadSessionFile> files
) {
}
