package com.eyelevel.invoiceprocessor.dto.submission;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Schema(description = "One file the client intends to upload through a pre-signed URL.")
public record UploadSessionFile(
        @Schema(description = "Original file name.", example = "invoice-0042.pdf")
        @NotBlank(message = "fileName is required.")
        String fileName,

        @Schema(description = "MIME type of the file.", example = "application/pdf")
        @NotBlank(message = "mimeType is required.")
        String mimeType,

        @Schema(description = "File size in bytes.", example = "184320")
        @NotNull(message = "fileSizeBytes is required.")
        @Positive(message = "fileSizeBytes must be positive.")
        Long fileSizeBytes
) {
}
