package com.eyelevel.invoiceprocessor.dto.submission;

import io.swagger.v3.oas.annotations.media.Schema;

import java.net.URL;
import java.util.UUID;

/**
 * @param documentId       The record created for this file, in {@code UPLOADING}.
 * @param fileName         The file name as sent by the client.
 * @param uploadUrl        Pre-signed PUT URL for the file.
 * @param expiresInSeconds Lifetime of {@code uploadUrl}.
 */
@Schema(description = "Pre-signed upload target for one file of a session.")
public record UploadSessionEntry(
        UUID documentId,
        String fileName,
        @Schema(example = "https://your-bucket.s3.region.amazonaws.com/...")
        URL uploadUrl,
        long expiresInSeconds
) {
}
