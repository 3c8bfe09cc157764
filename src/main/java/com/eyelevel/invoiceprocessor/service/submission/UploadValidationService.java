package com.eyelevel.invoiceprocessor.service.submission;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.exception.ErrorCode;
import com.eyelevel.invoiceprocessor.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Checks file metadata against the configured upload limits before anything is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadValidationService {

    private final InvoiceProcessingConfig processingConfig;

    /**
     * @throws ValidationException if the file is empty, too large or of an unsupported type.
     */
    public void validateFile(final String fileName, final String mimeType, final long sizeBytes) {
        if (!StringUtils.hasText(fileName)) {
            throw new ValidationException(ErrorCode.INVALID_FILE, "File name is required.");
        }
        if (sizeBytes <= 0) {
            throw new ValidationException(ErrorCode.INVALID_FILE, "File '" + fileName + "' is empty.");
        }
        final long maxSize = processingConfig.getUpload().getMaxFileSizeBytes();
        if (sizeBytes > maxSize) {
            log.warn("Rejected '{}': {} bytes exceeds the {} byte limit.", fileName, sizeBytes, maxSize);
            throw new ValidationException(ErrorCode.FILE_TOO_LARGE,
                                          String.format("File '%s' exceeds the maximum size of %d MB.", fileName,
                                                        maxSize / (1024 * 1024)));
        }
        final String normalizedType = mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT).trim();
        if (!processingConfig.getUpload().getAllowedMimeTypes().contains(normalizedType)) {
            log.warn("Rejected '{}': unsupported media type '{}'.", fileName, mimeType);
            throw new ValidationException(ErrorCode.UNSUPPORTED_MEDIA_TYPE,
                                          "File '" + fileName + "' has unsupported type '" + mimeType
                                                  + "'. Allowed: " + processingConfig.getUpload()
                                                                                     .getAllowedMimeTypes());
        }
    }

    public void validateSessionSize(final int fileCount) {
        final int maxFiles = processingConfig.getUpload().getMaxSessionFiles();
        if (fileCount > maxFiles) {
            throw new ValidationException(ErrorCode.TOO_MANY_FILES,
                                          "An upload session accepts at most " + maxFiles + " files.");
        }
    }
}
