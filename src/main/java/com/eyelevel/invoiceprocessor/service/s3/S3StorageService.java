package com.eyelevel.invoiceprocessor.service.s3;

import com.eyelevel.invoiceprocessor.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import software.amazon.awssdk.transfer.s3.model.Upload;
import software.amazon.awssdk.transfer.s3.model.UploadRequest;

import java.net.URL;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Object storage gateway for invoice files: uploads through the S3 transfer manager and
 * pre-signed read and write URLs.
 */
@Slf4j
@Service
public class S3StorageService {

    private static final String KEY_PREFIX = "documents";

    private final S3Presigner s3Presigner;
    private final S3TransferManager transferManager;
    private final String bucketName;
    private final long presignedUrlDurationMinutes;

    public S3StorageService(final S3Presigner s3Presigner, final S3TransferManager transferManager,
                            @Value("${aws.s3.bucket}") final String bucketName,
                            @Value("${aws.s3.presigned-url-duration-minutes}") final long presignedUrlDurationMinutes) {
        this.s3Presigner = s3Presigner;
        this.transferManager = transferManager;
        this.bucketName = bucketName;
        this.presignedUrlDurationMinutes = presignedUrlDurationMinutes;
        log.info("S3StorageService initialized for bucket '{}' with a pre-signed URL duration of {} minutes.",
                 bucketName, presignedUrlDurationMinutes);
    }

    /**
     * Key for a directly uploaded or replacement file: {@code documents/{orgId}/{uuid}}.
     */
    public static String constructDocumentKey(final String organisationId) {
        return String.format("%s/%s/%s", KEY_PREFIX, organisationId, UUID.randomUUID());
    }

    /**
     * Key for a presigned session upload: {@code documents/{orgId}/{uuid}-{sanitizedFilename}}.
     */
    public static String constructDocumentKey(final String organisationId, final String fileName) {
        return String.format("%s/%s/%s-%s", KEY_PREFIX, organisationId, UUID.randomUUID(), sanitizeFileName(fileName));
    }

    /**
     * Strips any path component and replaces every character outside {@code [A-Za-z0-9._-]} with an underscore.
     */
    public static String sanitizeFileName(final String fileName) {
        final String baseName = FilenameUtils.getName(fileName);
        if (!StringUtils.hasText(baseName)) {
            return "file";
        }
        return baseName.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    /**
     * Uploads the given bytes and blocks until S3 has acknowledged the write.
     *
     * @throws StorageException if the upload fails for any reason.
     */
    public void upload(final String s3Key, final byte[] content, final String contentType) {
        log.debug("Uploading {} bytes to S3 key: {}", content.length, s3Key);
        try {
            final UploadRequest uploadRequest = UploadRequest.builder()
                    .putObjectRequest(req -> req.bucket(bucketName).key(s3Key).contentType(contentType))
                    .requestBody(AsyncRequestBody.fromBytes(content))
                    .build();

            final Upload upload = transferManager.upload(uploadRequest);
            upload.completionFuture().join();
            log.info("Successfully uploaded object to S3 key: {}", s3Key);
        } catch (CompletionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("S3 upload failed for key: {}", s3Key, cause);
            throw new StorageException("Failed to store file in object storage.", cause);
        } catch (RuntimeException e) {
            log.error("S3 upload failed for key: {}", s3Key, e);
            throw new StorageException("Failed to store file in object storage.", e);
        }
    }

    public URL generatePresignedUploadUrl(final String s3Key, final String contentType) {
        log.debug("Generating pre-signed upload URL for S3 key: {}", s3Key);
        final PutObjectRequest objectRequest = PutObjectRequest.builder()
                                                               .bucket(bucketName)
                                                               .key(s3Key)
                                                               .contentType(contentType)
                                                               .build();

        final PutObjectPresignRequest presignRequest = PutObjectPresignRequest.builder()
                .signatureDuration(Duration.ofMinutes(presignedUrlDurationMinutes))
                .putObjectRequest(objectRequest)
                .build();

        return s3Presigner.presignPutObject(presignRequest).url();
    }

    public URL generatePresignedDownloadUrl(final String s3Key) {
        log.debug("Generating pre-signed download URL for S3 key: {}", s3Key);
        final GetObjectRequest getObjectRequest = GetObjectRequest.builder().bucket(bucketName).key(s3Key).build();

        final GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(Duration.ofMinutes(presignedUrlDurationMinutes))
                .getObjectRequest(getObjectRequest)
                .build();

        return s3Presigner.presignGetObject(presignRequest).url();
    }

    public long getPresignedUrlDurationSeconds() {
        return Duration.ofMinutes(presignedUrlDurationMinutes).toSeconds();
    }
}
