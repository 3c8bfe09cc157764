package com.eyelevel.invoiceprocessor.controller;

import com.eyelevel.invoiceprocessor.dto.batch.BatchRefreshRequest;
import com.eyelevel.invoiceprocessor.dto.batch.BatchRefreshResult;
import com.eyelevel.invoiceprocessor.dto.common.ApiResponse;
import com.eyelevel.invoiceprocessor.dto.lifecycle.BulkIdsRequest;
import com.eyelevel.invoiceprocessor.dto.lifecycle.BulkOperationResponse;
import com.eyelevel.invoiceprocessor.dto.lifecycle.ExtractedDocumentResponse;
import com.eyelevel.invoiceprocessor.dto.lifecycle.VerifyRequest;
import com.eyelevel.invoiceprocessor.dto.status.DocumentListFilter;
import com.eyelevel.invoiceprocessor.dto.status.DocumentStatusResponse;
import com.eyelevel.invoiceprocessor.dto.submission.UploadSessionRequest;
import com.eyelevel.invoiceprocessor.dto.submission.UploadSessionResponse;
import com.eyelevel.invoiceprocessor.exception.ErrorCode;
import com.eyelevel.invoiceprocessor.exception.ValidationException;
import com.eyelevel.invoiceprocessor.service.batch.BatchStatusRefreshService;
import com.eyelevel.invoiceprocessor.service.lifecycle.InvoiceLifecycleService;
import com.eyelevel.invoiceprocessor.service.status.DocumentListingService;
import com.eyelevel.invoiceprocessor.service.status.DocumentStatusService;
import com.eyelevel.invoiceprocessor.service.submission.InvoiceSubmissionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for the invoice pipeline: submission, status, review and deletion. Every path
 * is scoped to an organisation. All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/invoices/v1/organisations/{organisationId}")
@RequiredArgsConstructor
@Validated
public class InvoiceProcessingController implements InvoiceProcessingApi {

    private final InvoiceSubmissionService submissionService;
    private final DocumentStatusService documentStatusService;
    private final DocumentListingService documentListingService;
    private final BatchStatusRefreshService batchStatusRefreshService;
    private final InvoiceLifecycleService lifecycleService;

    // --- 1. SUBMISSION ---

    @Override
    @PostMapping(value = "/locations/{locationId}/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> submitInvoice(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable @NotBlank final String locationId,
            @RequestPart("file") final MultipartFile file) {

        log.info("Direct submission of '{}' for organisation: {}, location: {}", file.getOriginalFilename(),
                 organisationId, locationId);

        final DocumentStatusResponse responseData = submissionService.submit(organisationId, locationId,
                                                                             file.getOriginalFilename(),
                                                                             file.getContentType(), readBytes(file));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                             .body(ApiResponse.success(responseData, "Invoice accepted for analysis.",
                                                       HttpStatus.ACCEPTED.value()));
    }

    @Override
    @PostMapping("/locations/{locationId}/upload-sessions")
    public ResponseEntity<ApiResponse<UploadSessionResponse>> createUploadSession(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable @NotBlank final String locationId,
            @Valid @RequestBody final UploadSessionRequest request) {

        log.info("Creating upload session with {} file(s) for organisation: {}, location: {}", request.files().size(),
                 organisationId, locationId);

        final UploadSessionResponse responseData = submissionService.createUploadSession(organisationId, locationId,
                                                                                         request.files());
        return ResponseEntity.ok(ApiResponse.success(responseData, "Upload session created successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/documents/{documentId}/complete")
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> completeUpload(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        log.info("Completing upload for document: {}", documentId);

        final DocumentStatusResponse responseData = submissionService.completeUpload(organisationId, documentId);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Upload completed. Analysis will start shortly.",
                                                     HttpStatus.OK.value()));
    }

    // --- 2. STATUS ---

    @Override
    @GetMapping("/documents/{documentId}")
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> getDocumentStatus(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        log.debug("Fetching status for document: {}", documentId);

        final DocumentStatusResponse responseData = documentStatusService.pollStatus(organisationId, documentId);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Document status retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/locations/{locationId}/documents/refresh-status")
    public ResponseEntity<ApiResponse<List<BatchRefreshResult>>> refreshStatuses(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable @NotBlank final String locationId,
            @Valid @RequestBody final BatchRefreshRequest request) {

        log.info("Batch refresh of {} document(s) for organisation: {}, location: {}", request.ids().size(),
                 organisationId, locationId);

        final List<BatchRefreshResult> responseData = batchStatusRefreshService.refresh(organisationId, locationId,
                                                                                        request.ids());
        return ResponseEntity.ok(ApiResponse.success(responseData, "Batch refresh completed.", HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/locations/{locationId}/documents")
    public ResponseEntity<ApiResponse<Page<DocumentStatusResponse>>> listDocuments(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable @NotBlank final String locationId,
            @RequestParam(value = "filter", defaultValue = "ALL") final DocumentListFilter filter,
            @RequestParam(value = "page", defaultValue = "0") final int page,
            @RequestParam(value = "size", defaultValue = "20") final int size) {

        final Page<DocumentStatusResponse> responseData = documentListingService.list(organisationId, locationId,
                                                                                      filter, page, size);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Documents retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @GetMapping("/locations/{locationId}/documents/review-count")
    public ResponseEntity<ApiResponse<Long>> countNeedingReview(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable @NotBlank final String locationId) {

        final long count = documentListingService.countNeedingReview(organisationId, locationId);
        return ResponseEntity.ok(ApiResponse.success(count, "Review count retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    // --- 3. LIFECYCLE ---

    @Override
    @PostMapping("/documents/{documentId}/retry")
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> retryDocument(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        log.info("Manual retry requested for document: {}", documentId);

        final DocumentStatusResponse responseData = lifecycleService.retry(organisationId, documentId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                             .body(ApiResponse.success(responseData, "Retry accepted.", HttpStatus.ACCEPTED.value()));
    }

    @Override
    @PostMapping(value = "/documents/{documentId}/replace-file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> replaceFile(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId,
            @RequestPart("file") final MultipartFile file) {

        log.info("Replacing file of document: {} with '{}'", documentId, file.getOriginalFilename());

        final DocumentStatusResponse responseData = lifecycleService.replaceFile(organisationId, documentId,
                                                                                 file.getOriginalFilename(),
                                                                                 file.getContentType(),
                                                                                 readBytes(file));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                             .body(ApiResponse.success(responseData, "File replaced. Analysis will start shortly.",
                                                       HttpStatus.ACCEPTED.value()));
    }

    @Override
    @PostMapping("/documents/{documentId}/verify")
    public ResponseEntity<ApiResponse<ExtractedDocumentResponse>> verifyDocument(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId,
            @Valid @RequestBody final VerifyRequest request) {

        log.info("Verifying document: {}", documentId);

        final ExtractedDocumentResponse responseData = lifecycleService.verify(organisationId, documentId, request);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Invoice verified successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/documents/{documentId}/revert")
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> revertVerification(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        final DocumentStatusResponse responseData = lifecycleService.revertVerification(organisationId, documentId);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Verification reverted.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/documents/{documentId}/manual-entry")
    public ResponseEntity<ApiResponse<ExtractedDocumentResponse>> createManualEntry(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        final ExtractedDocumentResponse responseData = lifecycleService.createManualEntry(organisationId, documentId);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Manual entry ready.", HttpStatus.OK.value()));
    }

    @Override
    @DeleteMapping("/documents/{documentId}")
    public ResponseEntity<ApiResponse<Void>> deleteDocument(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        lifecycleService.delete(organisationId, documentId);
        return ResponseEntity.ok(ApiResponse.success(null, "Document deleted.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/documents/{documentId}/restore")
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> restoreDocument(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        final DocumentStatusResponse responseData = lifecycleService.restore(organisationId, documentId);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Document restored.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/documents/bulk-delete")
    public ResponseEntity<ApiResponse<BulkOperationResponse>> bulkDelete(
            @PathVariable @NotBlank final String organisationId,
            @Valid @RequestBody final BulkIdsRequest request) {

        log.info("Bulk delete of {} document(s) for organisation: {}", request.ids().size(), organisationId);

        final BulkOperationResponse responseData = lifecycleService.bulkDelete(organisationId, request.ids());
        return ResponseEntity.ok(ApiResponse.success(responseData, "Bulk delete completed.", HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/documents/bulk-restore")
    public ResponseEntity<ApiResponse<BulkOperationResponse>> bulkRestore(
            @PathVariable @NotBlank final String organisationId,
            @Valid @RequestBody final BulkIdsRequest request) {

        log.info("Bulk restore of {} document(s) for organisation: {}", request.ids().size(), organisationId);

        final BulkOperationResponse responseData = lifecycleService.bulkRestore(organisationId, request.ids());
        return ResponseEntity.ok(ApiResponse.success(responseData, "Bulk restore completed.", HttpStatus.OK.value()));
    }

    @Override
    @DeleteMapping("/documents/{documentId}/permanent")
    public ResponseEntity<ApiResponse<Void>> hardDeleteDocument(
            @PathVariable @NotBlank final String organisationId,
            @PathVariable final UUID documentId) {

        log.warn("Permanent deletion requested for document: {}", documentId);

        lifecycleService.hardDelete(organisationId, documentId);
        return ResponseEntity.ok(ApiResponse.success(null, "Document permanently deleted.", HttpStatus.OK.value()));
    }

    private static byte[] readBytes(final MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ValidationException(ErrorCode.INVALID_FILE, "The uploaded file could not be read.");
        }
    }
}
