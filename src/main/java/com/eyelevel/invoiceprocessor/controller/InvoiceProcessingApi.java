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
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@Tag(name = "Invoice Processing", description = "Endpoints for submitting invoices, tracking their analysis and reviewing the extracted data.")
public interface InvoiceProcessingApi {

    // --- 1. SUBMISSION ---

    @Operation(summary = "Submit Invoice File",
            description = "Stores the file, creates its document record and starts analysis before returning. A failure reports the stage it reached.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Document accepted and analysis started.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Invoice accepted for analysis.",
                                        "response": {
                                            "id": "8d4c1f9e-3a57-4b8e-9d0f-5b7a1e2c3d4f",
                                            "fileName": "invoice-0042.pdf",
                                            "processingStatus": "ANALYZING",
                                            "reviewStatus": "NONE",
                                            "attemptCount": 0
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Empty file, unsupported media type or file too large.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Storage, record creation or analysis start failed. The error detail names the stage.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<DocumentStatusResponse>> submitInvoice(
            @Parameter(description = "Owning organisation.", required = true) @PathVariable String organisationId,
            @Parameter(description = "Location the invoice belongs to.", required = true) @PathVariable String locationId,
            @Parameter(description = "PDF, JPEG or PNG, at most 20 MB.", required = true) @RequestPart("file") MultipartFile file);

    @Operation(summary = "Create Upload Session",
            description = "Creates one UPLOADING document per file, all sharing a batch id, and returns a pre-signed PUT URL for each. At most 25 files.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Session created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Too many files or an invalid file.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadSessionResponse>> createUploadSession(
            @PathVariable String organisationId,
            @PathVariable String locationId,
            @Valid @RequestBody UploadSessionRequest request);

    @Operation(summary = "Complete Upload",
            description = "Confirms that a pre-signed upload finished. The document moves to PENDING_ANALYSIS and analysis starts in the background.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Upload confirmed."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "The document is not UPLOADING."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Document not found.")
    })
    ResponseEntity<ApiResponse<DocumentStatusResponse>> completeUpload(
            @PathVariable String organisationId,
            @Parameter(description = "The document created by the upload session.", required = true) @PathVariable UUID documentId);

    // --- 2. STATUS ---

    @Operation(summary = "Get Document Status",
            description = "Returns the document's state with a short-lived download URL. A document still ANALYZING is checked against the provider first.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Document not found.")
    })
    ResponseEntity<ApiResponse<DocumentStatusResponse>> getDocumentStatus(
            @PathVariable String organisationId,
            @PathVariable UUID documentId);

    @Operation(summary = "Refresh Document Statuses",
            description = "Checks up to 20 documents against the analysis provider and reports one result per id, in request order.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Batch refreshed.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Batch refresh completed.",
                                        "response": [
                                            { "id": "8d4c1f9e-3a57-4b8e-9d0f-5b7a1e2c3d4f", "action": "CHECKED", "processingStatus": "ANALYSIS_COMPLETE", "reviewStatus": "NEEDS_REVIEW" },
                                            { "id": "0b6a2c1d-77e4-4f11-8a0e-2e9c4b5d6a7f", "action": "SKIPPED_NOT_FOUND" }
                                        ],
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "No ids or more than 20 ids.")
    })
    ResponseEntity<ApiResponse<List<BatchRefreshResult>>> refreshStatuses(
            @PathVariable String organisationId,
            @PathVariable String locationId,
            @Valid @RequestBody BatchRefreshRequest request);

    @Operation(summary = "List Documents", description = "Lists a location's documents, newest first. Page size is capped at 100.")
    ResponseEntity<ApiResponse<Page<DocumentStatusResponse>>> listDocuments(
            @PathVariable String organisationId,
            @PathVariable String locationId,
            @Parameter(description = "ALL, PENDING (awaiting review), REVIEWED or DELETED.") @RequestParam(value = "filter", defaultValue = "ALL") DocumentListFilter filter,
            @Parameter(description = "Zero-based page index.") @RequestParam(value = "page", defaultValue = "0") int page,
            @Parameter(description = "Page size.") @RequestParam(value = "size", defaultValue = "20") int size);

    @Operation(summary = "Count Documents Awaiting Review")
    ResponseEntity<ApiResponse<Long>> countNeedingReview(
            @PathVariable String organisationId,
            @PathVariable String locationId);

    // --- 3. LIFECYCLE ---

    @Operation(summary = "Retry Failed Document",
            description = "Sends an ANALYSIS_FAILED document back for analysis if it has attempts left.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Retry accepted."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Not failed, or no attempts left (RETRY_EXHAUSTED)."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Document not found.")
    })
    ResponseEntity<ApiResponse<DocumentStatusResponse>> retryDocument(
            @PathVariable String organisationId,
            @PathVariable UUID documentId);

    @Operation(summary = "Replace File",
            description = "Replaces the stored file, discards previous results and starts analysis from scratch.")
    ResponseEntity<ApiResponse<DocumentStatusResponse>> replaceFile(
            @PathVariable String organisationId,
            @PathVariable UUID documentId,
            @RequestPart("file") MultipartFile file);

    @Operation(summary = "Verify Extracted Invoice",
            description = "Confirms the extracted invoice, optionally pruning line items, overriding the total or date and recording a supplier alias.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Invoice verified."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid line item selection, unknown supplier or no supplier given."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Document not found.")
    })
    ResponseEntity<ApiResponse<ExtractedDocumentResponse>> verifyDocument(
            @PathVariable String organisationId,
            @PathVariable UUID documentId,
            @Valid @RequestBody VerifyRequest request);

    @Operation(summary = "Revert Verification")
    ResponseEntity<ApiResponse<DocumentStatusResponse>> revertVerification(
            @PathVariable String organisationId,
            @PathVariable UUID documentId);

    @Operation(summary = "Create Manual Entry",
            description = "Returns the extracted invoice of a failed document, creating an empty one to fill in by hand if needed.")
    ResponseEntity<ApiResponse<ExtractedDocumentResponse>> createManualEntry(
            @PathVariable String organisationId,
            @PathVariable UUID documentId);

    @Operation(summary = "Delete Document", description = "Soft-deletes the document. It can be restored.")
    ResponseEntity<ApiResponse<Void>> deleteDocument(
            @PathVariable String organisationId,
            @PathVariable UUID documentId);

    @Operation(summary = "Restore Document")
    ResponseEntity<ApiResponse<DocumentStatusResponse>> restoreDocument(
            @PathVariable String organisationId,
            @PathVariable UUID documentId);

    @Operation(summary = "Bulk Delete Documents")
    ResponseEntity<ApiResponse<BulkOperationResponse>> bulkDelete(
            @PathVariable String organisationId,
            @Valid @RequestBody BulkIdsRequest request);

    @Operation(summary = "Bulk Restore Documents")
    ResponseEntity<ApiResponse<BulkOperationResponse>> bulkRestore(
            @PathVariable String organisationId,
            @Valid @RequestBody BulkIdsRequest request);

    @Operation(summary = "Permanently Delete Document",
            description = "Removes the document, its extracted invoice and all analysis results. This cannot be undone.")
    ResponseEntity<ApiResponse<Void>> hardDeleteDocument(
            @PathVariable String organisationId,
            @PathVariable UUID documentId);
}
