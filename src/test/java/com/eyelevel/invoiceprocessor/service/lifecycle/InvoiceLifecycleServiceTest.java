package com.eyelevel.invoiceprocessor.service.lifecycle;

import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.dto.lifecycle.BulkOperationResponse;
import com.eyelevel.invoiceprocessor.dto.lifecycle.VerifyRequest;
import com.eyelevel.invoiceprocessor.exception.ErrorCode;
import com.eyelevel.invoiceprocessor.exception.InvalidStateException;
import com.eyelevel.invoiceprocessor.exception.NotFoundException;
import com.eyelevel.invoiceprocessor.exception.RetryExhaustedException;
import com.eyelevel.invoiceprocessor.exception.ValidationException;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ExtractedDocument;
import com.eyelevel.invoiceprocessor.model.FailureCategory;
import com.eyelevel.invoiceprocessor.model.LineItem;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import com.eyelevel.invoiceprocessor.repository.AnalysisResultRepository;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.repository.ExtractedDocumentRepository;
import com.eyelevel.invoiceprocessor.service.asynctask.AsyncTaskManager;
import com.eyelevel.invoiceprocessor.service.s3.S3StorageService;
import com.eyelevel.invoiceprocessor.service.status.DocumentStatusService;
import com.eyelevel.invoiceprocessor.service.submission.UploadValidationService;
import com.eyelevel.invoiceprocessor.service.supplier.SupplierDirectory;
import com.eyelevel.invoiceprocessor.support.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvoiceLifecycleServiceTest {

    @Mock
    private DocumentRecordRepository documentRecordRepository;
    @Mock
    private ExtractedDocumentRepository extractedDocumentRepository;
    @Mock
    private AnalysisResultRepository analysisResultRepository;
    @Mock
    private SupplierDirectory supplierDirectory;
    @Mock
    private S3StorageService s3StorageService;
    @Mock
    private UploadValidationService uploadValidationService;
    @Mock
    private AsyncTaskManager asyncTaskManager;
    @Mock
    private DocumentStatusService documentStatusService;

    private InvoiceLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new InvoiceLifecycleService(documentRecordRepository, extractedDocumentRepository,
                                              analysisResultRepository, supplierDirectory, s3StorageService,
                                              uploadValidationService, asyncTaskManager, documentStatusService,
                                              new InvoiceProcessingConfig());
    }

    @Test
    void retryRequeuesFailedDocumentWithoutSpendingAnAttempt() {
        final DocumentRecord record = failed(1);
        stubLive(record);
        when(documentRecordRepository.save(record)).thenReturn(record);

        service.retry(TestDocuments.ORG, record.getId());

        assertThat(record.getProcessingStatus()).isEqualTo(ProcessingStatus.PENDING_ANALYSIS);
        assertThat(record.getAttemptCount()).isEqualTo(1);
        assertThat(record.getFailureReason()).isNull();
        assertThat(record.getAnalysisJobId()).isNull();
        verify(asyncTaskManager).scheduleAnalysisStartAfterCommit(record.getId());
    }

    @Test
    void retryWithNoAttemptsLeftChangesNothing() {
        final DocumentRecord record = failed(3);
        stubLive(record);

        assertThatThrownBy(() -> service.retry(TestDocuments.ORG, record.getId()))
                .isInstanceOf(RetryExhaustedException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.RETRY_EXHAUSTED);

        assertThat(record.getProcessingStatus()).isEqualTo(ProcessingStatus.ANALYSIS_FAILED);
        assertThat(record.getAttemptCount()).isEqualTo(3);
        verify(documentRecordRepository, never()).save(any());
        verifyNoInteractions(asyncTaskManager);
    }

    @Test
    void retryOfAnAnalysingDocumentIsRejected() {
        final DocumentRecord record = TestDocuments.analysing("job-1");
        stubLive(record);

        assertThatThrownBy(() -> service.retry(TestDocuments.ORG, record.getId()))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void documentOfAnotherOrganisationIsNotFound() {
        final UUID id = UUID.randomUUID();
        when(documentRecordRepository.findByIdAndOrganisationIdAndDeletedAtIsNull(id, "org-2"))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.retry("org-2", id)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void replacingTheFileResetsAttemptsAndResults() {
        final DocumentRecord record = failed(3);
        record.setReviewStatus(ReviewStatus.NEEDS_REVIEW);
        final ExtractedDocument extracted = extracted(record, 1L);
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.of(extracted));
        when(documentRecordRepository.save(record)).thenReturn(record);
        final byte[] content = "%PDF".getBytes();

        service.replaceFile(TestDocuments.ORG, record.getId(), "fixed.pdf", "application/pdf", content);

        verify(s3StorageService).upload(anyString(), eq(content), eq("application/pdf"));
        verify(extractedDocumentRepository).delete(extracted);
        verify(analysisResultRepository).deleteAllByDocumentRecordId(record.getId());
        assertThat(record.getAttemptCount()).isZero();
        assertThat(record.getFileName()).isEqualTo("fixed.pdf");
        assertThat(record.getReviewStatus()).isEqualTo(ReviewStatus.NONE);
        assertThat(record.getProcessingStatus()).isEqualTo(ProcessingStatus.PENDING_ANALYSIS);
        verify(asyncTaskManager).scheduleAnalysisStartAfterCommit(record.getId());
    }

    @Test
    void verifyKeepsOnlySelectedLineItems() {
        final DocumentRecord record = completed();
        final ExtractedDocument extracted = extracted(record, 1L, 2L, 3L);
        final UUID supplierId = UUID.randomUUID();
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.of(extracted));
        when(supplierDirectory.supplierExists(supplierId, TestDocuments.ORG)).thenReturn(true);
        when(extractedDocumentRepository.save(extracted)).thenReturn(extracted);

        service.verify(TestDocuments.ORG, record.getId(), VerifyRequest.builder()
                                                                       .supplierId(supplierId)
                                                                       .selectedLineItemIds(List.of(1L, 3L))
                                                                       .total(new BigDecimal("99.00"))
                                                                       .build());

        assertThat(extracted.getLineItems()).extracting(LineItem::getId).containsExactly(1L, 3L);
        assertThat(extracted.isVerified()).isTrue();
        assertThat(extracted.getSupplierId()).isEqualTo(supplierId);
        assertThat(extracted.getTotal()).isEqualByComparingTo("99.00");
        assertThat(record.getReviewStatus()).isEqualTo(ReviewStatus.VERIFIED);
        verify(supplierDirectory, never()).createAlias(any(), anyString(), anyString());
    }

    @Test
    void verifyWithForeignLineItemChangesNothing() {
        final DocumentRecord record = completed();
        final ExtractedDocument extracted = extracted(record, 1L, 2L);
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.of(extracted));

        assertThatThrownBy(() -> service.verify(TestDocuments.ORG, record.getId(),
                                                VerifyRequest.builder()
                                                             .supplierName("Acme")
                                                             .selectedLineItemIds(List.of(1L, 99L))
                                                             .build()))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_LINE_ITEM_SELECTION);

        assertThat(extracted.getLineItems()).hasSize(2);
        assertThat(extracted.isVerified()).isFalse();
        assertThat(record.getReviewStatus()).isEqualTo(ReviewStatus.NEEDS_REVIEW);
        verify(extractedDocumentRepository, never()).save(any());
        verify(documentRecordRepository, never()).save(any());
        verifyNoInteractions(supplierDirectory);
    }

    @Test
    void verifyRequiresAKnownSupplier() {
        final DocumentRecord record = completed();
        final UUID unknown = UUID.randomUUID();
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId()))
                .thenReturn(Optional.of(extracted(record, 1L)));
        when(supplierDirectory.supplierExists(unknown, TestDocuments.ORG)).thenReturn(false);

        assertThatThrownBy(() -> service.verify(TestDocuments.ORG, record.getId(),
                                                VerifyRequest.builder().supplierId(unknown).build()))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_SUPPLIER_ID);

        assertThatThrownBy(() -> service.verify(TestDocuments.ORG, record.getId(), new VerifyRequest()))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.SUPPLIER_REQUIRED);
        verify(documentRecordRepository, never()).save(any());
    }

    @Test
    void verifyByNameCreatesSupplierAndAlias() {
        final DocumentRecord record = completed();
        final ExtractedDocument extracted = extracted(record, 1L);
        final UUID supplierId = UUID.randomUUID();
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.of(extracted));
        when(supplierDirectory.findOrCreateSupplier("Acme Foods", TestDocuments.ORG)).thenReturn(supplierId);
        when(extractedDocumentRepository.save(extracted)).thenReturn(extracted);

        service.verify(TestDocuments.ORG, record.getId(), VerifyRequest.builder()
                                                                       .supplierName("Acme Foods")
                                                                       .createAlias(true)
                                                                       .aliasName("ACME FOODS P/L")
                                                                       .build());

        assertThat(extracted.getLineItems()).hasSize(1);
        verify(supplierDirectory).createAlias(supplierId, "ACME FOODS P/L", TestDocuments.ORG);
    }

    @Test
    void verifyWithoutExtractedDocumentFails() {
        final DocumentRecord record = completed();
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.verify(TestDocuments.ORG, record.getId(),
                                                VerifyRequest.builder().supplierName("Acme").build()))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.EXTRACTED_DOCUMENT_MISSING);
    }

    @Test
    void revertRequiresAVerifiedDocument() {
        final DocumentRecord record = completed();
        stubLive(record);

        assertThatThrownBy(() -> service.revertVerification(TestDocuments.ORG, record.getId()))
                .isInstanceOf(InvalidStateException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.NOT_VERIFIED);
    }

    @Test
    void revertReturnsDocumentToReview() {
        final DocumentRecord record = completed();
        record.setReviewStatus(ReviewStatus.VERIFIED);
        final ExtractedDocument extracted = extracted(record, 1L);
        extracted.setVerified(true);
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.of(extracted));
        when(documentRecordRepository.save(record)).thenReturn(record);

        service.revertVerification(TestDocuments.ORG, record.getId());

        assertThat(record.getReviewStatus()).isEqualTo(ReviewStatus.NEEDS_REVIEW);
        assertThat(extracted.isVerified()).isFalse();
    }

    @Test
    void manualEntryIsOnlyForFailedDocuments() {
        final DocumentRecord record = completed();
        stubLive(record);

        assertThatThrownBy(() -> service.createManualEntry(TestDocuments.ORG, record.getId()))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void manualEntryCreatesEmptyExtractedDocument() {
        final DocumentRecord record = failed(3);
        stubLive(record);
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.empty());
        when(extractedDocumentRepository.save(any(ExtractedDocument.class))).thenAnswer(i -> i.getArgument(0));

        service.createManualEntry(TestDocuments.ORG, record.getId());

        assertThat(record.getProcessingStatus()).isEqualTo(ProcessingStatus.ANALYSIS_FAILED);
        assertThat(record.getReviewStatus()).isEqualTo(ReviewStatus.NEEDS_REVIEW);
        verify(extractedDocumentRepository).save(any(ExtractedDocument.class));
    }

    @Test
    void restoreOnlyAppliesToDeletedDocuments() {
        final DocumentRecord live = completed();
        when(documentRecordRepository.findByIdAndOrganisationId(live.getId(), TestDocuments.ORG))
                .thenReturn(Optional.of(live));

        assertThatThrownBy(() -> service.restore(TestDocuments.ORG, live.getId()))
                .isInstanceOf(NotFoundException.class);

        final DocumentRecord deleted = completed();
        deleted.setDeletedAt(LocalDateTime.now().minusDays(1));
        when(documentRecordRepository.findByIdAndOrganisationId(deleted.getId(), TestDocuments.ORG))
                .thenReturn(Optional.of(deleted));
        when(documentRecordRepository.save(deleted)).thenReturn(deleted);

        service.restore(TestDocuments.ORG, deleted.getId());
        assertThat(deleted.getDeletedAt()).isNull();
    }

    @Test
    void bulkDeleteSkipsUnknownAndAlreadyDeletedIds() {
        final DocumentRecord live = completed();
        final DocumentRecord deleted = completed();
        deleted.setDeletedAt(LocalDateTime.now());
        final UUID unknown = UUID.randomUUID();
        when(documentRecordRepository.findAllByIdInAndOrganisationId(anyCollection(), eq(TestDocuments.ORG)))
                .thenReturn(List.of(live, deleted));
        when(documentRecordRepository.softDeleteAll(eq(List.of(live.getId())), eq(TestDocuments.ORG),
                                                    any(LocalDateTime.class))).thenReturn(1);

        final BulkOperationResponse response = service.bulkDelete(
                TestDocuments.ORG, List.of(live.getId(), deleted.getId(), unknown, live.getId()));

        assertThat(response.requested()).isEqualTo(3);
        assertThat(response.affected()).isEqualTo(1);
        assertThat(response.skippedIds()).containsExactly(deleted.getId(), unknown);
    }

    @Test
    void bulkRestoreWithNothingEligibleTouchesNoRows() {
        final DocumentRecord live = completed();
        when(documentRecordRepository.findAllByIdInAndOrganisationId(anyCollection(), eq(TestDocuments.ORG)))
                .thenReturn(List.of(live));

        final BulkOperationResponse response = service.bulkRestore(TestDocuments.ORG, List.of(live.getId()));

        assertThat(response.affected()).isZero();
        verify(documentRecordRepository, never()).restoreAll(anyList(), anyString(), any());
    }

    @Test
    void hardDeleteRemovesEverything() {
        final DocumentRecord record = completed();
        record.setDeletedAt(LocalDateTime.now());
        final ExtractedDocument extracted = extracted(record, 1L);
        when(documentRecordRepository.findByIdAndOrganisationId(record.getId(), TestDocuments.ORG))
                .thenReturn(Optional.of(record));
        when(extractedDocumentRepository.findByDocumentRecordId(record.getId())).thenReturn(Optional.of(extracted));

        service.hardDelete(TestDocuments.ORG, record.getId());

        verify(extractedDocumentRepository).delete(extracted);
        verify(analysisResultRepository).deleteAllByDocumentRecordId(record.getId());
        verify(documentRecordRepository).delete(record);
    }

    private void stubLive(final DocumentRecord record) {
        when(documentRecordRepository.findByIdAndOrganisationIdAndDeletedAtIsNull(record.getId(), TestDocuments.ORG))
                .thenReturn(Optional.of(record));
    }

    private static DocumentRecord failed(final int attempts) {
        final DocumentRecord record = TestDocuments.record(ProcessingStatus.ANALYSIS_FAILED);
        record.setAttemptCount(attempts);
        record.setAnalysisJobId("job-old");
        record.setFailureCategory(FailureCategory.PROVIDER_REJECTED);
        record.setFailureReason("Analysis job failed: unreadable");
        return record;
    }

    private static DocumentRecord completed() {
        final DocumentRecord record = TestDocuments.record(ProcessingStatus.ANALYSIS_COMPLETE);
        record.setAttemptCount(1);
        record.setReviewStatus(ReviewStatus.NEEDS_REVIEW);
        return record;
    }

    private static ExtractedDocument extracted(final DocumentRecord record, final Long... lineItemIds) {
        final ExtractedDocument document = ExtractedDocument.builder()
                                                            .id(UUID.randomUUID())
                                                            .documentRecordId(record.getId())
                                                            .organisationId(record.getOrganisationId())
                                                            .total(new BigDecimal("110.00"))
                                                            .build();
        for (Long id : lineItemIds) {
            document.addLineItem(LineItem.builder().id(id).description("Item " + id).build());
        }
        return document;
    }
}
