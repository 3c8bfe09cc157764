package com.eyelevel.invoiceprocessor.service.status;

import com.eyelevel.invoiceprocessor.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.invoiceprocessor.config.InvoiceProcessingConfig;
import com.eyelevel.invoiceprocessor.dto.lifecycle.ExtractedDocumentResponse;
import com.eyelevel.invoiceprocessor.dto.lifecycle.LineItemResponse;
import com.eyelevel.invoiceprocessor.dto.status.DocumentStatusResponse;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import com.eyelevel.invoiceprocessor.model.Supplier;
import com.eyelevel.invoiceprocessor.repository.AnalysisResultRepository;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.repository.ExtractedDocumentRepository;
import com.eyelevel.invoiceprocessor.repository.SupplierAliasRepository;
import com.eyelevel.invoiceprocessor.repository.SupplierRepository;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStarter;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStatus;
import com.eyelevel.invoiceprocessor.service.analysis.DocumentAnalysisClient;
import com.eyelevel.invoiceprocessor.service.analysis.parsing.ParsedInvoice;
import com.eyelevel.invoiceprocessor.service.analysis.parsing.ParsedLineItem;
import com.eyelevel.invoiceprocessor.service.asynctask.AsyncTaskManager;
import com.eyelevel.invoiceprocessor.service.document.DocumentRecordAtomicService;
import com.eyelevel.invoiceprocessor.service.reconciliation.AnalysisReconciliationService;
import com.eyelevel.invoiceprocessor.service.reconciliation.AnalysisResultRecorder;
import com.eyelevel.invoiceprocessor.service.s3.S3StorageService;
import com.eyelevel.invoiceprocessor.service.submission.InvoiceSubmissionService;
import com.eyelevel.invoiceprocessor.service.submission.UploadValidationService;
import com.eyelevel.invoiceprocessor.service.supplier.JpaSupplierDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * A direct submission followed by a status poll, over the real services and an in-memory database.
 * Only object storage and the analysis provider are stubbed.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:analysis-flow;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class InvoiceAnalysisFlowTest {

    private static final String ORG = "org-1";
    private static final String LOCATION = "loc-1";
    private static final byte[] PDF = "%PDF-1.7".getBytes();

    @Autowired
    private DocumentRecordRepository documentRecordRepository;
    @Autowired
    private ExtractedDocumentRepository extractedDocumentRepository;
    @Autowired
    private AnalysisResultRepository analysisResultRepository;
    @Autowired
    private SupplierRepository supplierRepository;
    @Autowired
    private SupplierAliasRepository supplierAliasRepository;
    @Autowired
    private TestEntityManager entityManager;

    private DocumentAnalysisClient analysisClient;
    private InvoiceSubmissionService submissionService;
    private DocumentStatusService statusService;

    @BeforeEach
    void setUp() {
        final InvoiceProcessingConfig config = new InvoiceProcessingConfig();
        analysisClient = mock(DocumentAnalysisClient.class);
        final S3StorageService s3StorageService = mock(S3StorageService.class);

        final DocumentRecordAtomicService atomicService = new DocumentRecordAtomicService(documentRecordRepository,
                                                                                          config);
        final AnalysisJobStarter starter = new AnalysisJobStarter(atomicService, analysisClient, config);
        final AnalysisResultRecorder recorder = new AnalysisResultRecorder(
                documentRecordRepository, extractedDocumentRepository, analysisResultRepository,
                new JpaSupplierDirectory(supplierRepository, supplierAliasRepository),
                new JacksonJsonSerializer(new ObjectMapper().findAndRegisterModules()));
        final AnalysisReconciliationService reconciliationService = new AnalysisReconciliationService(
                documentRecordRepository, analysisClient, recorder);

        statusService = new DocumentStatusService(documentRecordRepository, extractedDocumentRepository,
                                                  reconciliationService, s3StorageService);
        submissionService = new InvoiceSubmissionService(documentRecordRepository, s3StorageService,
                                                         new UploadValidationService(config), starter,
                                                         mock(AsyncTaskManager.class), statusService);
    }

    @Test
    void submittedInvoiceCompletesWithOneLineItemOnTheNextPoll() {
        final UUID supplierId = supplierRepository.save(Supplier.builder()
                                                                .organisationId(ORG)
                                                                .name("Acme Foods")
                                                                .normalizedName("acme foods")
                                                                .build()).getId();
        when(analysisClient.startJob(anyString())).thenReturn("job-1");
        when(analysisClient.getJobStatus("job-1")).thenReturn(succeededWithOneLine());

        final DocumentStatusResponse submitted = submissionService.submit(ORG, LOCATION, "invoice.pdf",
                                                                          "application/pdf", PDF);

        assertThat(submitted.processingStatus()).isEqualTo(ProcessingStatus.ANALYZING);
        assertThat(submitted.reviewStatus()).isEqualTo(ReviewStatus.NONE);
        assertThat(submitted.attemptCount()).isZero();
        assertThat(submitted.extractedDocument()).isNull();
        entityManager.flush();
        entityManager.clear();

        final DocumentStatusResponse polled = statusService.pollStatus(ORG, submitted.id());

        assertThat(polled.processingStatus()).isEqualTo(ProcessingStatus.ANALYSIS_COMPLETE);
        assertThat(polled.reviewStatus()).isEqualTo(ReviewStatus.NEEDS_REVIEW);
        assertThat(polled.confidenceScore()).isEqualTo(88.0);
        final ExtractedDocumentResponse extracted = polled.extractedDocument();
        assertThat(extracted).isNotNull();
        assertThat(extracted.total()).isEqualByComparingTo("100.00");
        assertThat(extracted.supplierId()).isEqualTo(supplierId);
        assertThat(extracted.verified()).isFalse();
        assertThat(extracted.lineItems()).singleElement()
                                         .extracting(LineItemResponse::description)
                                         .isEqualTo("Tomatoes");
        assertThat(analysisResultRepository.count()).isEqualTo(1);
        entityManager.flush();
        entityManager.clear();

        final DocumentStatusResponse again = statusService.pollStatus(ORG, submitted.id());

        assertThat(again.processingStatus()).isEqualTo(ProcessingStatus.ANALYSIS_COMPLETE);
        assertThat(again.extractedDocument().lineItems()).hasSize(1);
        verify(analysisClient, times(1)).getJobStatus("job-1");
    }

    private static AnalysisJobStatus succeededWithOneLine() {
        final ParsedInvoice parsed = new ParsedInvoice("Acme Foods", "INV-100", LocalDate.of(2024, 3, 15),
                                                       new BigDecimal("90.91"), new BigDecimal("9.09"),
                                                       new BigDecimal("100.00"), "AUD", 88.0,
                                                       List.of(new ParsedLineItem("Tomatoes", "TOM-1",
                                                                                  new BigDecimal("10"), "KG",
                                                                                  new BigDecimal("10.00"),
                                                                                  new BigDecimal("100.00"), 91.0)));
        return AnalysisJobStatus.succeeded("SUCCEEDED", parsed, List.of(Map.of("expenseIndex", 1)));
    }
}
