package com.eyelevel.invoiceprocessor.service.reconciliation;

import com.eyelevel.invoiceprocessor.common.json.JsonSerializer;
import com.eyelevel.invoiceprocessor.model.AnalysisResult;
import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ExtractedDocument;
import com.eyelevel.invoiceprocessor.model.FailureCategory;
import com.eyelevel.invoiceprocessor.model.LineItem;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import com.eyelevel.invoiceprocessor.repository.AnalysisResultRepository;
import com.eyelevel.invoiceprocessor.repository.DocumentRecordRepository;
import com.eyelevel.invoiceprocessor.repository.ExtractedDocumentRepository;
import com.eyelevel.invoiceprocessor.service.analysis.AnalysisJobStatus;
import com.eyelevel.invoiceprocessor.service.analysis.parsing.ParsedInvoice;
import com.eyelevel.invoiceprocessor.service.analysis.parsing.ParsedLineItem;
import com.eyelevel.invoiceprocessor.service.supplier.SupplierDirectory;
import com.eyelevel.invoiceprocessor.service.supplier.SupplierMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes a terminal provider result onto a document. Each call commits on its own so one bad
 * record never rolls back another.
 */
@Slf4j
@Service
public class AnalysisResultRecorder {

    private final DocumentRecordRepository documentRecordRepository;
    private final ExtractedDocumentRepository extractedDocumentRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final SupplierDirectory supplierDirectory;
    private final JsonSerializer jsonSerializer;

    public AnalysisResultRecorder(DocumentRecordRepository documentRecordRepository,
                                  ExtractedDocumentRepository extractedDocumentRepository,
                                  AnalysisResultRepository analysisResultRepository,
                                  SupplierDirectory supplierDirectory,
                                  @Qualifier("jacksonJsonSerializer") JsonSerializer jsonSerializer) {
        this.documentRecordRepository = documentRecordRepository;
        this.extractedDocumentRepository = extractedDocumentRepository;
        this.analysisResultRepository = analysisResultRepository;
        this.supplierDirectory = supplierDirectory;
        this.jsonSerializer = jsonSerializer;
    }

    /**
     * Stores the payload snapshot, creates the extracted document if there is none yet and moves the
     * record to {@code ANALYSIS_COMPLETE} / {@code NEEDS_REVIEW}.
     *
     * @return {@code false} if the record is no longer analysing the given job.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean recordSuccess(final UUID documentId, final String analysisJobId, final AnalysisJobStatus status) {
        final Optional<DocumentRecord> found = findAnalysing(documentId, analysisJobId);
        if (found.isEmpty()) {
            return false;
        }
        final DocumentRecord record = found.get();
        final ParsedInvoice parsed = status.parsed() != null ? status.parsed() : ParsedInvoice.empty();

        analysisResultRepository.save(AnalysisResult.builder()
                                                    .documentRecordId(documentId)
                                                    .analysisJobId(analysisJobId)
                                                    .rawResultJson(jsonSerializer.serialize(status.rawPayload()))
                                                    .parsedResultJson(jsonSerializer.serialize(parsed))
                                                    .build());

        if (extractedDocumentRepository.existsByDocumentRecordId(documentId)) {
            log.info("Extracted document already exists for document {}; keeping it.", documentId);
        } else {
            extractedDocumentRepository.save(toExtractedDocument(record, parsed));
        }

        record.setConfidenceScore(parsed.confidenceScore());
        record.setReviewStatus(ReviewStatus.NEEDS_REVIEW);
        record.setProcessingStatus(ProcessingStatus.ANALYSIS_COMPLETE);
        record.clearFailure();
        documentRecordRepository.save(record);
        log.info("Document {} analysis complete (job {}, confidence {}, {} line item(s)).", documentId, analysisJobId,
                 parsed.confidenceScore(), parsed.lineItems().size());
        return true;
    }

    /**
     * The provider rejected the document. Attempts are left as they are; the janitor decides about
     * retrying.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean recordFailure(final UUID documentId, final String analysisJobId, final AnalysisJobStatus status) {
        final Optional<DocumentRecord> found = findAnalysing(documentId, analysisJobId);
        if (found.isEmpty()) {
            return false;
        }
        final DocumentRecord record = found.get();
        final String reason = status.statusMessage() != null
                ? "Analysis job failed: " + status.statusMessage()
                : "Analysis job failed with provider status " + status.providerStatus() + ".";
        record.markFailed(FailureCategory.PROVIDER_REJECTED, reason);
        documentRecordRepository.save(record);
        log.warn("Document {} analysis failed at the provider (job {}): {}", documentId, analysisJobId, reason);
        return true;
    }

    private Optional<DocumentRecord> findAnalysing(final UUID documentId, final String analysisJobId) {
        final Optional<DocumentRecord> found = documentRecordRepository.findById(documentId)
                .filter(r -> !r.isDeleted())
                .filter(r -> r.getProcessingStatus() == ProcessingStatus.ANALYZING)
                .filter(r -> Objects.equals(r.getAnalysisJobId(), analysisJobId));
        if (found.isEmpty()) {
            log.info("Document {} is no longer analysing job {}; result ignored.", documentId, analysisJobId);
        }
        return found;
    }

    private ExtractedDocument toExtractedDocument(final DocumentRecord record, final ParsedInvoice parsed) {
        final UUID supplierId = parsed.supplierName() == null ? null
                : supplierDirectory.resolve(parsed.supplierName(), record.getOrganisationId())
                                   .map(SupplierMatch::supplierId)
                                   .orElse(null);
        final ExtractedDocument document = ExtractedDocument.builder()
                                                            .documentRecordId(record.getId())
                                                            .organisationId(record.getOrganisationId())
                                                            .supplierId(supplierId)
                                                            .supplierName(parsed.supplierName())
                                                            .invoiceNumber(parsed.invoiceNumber())
                                                            .invoiceDate(parsed.invoiceDate())
                                                            .subtotal(parsed.subtotal())
                                                            .tax(parsed.tax())
                                                            .total(parsed.total())
                                                            .currency(parsed.currency())
                                                            .build();
        for (ParsedLineItem item : parsed.lineItems()) {
            document.addLineItem(LineItem.builder()
                                         .description(item.description())
                                         .productCode(item.productCode())
                                         .quantity(item.quantity())
                                         .unitLabel(item.unitLabel())
                                         .unitPrice(item.unitPrice())
                                         .lineTotal(item.lineTotal())
                                         .confidenceScore(item.confidenceScore())
                                         .build());
        }
        return document;
    }
}
