package com.eyelevel.invoiceprocessor.dto.lifecycle;

import com.eyelevel.invoiceprocessor.model.ExtractedDocument;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Schema(description = "Invoice header and line items extracted from a document.")
public record ExtractedDocumentResponse(
        UUID id,
        UUID documentRecordId,
        UUID supplierId,
        String supplierName,
        String invoiceNumber,
        LocalDate invoiceDate,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal total,
        String currency,
        boolean verified,
        List<LineItemResponse> lineItems
) {

    public static ExtractedDocumentResponse from(ExtractedDocument document) {
        return new ExtractedDocumentResponse(document.getId(), document.getDocumentRecordId(),
                                             document.getSupplierId(), document.getSupplierName(),
                                             document.getInvoiceNumber(), document.getInvoiceDate(),
                                             document.getSubtotal(), document.getTax(), document.getTotal(),
                                             document.getCurrency(), document.isVerified(),
                                             document.getLineItems().stream().map(LineItemResponse::from).toList());
    }
}
