package com.eyelevel.invoiceprocessor.service.analysis.parsing;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Invoice fields read from an analysis payload. Every header field is optional.
 *
 * @param confidenceScore mean confidence (0-100) of the summary fields, 0 when there are none
 */
public record ParsedInvoice(String supplierName,
                            String invoiceNumber,
                            LocalDate invoiceDate,
                            BigDecimal subtotal,
                            BigDecimal tax,
                            BigDecimal total,
                            String currency,
                            double confidenceScore,
                            List<ParsedLineItem> lineItems) {

    public static ParsedInvoice empty() {
        return new ParsedInvoice(null, null, null, null, null, null, null, 0, List.of());
    }
}
