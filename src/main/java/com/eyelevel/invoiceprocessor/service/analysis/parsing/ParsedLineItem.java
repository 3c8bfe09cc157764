package com.eyelevel.invoiceprocessor.service.analysis.parsing;

import java.math.BigDecimal;

public record ParsedLineItem(String description,
                             String productCode,
                             BigDecimal quantity,
                             String unitLabel,
                             BigDecimal unitPrice,
                             BigDecimal lineTotal,
                             Double confidenceScore) {
}
