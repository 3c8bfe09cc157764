package com.eyelevel.invoiceprocessor.dto.lifecycle;

import com.eyelevel.invoiceprocessor.model.LineItem;

import java.math.BigDecimal;

public record LineItemResponse(
        Long id,
        String description,
        String productCode,
        BigDecimal quantity,
        String unitLabel,
        BigDecimal unitPrice,
        BigDecimal lineTotal,
        String categoryCode,
        Double confidenceScore
) {

    public static LineItemResponse from(LineItem item) {
        return new LineItemResponse(item.getId(), item.getDescription(), item.getProductCode(), item.getQuantity(),
                                    item.getUnitLabel(), item.getUnitPrice(), item.getLineTotal(),
                                    item.getCategoryCode(), item.getConfidenceScore());
    }
}
