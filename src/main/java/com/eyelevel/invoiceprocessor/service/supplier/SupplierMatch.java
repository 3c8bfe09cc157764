package com.eyelevel.invoiceprocessor.service.supplier;

import java.util.UUID;

/**
 * @param supplierId the matched supplier
 * @param confidence 1.0 for an exact name match, lower for an alias match
 */
public record SupplierMatch(UUID supplierId, double confidence) {
}
