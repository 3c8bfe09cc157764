package com.eyelevel.invoiceprocessor.service.supplier;

import java.util.Optional;
import java.util.UUID;

/**
 * Organisation-scoped supplier lookup used while recording and verifying extracted invoices.
 */
public interface SupplierDirectory {

    /**
     * Matches a supplier name as printed on an invoice against known suppliers and aliases.
     */
    Optional<SupplierMatch> resolve(String rawName, String organisationId);

    boolean supplierExists(UUID supplierId, String organisationId);

    /**
     * Returns the id of the supplier with this name, creating the supplier when none matches.
     */
    UUID findOrCreateSupplier(String name, String organisationId);

    /**
     * Records {@code aliasName} as another spelling of the supplier. An existing alias is re-pointed.
     */
    void createAlias(UUID supplierId, String aliasName, String organisationId);
}
