package com.eyelevel.invoiceprocessor.repository;

import com.eyelevel.invoiceprocessor.model.Supplier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SupplierRepository extends JpaRepository<Supplier, UUID> {

    Optional<Supplier> findByOrganisationIdAndNormalizedName(String organisationId, String normalizedName);

    boolean existsByIdAndOrganisationId(UUID id, String organisationId);
}
