package com.eyelevel.invoiceprocessor.repository;

import com.eyelevel.invoiceprocessor.model.SupplierAlias;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SupplierAliasRepository extends JpaRepository<SupplierAlias, Long> {

    Optional<SupplierAlias> findByOrganisationIdAndNormalizedAlias(String organisationId, String normalizedAlias);
}
