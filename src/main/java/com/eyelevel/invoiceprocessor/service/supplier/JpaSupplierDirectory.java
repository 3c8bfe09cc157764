package com.eyelevel.invoiceprocessor.service.supplier;

import com.eyelevel.invoiceprocessor.model.Supplier;
import com.eyelevel.invoiceprocessor.model.SupplierAlias;
import com.eyelevel.invoiceprocessor.repository.SupplierAliasRepository;
import com.eyelevel.invoiceprocessor.repository.SupplierRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaSupplierDirectory implements SupplierDirectory {

    static final double EXACT_MATCH_CONFIDENCE = 1.0;
    static final double ALIAS_MATCH_CONFIDENCE = 0.95;

    private final SupplierRepository supplierRepository;
    private final SupplierAliasRepository supplierAliasRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<SupplierMatch> resolve(final String rawName, final String organisationId) {
        final String normalized = SupplierNameNormalizer.normalize(rawName);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        final Optional<Supplier> exact = supplierRepository.findByOrganisationIdAndNormalizedName(organisationId,
                                                                                                  normalized);
        if (exact.isPresent()) {
            return Optional.of(new SupplierMatch(exact.get().getId(), EXACT_MATCH_CONFIDENCE));
        }
        return supplierAliasRepository.findByOrganisationIdAndNormalizedAlias(organisationId, normalized)
                                      .map(alias -> new SupplierMatch(alias.getSupplierId(), ALIAS_MATCH_CONFIDENCE));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean supplierExists(final UUID supplierId, final String organisationId) {
        return supplierRepository.existsByIdAndOrganisationId(supplierId, organisationId);
    }

    @Override
    @Transactional
    public UUID findOrCreateSupplier(final String name, final String organisationId) {
        final Optional<SupplierMatch> match = resolve(name, organisationId);
        if (match.isPresent()) {
            return match.get().supplierId();
        }
        final Supplier created = supplierRepository.save(Supplier.builder()
                                                                 .organisationId(organisationId)
                                                                 .name(name.trim())
                                                                 .normalizedName(SupplierNameNormalizer.normalize(name))
                                                                 .build());
        log.info("Created supplier {} ('{}') for organisation {}.", created.getId(), created.getName(), organisationId);
        return created.getId();
    }

    @Override
    @Transactional
    public void createAlias(final UUID supplierId, final String aliasName, final String organisationId) {
        final String normalized = SupplierNameNormalizer.normalize(aliasName);
        if (normalized.isEmpty()) {
            return;
        }
        final SupplierAlias alias = supplierAliasRepository
                .findByOrganisationIdAndNormalizedAlias(organisationId, normalized)
                .orElseGet(() -> SupplierAlias.builder()
                                              .organisationId(organisationId)
                                              .normalizedAlias(normalized)
                                              .build());
        alias.setSupplierId(supplierId);
        alias.setAliasName(aliasName.trim());
        supplierAliasRepository.save(alias);
        log.info("Alias '{}' now points to supplier {}.", aliasName, supplierId);
    }
}
