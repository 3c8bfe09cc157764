package com.eyelevel.invoiceprocessor.repository;

import com.eyelevel.invoiceprocessor.model.ExtractedDocument;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExtractedDocumentRepository extends JpaRepository<ExtractedDocument, UUID> {

    /**
     * Loads the extracted document together with its line items.
     */
    @EntityGraph(attributePaths = "lineItems")
    Optional<ExtractedDocument> findByDocumentRecordId(UUID documentRecordId);

    boolean existsByDocumentRecordId(UUID documentRecordId);
}
