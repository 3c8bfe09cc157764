package com.eyelevel.invoiceprocessor.repository;

import com.eyelevel.invoiceprocessor.model.DocumentRecord;
import com.eyelevel.invoiceprocessor.model.ProcessingStatus;
import com.eyelevel.invoiceprocessor.model.ReviewStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link DocumentRecord} entity.
 * <p>
 * Every scan used by the scheduled passes filters out soft-deleted records.
 */
@Repository
public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, UUID> {

    /**
     * First page of documents with an analysis job in flight, in id order. Used with
     * {@link #findIdsAwaitingAnalysisResultAfter} by the
     * {@link com.eyelevel.invoiceprocessor.scheduler.AnalysisStatusPollScheduler} to walk the whole set.
     */
    @Query("""
            SELECT d.id FROM DocumentRecord d
            WHERE d.processingStatus = com.eyelevel.invoiceprocessor.model.ProcessingStatus.ANALYZING
              AND d.analysisJobId IS NOT NULL
              AND d.deletedAt IS NULL
            ORDER BY d.id ASC
            """)
    List<UUID> findIdsAwaitingAnalysisResult(Pageable pageable);

    /**
     * Next page of documents with an analysis job in flight, strictly after the given id.
     */
    @Query("""
            SELECT d.id FROM DocumentRecord d
            WHERE d.processingStatus = com.eyelevel.invoiceprocessor.model.ProcessingStatus.ANALYZING
              AND d.analysisJobId IS NOT NULL
              AND d.deletedAt IS NULL
              AND d.id > :afterId
            ORDER BY d.id ASC
            """)
    List<UUID> findIdsAwaitingAnalysisResultAfter(@Param("afterId") UUID afterId, Pageable pageable);

    /**
     * Finds documents sitting in a state since before the cutoff.
     * Used by the janitor for the stuck ANALYZING and stuck PENDING_ANALYSIS buckets.
     */
    @Query("""
            SELECT d.id FROM DocumentRecord d
            WHERE d.processingStatus = :status
              AND d.deletedAt IS NULL
              AND d.updatedAt < :cutoff
            ORDER BY d.updatedAt ASC
            """)
    List<UUID> findStaleIds(@Param("status") ProcessingStatus status, @Param("cutoff") LocalDateTime cutoff);

    /**
     * Finds failed documents that still have attempts left and have been idle since before the cutoff.
     */
    @Query("""
            SELECT d.id FROM DocumentRecord d
            WHERE d.processingStatus = com.eyelevel.invoiceprocessor.model.ProcessingStatus.ANALYSIS_FAILED
              AND d.deletedAt IS NULL
              AND d.updatedAt < :cutoff
              AND d.attemptCount < :maxRetries
            ORDER BY d.updatedAt ASC
            """)
    List<UUID> findRetryableFailedIds(@Param("cutoff") LocalDateTime cutoff, @Param("maxRetries") int maxRetries);

    Optional<DocumentRecord> findByIdAndOrganisationId(UUID id, String organisationId);

    Optional<DocumentRecord> findByIdAndOrganisationIdAndDeletedAtIsNull(UUID id, String organisationId);

    List<DocumentRecord> findAllByIdInAndOrganisationIdAndLocationIdAndDeletedAtIsNull(Collection<UUID> ids,
                                                                                      String organisationId,
                                                                                      String locationId);

    List<DocumentRecord> findAllByIdInAndOrganisationId(Collection<UUID> ids, String organisationId);

    Page<DocumentRecord> findByOrganisationIdAndLocationIdAndDeletedAtIsNull(String organisationId, String locationId,
                                                                             Pageable pageable);

    Page<DocumentRecord> findByOrganisationIdAndLocationIdAndReviewStatusAndDeletedAtIsNull(String organisationId,
                                                                                            String locationId,
                                                                                            ReviewStatus reviewStatus,
                                                                                            Pageable pageable);

    Page<DocumentRecord> findByOrganisationIdAndLocationIdAndDeletedAtIsNotNull(String organisationId,
                                                                                String locationId,
                                                                                Pageable pageable);

    long countByOrganisationIdAndLocationIdAndReviewStatusAndDeletedAtIsNull(String organisationId,
                                                                             String locationId,
                                                                             ReviewStatus reviewStatus);

    @Modifying
    @Query("""
            UPDATE DocumentRecord d SET d.deletedAt = :deletedAt, d.updatedAt = :deletedAt, d.version = d.version + 1
            WHERE d.id IN :ids AND d.organisationId = :organisationId AND d.deletedAt IS NULL
            """)
    int softDeleteAll(@Param("ids") Collection<UUID> ids, @Param("organisationId") String organisationId,
                      @Param("deletedAt") LocalDateTime deletedAt);

    @Modifying
    @Query("""
            UPDATE DocumentRecord d SET d.deletedAt = NULL, d.updatedAt = :restoredAt, d.version = d.version + 1
            WHERE d.id IN :ids AND d.organisationId = :organisationId AND d.deletedAt IS NOT NULL
            """)
    int restoreAll(@Param("ids") Collection<UUID> ids, @Param("organisationId") String organisationId,
                   @Param("restoredAt") LocalDateTime restoredAt);
}
