package com.eyelevel.invoiceprocessor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One uploaded document together with its processing and review state.
 * <p>
 * {@code analysisJobId} is set whenever the record is {@link ProcessingStatus#ANALYZING} and may be
 * retained afterwards for audit. {@code attemptCount} never exceeds the configured retry budget.
 */
@Entity
@Table(name = "document_record", indexes = {
        @Index(name = "idx_document_record_scan", columnList = "processing_status, deleted_at, updated_at"),
        @Index(name = "idx_document_record_owner", columnList = "organisation_id, location_id, deleted_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organisation_id", nullable = false)
    private String organisationId;

    @Column(name = "location_id", nullable = false)
    private String locationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SourceType sourceType;

    @Column(nullable = false)
    private String fileName;

    private String mimeType;

    private Long fileSizeBytes;

    private String storageKey;

    private UUID uploadBatchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false)
    private ProcessingStatus processingStatus;

    private String analysisJobId;

    @Builder.Default
    @Column(nullable = false)
    private int attemptCount = 0;

    private LocalDateTime lastAttemptAt;

    @Enumerated(EnumType.STRING)
    private FailureCategory failureCategory;

    @Column(columnDefinition = "TEXT")
    private String failureReason;

    private Double confidenceScore;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReviewStatus reviewStatus = ReviewStatus.NONE;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public void clearFailure() {
        this.failureCategory = null;
        this.failureReason = null;
    }

    public void markFailed(final FailureCategory category, final String reason) {
        this.processingStatus = ProcessingStatus.ANALYSIS_FAILED;
        this.failureCategory = category;
        this.failureReason = reason;
    }
}
