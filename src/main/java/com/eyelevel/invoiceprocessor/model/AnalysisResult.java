package com.eyelevel.invoiceprocessor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Raw and parsed payload snapshot of one successful analysis, kept for audit and debugging.
 */
@Entity
@Table(name = "analysis_result")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_record_id", nullable = false)
    private UUID documentRecordId;

    private String analysisJobId;

    @Column(columnDefinition = "TEXT")
    private String rawResultJson;

    @Column(columnDefinition = "TEXT")
    private String parsedResultJson;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
