package com.eyelevel.invoiceprocessor.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Invoice header and line items extracted from a {@link DocumentRecord}. At most one exists per record.
 */
@Entity
@Table(name = "extracted_document")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "document_record_id", nullable = false, unique = true)
    private UUID documentRecordId;

    @Column(nullable = false)
    private String organisationId;

    private UUID supplierId;

    private String supplierName;

    private String invoiceNumber;

    private LocalDate invoiceDate;

    @Column(precision = 14, scale = 2)
    private BigDecimal subtotal;

    @Column(precision = 14, scale = 2)
    private BigDecimal tax;

    @Column(precision = 14, scale = 2)
    private BigDecimal total;

    private String currency;

    @Builder.Default
    private boolean verified = false;

    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @OneToMany(mappedBy = "extractedDocument", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<LineItem> lineItems = new ArrayList<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public void addLineItem(final LineItem lineItem) {
        lineItem.setExtractedDocument(this);
        lineItems.add(lineItem);
    }
}
