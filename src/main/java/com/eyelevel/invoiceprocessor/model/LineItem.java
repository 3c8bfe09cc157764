package com.eyelevel.invoiceprocessor.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "line_item")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "extracted_document_id", nullable = false)
    private ExtractedDocument extractedDocument;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    private String productCode;

    @Column(precision = 14, scale = 4)
    private BigDecimal quantity;

    private String unitLabel;

    @Column(precision = 14, scale = 4)
    private BigDecimal unitPrice;

    @Column(precision = 14, scale = 2)
    private BigDecimal lineTotal;

    private String categoryCode;

    private Double confidenceScore;
}
