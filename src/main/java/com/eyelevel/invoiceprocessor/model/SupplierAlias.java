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
 * Alternative spelling of a supplier name as it appears on invoices.
 */
@Entity
@Table(name = "supplier_alias",
        uniqueConstraints = @UniqueConstraint(columnNames = {"organisation_id", "normalized_alias"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupplierAlias {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organisation_id", nullable = false)
    private String organisationId;

    @Column(nullable = false)
    private UUID supplierId;

    @Column(nullable = false)
    private String aliasName;

    @Column(name = "normalized_alias", nullable = false)
    private String normalizedAlias;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
