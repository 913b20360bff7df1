package com.jay.finsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * One evaluated metric of the financial health report.
 * Display strings are stored as produced by the evaluator so the report can be served as-is.
 */
@Entity
@Table(name = "financial_health",
    uniqueConstraints = @UniqueConstraint(name = "uq_health_symbol_section_metric",
        columnNames = {"symbol", "section", "metric"}),
    indexes = @Index(name = "ix_health_company", columnList = "company_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyFinancialHealth {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;
    @Column(nullable = false, length = 20)
    private String symbol;

    @Column(nullable = false, length = 100)
    private String section;
    @Column(nullable = false, length = 100)
    private String metric;
    @Column(length = 100)
    private String benchmark;

    // VALUE is reserved in H2
    @Column(name = "metric_value", length = 100)
    private String value;

    @Column(nullable = false, length = 10)
    private String status;         // healthy | warning | neutral

    @Column(length = 1000)
    private String insight;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
