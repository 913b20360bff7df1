package com.jay.finsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/** Altman Z and Piotroski scores. One row per symbol, overwritten on every sync. */
@Entity
@Table(name = "company_financial_scores",
    uniqueConstraints = @UniqueConstraint(name = "uq_financial_score_symbol", columnNames = "symbol"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyFinancialScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;
    @Column(nullable = false, length = 20)
    private String symbol;
    @Column(length = 10)
    private String reportedCurrency;

    private Double altmanZScore;
    private Integer piotroskiScore;
    private Double workingCapital;
    private Double totalAssets;
    private Double retainedEarnings;
    private Double ebit;
    private Double marketCap;
    private Double totalLiabilities;
    private Double revenue;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
