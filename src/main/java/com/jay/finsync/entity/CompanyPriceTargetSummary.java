package com.jay.finsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/** Analyst price target counts and averages over rolling windows. One row per symbol. */
@Entity
@Table(name = "company_price_target_summaries",
    uniqueConstraints = @UniqueConstraint(name = "uq_price_target_summary_symbol", columnNames = "symbol"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyPriceTargetSummary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;
    @Column(nullable = false, length = 20)
    private String symbol;

    private Integer lastMonthCount;
    private Double lastMonthAvgPriceTarget;
    private Integer lastQuarterCount;
    private Double lastQuarterAvgPriceTarget;
    private Integer lastYearCount;
    private Double lastYearAvgPriceTarget;
    private Integer allTimeCount;
    private Double allTimeAvgPriceTarget;

    @Column(length = 1000)
    private String publishers;     // comma-separated

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
