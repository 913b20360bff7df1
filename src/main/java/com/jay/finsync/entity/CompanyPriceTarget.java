package com.jay.finsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/** Analyst price target consensus. One row per symbol. */
@Entity
@Table(name = "company_price_targets",
    uniqueConstraints = @UniqueConstraint(name = "uq_price_target_symbol", columnNames = "symbol"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyPriceTarget {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;
    @Column(nullable = false, length = 20)
    private String symbol;

    private Double targetHigh;
    private Double targetLow;
    private Double targetConsensus;
    private Double targetMedian;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
