package com.jay.finsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "company_key_metrics",
    uniqueConstraints = @UniqueConstraint(name = "uq_key_metrics_symbol_date_period",
        columnNames = {"symbol", "date", "period"}),
    indexes = @Index(name = "ix_key_metrics_company", columnList = "company_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyKeyMetrics implements PeriodRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;
    @Column(nullable = false, length = 20)
    private String symbol;

    @Column(nullable = false)
    private LocalDate date;
    @Column(length = 10)
    private String fiscalYear;
    @Column(nullable = false, length = 10)
    private String period;
    @Column(length = 10)
    private String reportedCurrency;

    // Market
    private Double marketCap;
    private Double enterpriseValue;
    private Double evToSales;
    private Double evToOperatingCashFlow;
    private Double evToFreeCashFlow;
    private Double evToEbitda;
    private Double netDebtToEbitda;
    private Double currentRatio;
    private Double incomeQuality;
    private Double grahamNumber;
    private Double grahamNetNet;
    private Double taxBurden;
    private Double interestBurden;

    // Capital & returns
    private Double workingCapital;
    private Double investedCapital;
    private Double returnOnAssets;
    private Double operatingReturnOnAssets;
    private Double returnOnTangibleAssets;
    private Double returnOnEquity;
    private Double returnOnInvestedCapital;
    private Double returnOnCapitalEmployed;

    // Cash flow
    private Double earningsYield;
    private Double freeCashFlowYield;
    private Double capexToOperatingCashFlow;
    private Double capexToDepreciation;
    private Double capexToRevenue;

    // Operating efficiency
    private Double salesGeneralAndAdministrativeToRevenue;
    private Double researchAndDevelopmentToRevenue;
    private Double stockBasedCompensationToRevenue;
    private Double intangiblesToTotalAssets;
    private Double averageReceivables;
    private Double averagePayables;
    private Double averageInventory;
    private Double daysOfSalesOutstanding;
    private Double daysOfPayablesOutstanding;
    private Double daysOfInventoryOutstanding;
    private Double operatingCycle;
    private Double cashConversionCycle;
    private Double freeCashFlowToEquity;
    private Double freeCashFlowToFirm;
    private Double tangibleAssetValue;
    private Double netCurrentAssetValue;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
