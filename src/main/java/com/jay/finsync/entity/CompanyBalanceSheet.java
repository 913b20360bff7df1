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
@Table(name = "company_balance_sheets",
    uniqueConstraints = @UniqueConstraint(name = "uq_balance_sheet_symbol_date_period",
        columnNames = {"symbol", "date", "period"}),
    indexes = @Index(name = "ix_balance_sheet_company", columnList = "company_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyBalanceSheet implements PeriodRecord {

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
    @Column(length = 20)
    private String cik;
    private LocalDate filingDate;
    @Column(length = 30)
    private String acceptedDate;

    // Assets
    private Double cashAndCashEquivalents;
    private Double shortTermInvestments;
    private Double cashAndShortTermInvestments;
    private Double netReceivables;
    private Double inventory;
    private Double otherCurrentAssets;
    private Double totalCurrentAssets;
    private Double propertyPlantEquipmentNet;
    private Double goodwill;
    private Double intangibleAssets;
    private Double goodwillAndIntangibleAssets;
    private Double longTermInvestments;
    private Double otherNonCurrentAssets;
    private Double totalNonCurrentAssets;
    private Double totalAssets;

    // Liabilities
    private Double accountPayables;
    private Double shortTermDebt;
    private Double deferredRevenue;
    private Double otherCurrentLiabilities;
    private Double totalCurrentLiabilities;
    private Double longTermDebt;
    private Double otherNonCurrentLiabilities;
    private Double totalNonCurrentLiabilities;
    private Double totalLiabilities;

    // Equity
    private Double commonStock;
    private Double retainedEarnings;
    private Double totalStockholdersEquity;
    private Double minorityInterest;
    private Double totalEquity;
    private Double totalLiabilitiesAndTotalEquity;

    // Derived
    private Double totalInvestments;
    private Double totalDebt;
    private Double netDebt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
