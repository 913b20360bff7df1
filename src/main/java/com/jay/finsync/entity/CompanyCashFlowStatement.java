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
@Table(name = "company_cash_flow_statements",
    uniqueConstraints = @UniqueConstraint(name = "uq_cash_flow_symbol_date_period",
        columnNames = {"symbol", "date", "period"}),
    indexes = @Index(name = "ix_cash_flow_company", columnList = "company_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyCashFlowStatement implements PeriodRecord {

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

    // Operating
    private Double netIncome;
    private Double depreciationAndAmortization;
    private Double stockBasedCompensation;
    private Double changeInWorkingCapital;
    private Double netCashProvidedByOperatingActivities;

    // Investing
    private Double investmentsInPropertyPlantAndEquipment;
    private Double acquisitionsNet;
    private Double purchasesOfInvestments;
    private Double salesMaturitiesOfInvestments;
    private Double netCashProvidedByInvestingActivities;

    // Financing
    private Double netDebtIssuance;
    private Double netStockIssuance;
    private Double netDividendsPaid;
    private Double netCashProvidedByFinancingActivities;

    private Double netChangeInCash;
    private Double cashAtEndOfPeriod;
    private Double cashAtBeginningOfPeriod;
    private Double operatingCashFlow;
    private Double capitalExpenditure;
    private Double freeCashFlow;
    private Double incomeTaxesPaid;
    private Double interestPaid;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
