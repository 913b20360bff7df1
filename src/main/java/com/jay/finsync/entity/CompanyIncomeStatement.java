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
@Table(name = "company_income_statements",
    uniqueConstraints = @UniqueConstraint(name = "uq_income_statement_symbol_date_period",
        columnNames = {"symbol", "date", "period"}),
    indexes = @Index(name = "ix_income_statement_company", columnList = "company_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyIncomeStatement implements PeriodRecord {

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

    private Double revenue;
    private Double costOfRevenue;
    private Double grossProfit;
    private Double researchAndDevelopmentExpenses;
    private Double generalAndAdministrativeExpenses;
    private Double sellingAndMarketingExpenses;
    private Double sellingGeneralAndAdministrativeExpenses;
    private Double operatingExpenses;
    private Double costAndExpenses;
    private Double netInterestIncome;
    private Double interestIncome;
    private Double interestExpense;
    private Double depreciationAndAmortization;
    private Double ebitda;
    private Double ebit;
    private Double operatingIncome;
    private Double incomeBeforeTax;
    private Double incomeTaxExpense;
    private Double netIncome;
    private Double eps;
    private Double epsDiluted;
    private Double weightedAverageShsOut;
    private Double weightedAverageShsOutDil;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
