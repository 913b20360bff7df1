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
@Table(name = "company_financial_ratios",
    uniqueConstraints = @UniqueConstraint(name = "uq_ratio_symbol_date_period",
        columnNames = {"symbol", "date", "period"}),
    indexes = @Index(name = "ix_ratio_company", columnList = "company_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyFinancialRatio implements PeriodRecord {

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

    // Margins
    private Double grossProfitMargin;
    private Double ebitMargin;
    private Double ebitdaMargin;
    private Double operatingProfitMargin;
    private Double pretaxProfitMargin;
    private Double continuousOperationsProfitMargin;
    private Double netProfitMargin;
    private Double bottomLineProfitMargin;

    // Turnover
    private Double receivablesTurnover;
    private Double payablesTurnover;
    private Double inventoryTurnover;
    private Double fixedAssetTurnover;
    private Double assetTurnover;

    // Liquidity
    private Double currentRatio;
    private Double quickRatio;
    private Double solvencyRatio;
    private Double cashRatio;

    // Valuation
    private Double priceToEarningsRatio;
    private Double priceToEarningsGrowthRatio;
    private Double forwardPriceToEarningsGrowthRatio;
    private Double priceToBookRatio;
    private Double priceToSalesRatio;
    private Double priceToFreeCashFlowRatio;
    private Double priceToOperatingCashFlowRatio;
    private Double priceToFairValue;
    private Double enterpriseValueMultiple;

    // Leverage & coverage
    private Double debtToAssetsRatio;
    private Double debtToEquityRatio;
    private Double debtToCapitalRatio;
    private Double longTermDebtToCapitalRatio;
    private Double financialLeverageRatio;
    private Double debtToMarketCap;
    private Double workingCapitalTurnoverRatio;
    private Double operatingCashFlowRatio;
    private Double operatingCashFlowSalesRatio;
    private Double freeCashFlowOperatingCashFlowRatio;
    private Double debtServiceCoverageRatio;
    private Double interestCoverageRatio;
    private Double shortTermOperatingCashFlowCoverageRatio;
    private Double operatingCashFlowCoverageRatio;
    private Double capitalExpenditureCoverageRatio;
    private Double dividendPaidAndCapexCoverageRatio;

    // Dividends
    private Double dividendPayoutRatio;
    private Double dividendYield;
    private Double dividendYieldPercentage;

    // Per share
    private Double revenuePerShare;
    private Double netIncomePerShare;
    private Double interestDebtPerShare;
    private Double cashPerShare;
    private Double bookValuePerShare;
    private Double tangibleBookValuePerShare;
    private Double shareholdersEquityPerShare;
    private Double operatingCashFlowPerShare;
    private Double capexPerShare;
    private Double freeCashFlowPerShare;

    // Tax
    private Double netIncomePerEbt;
    private Double ebtPerEbit;
    private Double effectiveTaxRate;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
