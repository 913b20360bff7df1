package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDate;

/** FMP /ratios row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpFinancialRatios implements FmpPeriodRow {
    private String symbol;
    private LocalDate date;
    private String fiscalYear;
    private String period;
    private String reportedCurrency;

    private Double grossProfitMargin;
    private Double ebitMargin;
    private Double ebitdaMargin;
    private Double operatingProfitMargin;
    private Double pretaxProfitMargin;
    private Double continuousOperationsProfitMargin;
    private Double netProfitMargin;
    private Double bottomLineProfitMargin;

    private Double receivablesTurnover;
    private Double payablesTurnover;
    private Double inventoryTurnover;
    private Double fixedAssetTurnover;
    private Double assetTurnover;

    private Double currentRatio;
    private Double quickRatio;
    private Double solvencyRatio;
    private Double cashRatio;

    private Double priceToEarningsRatio;
    private Double priceToEarningsGrowthRatio;
    private Double forwardPriceToEarningsGrowthRatio;
    private Double priceToBookRatio;
    private Double priceToSalesRatio;
    private Double priceToFreeCashFlowRatio;
    private Double priceToOperatingCashFlowRatio;
    private Double priceToFairValue;
    private Double enterpriseValueMultiple;

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

    private Double dividendPayoutRatio;
    private Double dividendYield;
    private Double dividendYieldPercentage;

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

    @JsonProperty("netIncomePerEBT")
    private Double netIncomePerEbt;
    private Double ebtPerEbit;
    private Double effectiveTaxRate;
}
