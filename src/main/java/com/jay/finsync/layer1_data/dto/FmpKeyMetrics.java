package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.LocalDate;

/** FMP /key-metrics row. Property names follow the JSON except where FMP capitalises or misspells. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpKeyMetrics implements FmpPeriodRow {
    private String symbol;
    private LocalDate date;
    private String fiscalYear;
    private String period;
    private String reportedCurrency;

    private Double marketCap;
    private Double enterpriseValue;
    private Double evToSales;
    private Double evToOperatingCashFlow;
    private Double evToFreeCashFlow;
    @JsonProperty("evToEBITDA")
    private Double evToEbitda;
    @JsonProperty("netDebtToEBITDA")
    private Double netDebtToEbitda;
    private Double currentRatio;
    private Double incomeQuality;
    private Double grahamNumber;
    private Double grahamNetNet;
    private Double taxBurden;
    private Double interestBurden;

    private Double workingCapital;
    private Double investedCapital;
    private Double returnOnAssets;
    private Double operatingReturnOnAssets;
    private Double returnOnTangibleAssets;
    private Double returnOnEquity;
    private Double returnOnInvestedCapital;
    private Double returnOnCapitalEmployed;

    private Double earningsYield;
    private Double freeCashFlowYield;
    private Double capexToOperatingCashFlow;
    private Double capexToDepreciation;
    private Double capexToRevenue;

    private Double salesGeneralAndAdministrativeToRevenue;
    @JsonProperty("researchAndDevelopementToRevenue")
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
}
