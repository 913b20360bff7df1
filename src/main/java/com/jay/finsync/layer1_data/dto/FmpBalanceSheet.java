package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;

/** FMP /balance-sheet-statement row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpBalanceSheet implements FmpPeriodRow {
    private String symbol;
    private LocalDate date;
    private String fiscalYear;
    private String period;
    private String reportedCurrency;
    private String cik;
    private LocalDate filingDate;
    private String acceptedDate;

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

    private Double accountPayables;
    private Double shortTermDebt;
    private Double deferredRevenue;
    private Double otherCurrentLiabilities;
    private Double totalCurrentLiabilities;
    private Double longTermDebt;
    private Double otherNonCurrentLiabilities;
    private Double totalNonCurrentLiabilities;
    private Double totalLiabilities;

    private Double commonStock;
    private Double retainedEarnings;
    private Double totalStockholdersEquity;
    private Double minorityInterest;
    private Double totalEquity;
    private Double totalLiabilitiesAndTotalEquity;

    private Double totalInvestments;
    private Double totalDebt;
    private Double netDebt;
}
