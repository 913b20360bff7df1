package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;

/** FMP /income-statement row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpIncomeStatement implements FmpPeriodRow {
    private String symbol;
    private LocalDate date;
    private String fiscalYear;
    private String period;
    private String reportedCurrency;
    private String cik;
    private LocalDate filingDate;
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
}
