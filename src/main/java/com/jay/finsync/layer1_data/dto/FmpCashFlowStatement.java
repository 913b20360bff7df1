package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDate;

/** FMP /cash-flow-statement row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpCashFlowStatement implements FmpPeriodRow {
    private String symbol;
    private LocalDate date;
    private String fiscalYear;
    private String period;
    private String reportedCurrency;
    private String cik;
    private LocalDate filingDate;
    private String acceptedDate;

    private Double netIncome;
    private Double depreciationAndAmortization;
    private Double stockBasedCompensation;
    private Double changeInWorkingCapital;
    private Double netCashProvidedByOperatingActivities;

    private Double investmentsInPropertyPlantAndEquipment;
    private Double acquisitionsNet;
    private Double purchasesOfInvestments;
    private Double salesMaturitiesOfInvestments;
    private Double netCashProvidedByInvestingActivities;

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
}
