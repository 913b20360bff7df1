package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** FMP /financial-scores row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpFinancialScores {
    private String symbol;
    private String reportedCurrency;
    private Double altmanZScore;
    private Integer piotroskiScore;
    private Double workingCapital;
    private Double totalAssets;
    private Double retainedEarnings;
    private Double ebit;
    private Double marketCap;
    private Double totalLiabilities;
    private Double revenue;
}
