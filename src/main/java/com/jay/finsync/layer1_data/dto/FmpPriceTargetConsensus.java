package com.jay.finsync.layer1_data.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/** FMP /price-target-consensus row. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FmpPriceTargetConsensus {
    private String symbol;
    private Double targetHigh;
    private Double targetLow;
    private Double targetConsensus;
    private Double targetMedian;
}
