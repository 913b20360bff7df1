package com.jay.finsync.layer1_data.dto;

import java.time.LocalDate;

/** An FMP row reported for one fiscal period (statements, key metrics, ratios). */
public interface FmpPeriodRow {
    LocalDate getDate();
    String getPeriod();
}
