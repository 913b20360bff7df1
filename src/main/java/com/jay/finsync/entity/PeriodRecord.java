package com.jay.finsync.entity;

/** A stored row keyed on (symbol, date, period). */
public interface PeriodRecord {
    void setCompanyId(Long companyId);
    void setSymbol(String symbol);
    void setPeriod(String period);
}
