package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyFinancialRatio;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyFinancialRatioRepository extends PeriodRecordRepository<CompanyFinancialRatio> {

    Optional<CompanyFinancialRatio> findTopBySymbolOrderByDateDesc(String symbol);
}
