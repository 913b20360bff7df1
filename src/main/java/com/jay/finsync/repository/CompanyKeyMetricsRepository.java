package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyKeyMetrics;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyKeyMetricsRepository extends PeriodRecordRepository<CompanyKeyMetrics> {

    Optional<CompanyKeyMetrics> findTopBySymbolOrderByDateDesc(String symbol);
}
