package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyFinancialHealth;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CompanyFinancialHealthRepository extends JpaRepository<CompanyFinancialHealth, Long> {

    Optional<CompanyFinancialHealth> findBySymbolAndSectionAndMetric(String symbol, String section, String metric);

    List<CompanyFinancialHealth> findBySymbolOrderByIdAsc(String symbol);

    long countBySymbolAndStatus(String symbol, String status);
}
