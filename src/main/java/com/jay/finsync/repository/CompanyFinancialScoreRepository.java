package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyFinancialScore;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyFinancialScoreRepository extends JpaRepository<CompanyFinancialScore, Long> {

    Optional<CompanyFinancialScore> findBySymbol(String symbol);
}
