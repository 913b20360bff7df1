package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyPriceTargetSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyPriceTargetSummaryRepository extends JpaRepository<CompanyPriceTargetSummary, Long> {

    Optional<CompanyPriceTargetSummary> findBySymbol(String symbol);
}
