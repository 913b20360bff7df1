package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyPriceTarget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyPriceTargetRepository extends JpaRepository<CompanyPriceTarget, Long> {

    Optional<CompanyPriceTarget> findBySymbol(String symbol);
}
