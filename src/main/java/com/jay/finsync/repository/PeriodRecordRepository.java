package com.jay.finsync.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.time.LocalDate;
import java.util.Optional;

/** Finders shared by every table keyed on (symbol, date, period). */
@NoRepositoryBean
public interface PeriodRecordRepository<E> extends JpaRepository<E, Long> {

    Optional<E> findBySymbolAndDateAndPeriod(String symbol, LocalDate date, String period);
}
