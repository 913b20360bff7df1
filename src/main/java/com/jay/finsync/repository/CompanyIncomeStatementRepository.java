package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyIncomeStatement;
import org.springframework.stereotype.Repository;

@Repository
public interface CompanyIncomeStatementRepository extends PeriodRecordRepository<CompanyIncomeStatement> {
}
