package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyBalanceSheet;
import org.springframework.stereotype.Repository;

@Repository
public interface CompanyBalanceSheetRepository extends PeriodRecordRepository<CompanyBalanceSheet> {
}
