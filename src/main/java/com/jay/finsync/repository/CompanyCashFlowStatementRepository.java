package com.jay.finsync.repository;

import com.jay.finsync.entity.CompanyCashFlowStatement;
import org.springframework.stereotype.Repository;

@Repository
public interface CompanyCashFlowStatementRepository extends PeriodRecordRepository<CompanyCashFlowStatement> {
}
