package com.jay.finsync.layer3_sync;

import com.jay.finsync.entity.Company;
import com.jay.finsync.entity.CompanyBalanceSheet;
import com.jay.finsync.entity.CompanyCashFlowStatement;
import com.jay.finsync.entity.CompanyIncomeStatement;
import com.jay.finsync.layer1_data.FmpClient;
import com.jay.finsync.layer1_data.dto.FmpBalanceSheet;
import com.jay.finsync.layer1_data.dto.FmpCashFlowStatement;
import com.jay.finsync.layer1_data.dto.FmpIncomeStatement;
import com.jay.finsync.repository.CompanyBalanceSheetRepository;
import com.jay.finsync.repository.CompanyCashFlowStatementRepository;
import com.jay.finsync.repository.CompanyIncomeStatementRepository;
import com.jay.finsync.repository.CompanyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/** Layer 3: balance sheet, income statement and cash flow statement sync. */
@Slf4j
@Service
public class FinancialStatementsSyncService extends BaseSyncService {

    private final CompanyBalanceSheetRepository balanceSheetRepository;
    private final CompanyIncomeStatementRepository incomeStatementRepository;
    private final CompanyCashFlowStatementRepository cashFlowStatementRepository;

    public FinancialStatementsSyncService(FmpClient fmpClient,
                                          CompanyRepository companyRepository,
                                          CompanyBalanceSheetRepository balanceSheetRepository,
                                          CompanyIncomeStatementRepository incomeStatementRepository,
                                          CompanyCashFlowStatementRepository cashFlowStatementRepository) {
        super(fmpClient, companyRepository);
        this.balanceSheetRepository = balanceSheetRepository;
        this.incomeStatementRepository = incomeStatementRepository;
        this.cashFlowStatementRepository = cashFlowStatementRepository;
    }

    @Transactional
    public List<CompanyBalanceSheet> upsertBalanceSheets(String symbol, int limit, String period) {
        String ticker = normalize(symbol);
        validatePeriodQuery(period, limit);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return List.of();

        List<FmpBalanceSheet> rows = fmpClient.getBalanceSheets(ticker, period, limit);
        if (rows.isEmpty()) {
            logNoData("balance sheets", ticker);
            return List.of();
        }
        List<CompanyBalanceSheet> saved = upsertPeriodRows(ticker, company.get().getId(), period, rows,
            balanceSheetRepository, CompanyBalanceSheet::new);
        logSynced(saved.size(), "balance sheets", ticker);
        return saved;
    }

    @Transactional
    public List<CompanyIncomeStatement> upsertIncomeStatements(String symbol, int limit, String period) {
        String ticker = normalize(symbol);
        validatePeriodQuery(period, limit);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return List.of();

        List<FmpIncomeStatement> rows = fmpClient.getIncomeStatements(ticker, period, limit);
        if (rows.isEmpty()) {
            logNoData("income statements", ticker);
            return List.of();
        }
        List<CompanyIncomeStatement> saved = upsertPeriodRows(ticker, company.get().getId(), period, rows,
            incomeStatementRepository, CompanyIncomeStatement::new);
        logSynced(saved.size(), "income statements", ticker);
        return saved;
    }

    @Transactional
    public List<CompanyCashFlowStatement> upsertCashFlowStatements(String symbol, int limit, String period) {
        String ticker = normalize(symbol);
        validatePeriodQuery(period, limit);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return List.of();

        List<FmpCashFlowStatement> rows = fmpClient.getCashFlowStatements(ticker, period, limit);
        if (rows.isEmpty()) {
            logNoData("cash flow statements", ticker);
            return List.of();
        }
        List<CompanyCashFlowStatement> saved = upsertPeriodRows(ticker, company.get().getId(), period, rows,
            cashFlowStatementRepository, CompanyCashFlowStatement::new);
        logSynced(saved.size(), "cash flow statements", ticker);
        return saved;
    }
}
