package com.jay.finsync.layer3_sync;

import com.jay.finsync.entity.Company;
import com.jay.finsync.entity.CompanyFinancialRatio;
import com.jay.finsync.entity.CompanyKeyMetrics;
import com.jay.finsync.layer1_data.FmpClient;
import com.jay.finsync.layer1_data.dto.FmpFinancialRatios;
import com.jay.finsync.layer1_data.dto.FmpKeyMetrics;
import com.jay.finsync.repository.CompanyFinancialRatioRepository;
import com.jay.finsync.repository.CompanyKeyMetricsRepository;
import com.jay.finsync.repository.CompanyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Layer 3: key metrics and financial ratios sync.
 * Rows are keyed on (symbol, date, period); re-syncing a period overwrites it in place.
 */
@Slf4j
@Service
public class CompanyMetricsSyncService extends BaseSyncService {

    private final CompanyKeyMetricsRepository keyMetricsRepository;
    private final CompanyFinancialRatioRepository ratioRepository;

    public CompanyMetricsSyncService(FmpClient fmpClient,
                                     CompanyRepository companyRepository,
                                     CompanyKeyMetricsRepository keyMetricsRepository,
                                     CompanyFinancialRatioRepository ratioRepository) {
        super(fmpClient, companyRepository);
        this.keyMetricsRepository = keyMetricsRepository;
        this.ratioRepository = ratioRepository;
    }

    @Transactional
    public List<CompanyKeyMetrics> upsertKeyMetrics(String symbol, int limit, String period) {
        String ticker = normalize(symbol);
        validatePeriodQuery(period, limit);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return List.of();

        List<FmpKeyMetrics> rows = fmpClient.getKeyMetrics(ticker, period, limit);
        if (rows.isEmpty()) {
            logNoData("key metrics", ticker);
            return List.of();
        }
        List<CompanyKeyMetrics> saved = upsertPeriodRows(ticker, company.get().getId(), period, rows,
            keyMetricsRepository, CompanyKeyMetrics::new);
        logSynced(saved.size(), "key metrics", ticker);
        return saved;
    }

    @Transactional
    public List<CompanyFinancialRatio> upsertFinancialRatios(String symbol, int limit, String period) {
        String ticker = normalize(symbol);
        validatePeriodQuery(period, limit);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return List.of();

        List<FmpFinancialRatios> rows = fmpClient.getFinancialRatios(ticker, period, limit);
        if (rows.isEmpty()) {
            logNoData("financial ratios", ticker);
            return List.of();
        }
        List<CompanyFinancialRatio> saved = upsertPeriodRows(ticker, company.get().getId(), period, rows,
            ratioRepository, CompanyFinancialRatio::new);
        logSynced(saved.size(), "financial ratios", ticker);
        return saved;
    }
}
