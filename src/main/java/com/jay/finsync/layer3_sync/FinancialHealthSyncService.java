package com.jay.finsync.layer3_sync;

import com.jay.finsync.config.HealthBenchmarkConfig;
import com.jay.finsync.entity.Company;
import com.jay.finsync.entity.CompanyFinancialHealth;
import com.jay.finsync.entity.CompanyFinancialRatio;
import com.jay.finsync.entity.CompanyFinancialScore;
import com.jay.finsync.entity.CompanyKeyMetrics;
import com.jay.finsync.layer1_data.FmpClient;
import com.jay.finsync.layer1_data.dto.FmpFinancialScores;
import com.jay.finsync.layer2_health.BenchmarkEvaluator;
import com.jay.finsync.model.HealthRecord;
import com.jay.finsync.model.enums.HealthStatus;
import com.jay.finsync.repository.CompanyFinancialHealthRepository;
import com.jay.finsync.repository.CompanyFinancialRatioRepository;
import com.jay.finsync.repository.CompanyFinancialScoreRepository;
import com.jay.finsync.repository.CompanyKeyMetricsRepository;
import com.jay.finsync.repository.CompanyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Layer 3: financial health report and financial scores.
 *
 * The health report is computed locally: the latest stored key metrics and ratios rows
 * are merged (ratios win on shared keys such as current_ratio), run through the
 * BenchmarkEvaluator against the configured layout, and stored one row per
 * (symbol, section, metric). Key metrics and ratios must have been synced first.
 */
@Slf4j
@Service
public class FinancialHealthSyncService extends BaseSyncService {

    private final CompanyKeyMetricsRepository keyMetricsRepository;
    private final CompanyFinancialRatioRepository ratioRepository;
    private final CompanyFinancialHealthRepository healthRepository;
    private final CompanyFinancialScoreRepository scoreRepository;
    private final BenchmarkEvaluator evaluator;
    private final HealthBenchmarkConfig healthConfig;

    public FinancialHealthSyncService(FmpClient fmpClient,
                                      CompanyRepository companyRepository,
                                      CompanyKeyMetricsRepository keyMetricsRepository,
                                      CompanyFinancialRatioRepository ratioRepository,
                                      CompanyFinancialHealthRepository healthRepository,
                                      CompanyFinancialScoreRepository scoreRepository,
                                      BenchmarkEvaluator evaluator,
                                      HealthBenchmarkConfig healthConfig) {
        super(fmpClient, companyRepository);
        this.keyMetricsRepository = keyMetricsRepository;
        this.ratioRepository = ratioRepository;
        this.healthRepository = healthRepository;
        this.scoreRepository = scoreRepository;
        this.evaluator = evaluator;
        this.healthConfig = healthConfig;
    }

    // ── Financial Health ───────────────────────────────────────────────────────

    @Transactional
    public List<CompanyFinancialHealth> upsertFinancialHealth(String symbol) {
        String ticker = normalize(symbol);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return List.of();

        Optional<CompanyKeyMetrics> keyMetrics = keyMetricsRepository.findTopBySymbolOrderByDateDesc(ticker);
        Optional<CompanyFinancialRatio> ratios = ratioRepository.findTopBySymbolOrderByDateDesc(ticker);
        if (keyMetrics.isEmpty() || ratios.isEmpty()) {
            log.warn("Financial health for {} needs both key metrics and ratios (key metrics: {}, ratios: {})",
                ticker, keyMetrics.isPresent(), ratios.isPresent());
            return List.of();
        }

        Map<String, Object> metrics = new LinkedHashMap<>(MetricValues.of(keyMetrics.get()));
        metrics.putAll(MetricValues.of(ratios.get()));

        List<HealthRecord> records = evaluator.buildHealthRecords(
            metrics, healthConfig.sections(), healthConfig.benchmarks());

        Long companyId = company.get().getId();
        List<CompanyFinancialHealth> rows = new ArrayList<>(records.size());
        for (HealthRecord record : records) {
            CompanyFinancialHealth row = healthRepository
                .findBySymbolAndSectionAndMetric(ticker, record.getSection(), record.getMetric())
                .orElseGet(CompanyFinancialHealth::new);
            row.setCompanyId(companyId);
            row.setSymbol(ticker);
            row.setSection(record.getSection());
            row.setMetric(record.getMetric());
            row.setBenchmark(record.getBenchmark());
            row.setValue(record.getValue());
            row.setStatus(record.getStatus().value());
            row.setInsight(record.getInsight());
            rows.add(row);
        }
        List<CompanyFinancialHealth> saved = healthRepository.saveAll(rows);

        long healthy = records.stream().filter(r -> r.getStatus() == HealthStatus.HEALTHY).count();
        long warning = records.stream().filter(r -> r.getStatus() == HealthStatus.WARNING).count();
        log.info("Financial health for {} (key metrics {}, ratios {}): {} healthy, {} warning, {} neutral",
            ticker, keyMetrics.get().getDate(), ratios.get().getDate(),
            healthy, warning, records.size() - healthy - warning);
        return saved;
    }

    // ── Financial Scores ───────────────────────────────────────────────────────

    @Transactional
    public Optional<CompanyFinancialScore> upsertFinancialScores(String symbol) {
        String ticker = normalize(symbol);
        Optional<Company> company = findCompany(ticker);
        if (company.isEmpty()) return Optional.empty();

        Optional<FmpFinancialScores> scores = fmpClient.getFinancialScores(ticker);
        if (scores.isEmpty()) {
            logNoData("financial scores", ticker);
            return Optional.empty();
        }

        CompanyFinancialScore row = scoreRepository.findBySymbol(ticker).orElseGet(CompanyFinancialScore::new);
        copyRow(scores.get(), row);
        row.setCompanyId(company.get().getId());
        row.setSymbol(ticker);
        CompanyFinancialScore saved = scoreRepository.save(row);
        log.info("Synced financial scores for {}: Altman Z {}, Piotroski {}",
            ticker, saved.getAltmanZScore(), saved.getPiotroskiScore());
        return Optional.of(saved);
    }
}
