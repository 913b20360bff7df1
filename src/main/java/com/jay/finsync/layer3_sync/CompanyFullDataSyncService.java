package com.jay.finsync.layer3_sync;

import com.jay.finsync.config.SyncConfig;
import com.jay.finsync.model.FullSyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Layer 3: full company sync orchestrator.
 *
 * Runs every sync in a fixed order, pausing step_delay_ms between FMP calls.
 * Each step runs in its own transaction; a failed step is recorded and the run moves on.
 * Only a missing company profile stops the run, since every other table hangs off it.
 * Limits outside 1..100 are rejected before anything is fetched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyFullDataSyncService {

    static final String SUCCESS = "success";
    static final String NO_DATA = "no_data";

    private final SyncConfig config;
    private final CompanySyncService companySync;
    private final PriceTargetSyncService priceTargetSync;
    private final CompanyMetricsSyncService metricsSync;
    private final FinancialStatementsSyncService statementsSync;
    private final FinancialHealthSyncService healthSync;

    private record Step(String name, boolean remote, Supplier<Boolean> action) {}

    public FullSyncResult syncAll(String symbol, int financialLimit, int metricsLimit) {
        String ticker = BaseSyncService.normalize(symbol);
        String period = config.sync().getDefaultPeriod();
        BaseSyncService.validatePeriodQuery(period, financialLimit);
        BaseSyncService.validatePeriodQuery(period, metricsLimit);
        long start = System.nanoTime();

        Map<String, String> steps = new LinkedHashMap<>();
        int apiCalls = 0;

        // ── Step 1: Company profile ────────────────────────────────────────────
        log.info("[1/10] Syncing company profile for {}", ticker);
        try {
            boolean found = companySync.upsertCompany(ticker).isPresent();
            apiCalls++;
            if (!found) {
                steps.put("company_profile", "failed: no profile returned for " + ticker);
                return finish(ticker, FullSyncResult.FAILED, steps, apiCalls, start);
            }
            steps.put("company_profile", SUCCESS);
        } catch (RuntimeException e) {
            log.error("Failed to sync company profile for {}: {}", ticker, e.getMessage());
            steps.put("company_profile", "failed: " + e.getMessage());
            return finish(ticker, FullSyncResult.FAILED, steps, apiCalls, start);
        }

        List<Step> plan = List.of(
            new Step("price_target", true, () -> priceTargetSync.upsertPriceTarget(ticker).isPresent()),
            new Step("price_target_summary", true, () -> priceTargetSync.upsertPriceTargetSummary(ticker).isPresent()),
            new Step("key_metrics", true, () -> hasRows(metricsSync.upsertKeyMetrics(ticker, metricsLimit, period))),
            new Step("financial_ratios", true, () -> hasRows(metricsSync.upsertFinancialRatios(ticker, metricsLimit, period))),
            new Step("income_statements", true, () -> hasRows(statementsSync.upsertIncomeStatements(ticker, financialLimit, period))),
            new Step("balance_sheets", true, () -> hasRows(statementsSync.upsertBalanceSheets(ticker, financialLimit, period))),
            new Step("cash_flow_statements", true, () -> hasRows(statementsSync.upsertCashFlowStatements(ticker, financialLimit, period))),
            new Step("financial_scores", true, () -> healthSync.upsertFinancialScores(ticker).isPresent()),
            new Step("financial_health", false, () -> hasRows(healthSync.upsertFinancialHealth(ticker)))
        );

        int total = plan.size() + 1;
        for (int i = 0; i < plan.size(); i++) {
            Step step = plan.get(i);
            if (!pause()) {
                steps.put(step.name(), "failed: interrupted");
                break;
            }
            log.info("[{}/{}] Syncing {} for {}", i + 2, total, step.name(), ticker);
            try {
                boolean synced = step.action().get();
                if (step.remote()) apiCalls++;
                steps.put(step.name(), synced ? SUCCESS : NO_DATA);
            } catch (RuntimeException e) {
                log.error("Failed to sync {} for {}: {}", step.name(), ticker, e.getMessage());
                steps.put(step.name(), "failed: " + e.getMessage());
            }
        }

        boolean anyFailed = steps.values().stream().anyMatch(s -> s.startsWith("failed"));
        return finish(ticker, anyFailed ? FullSyncResult.COMPLETED_WITH_ERRORS : FullSyncResult.COMPLETED,
            steps, apiCalls, start);
    }

    private FullSyncResult finish(String symbol, String status, Map<String, String> steps, int apiCalls, long start) {
        double seconds = Math.round((System.nanoTime() - start) / 1e7) / 100.0;
        FullSyncResult result = new FullSyncResult(symbol, status, Collections.unmodifiableMap(steps), apiCalls, seconds);
        log.info("Full sync for {} {}: {} api calls in {}s", symbol, status, apiCalls, seconds);
        return result;
    }

    private static boolean hasRows(Collection<?> rows) {
        return rows != null && !rows.isEmpty();
    }

    /** Sleeps step_delay_ms. False when the thread was interrupted. */
    private boolean pause() {
        long delay = config.sync().getStepDelayMs();
        if (delay <= 0) return true;
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Full sync interrupted");
            return false;
        }
    }
}
