package com.jay.finsync.controller;

import com.jay.finsync.layer3_sync.CompanyFullDataSyncService;
import com.jay.finsync.layer3_sync.CompanyMetricsSyncService;
import com.jay.finsync.layer3_sync.CompanySyncService;
import com.jay.finsync.layer3_sync.FinancialHealthSyncService;
import com.jay.finsync.layer3_sync.FinancialStatementsSyncService;
import com.jay.finsync.layer3_sync.PriceTargetSyncService;
import com.jay.finsync.model.FullSyncResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * REST API: internal sync triggers. Each call pulls from FMP, upserts, and returns the stored rows.
 *
 * Endpoints:
 *   GET /internal/company/{symbol}/sync                Company profile
 *   GET /internal/key-metrics/{symbol}/sync            Key metrics (limit, period)
 *   GET /internal/financial-ratios/{symbol}/sync       Financial ratios (limit, period)
 *   GET /internal/balance-sheets/{symbol}/sync         Balance sheets (limit, period)
 *   GET /internal/income-statements/{symbol}/sync      Income statements (limit, period)
 *   GET /internal/cash-flow-statements/{symbol}/sync   Cash flow statements (limit, period)
 *   GET /internal/financial-health/{symbol}/sync       Financial health report from stored metrics
 *   GET /internal/financial-scores/{symbol}/sync       Altman Z / Piotroski scores
 *   GET /internal/price-target/{symbol}/sync           Analyst price target consensus
 *   GET /internal/price-target-summary/{symbol}/sync   Analyst price target summary
 *   GET /internal/full-data/{symbol}/sync              Everything above, in order
 *
 * A sync that stores nothing answers 404 with {"detail": "... not found for symbol: X"}.
 * A full sync whose company profile step fails answers 500 with the run summary.
 */
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
public class InternalSyncController {

    private static final String DEFAULT_LIMIT = "40";
    private static final String DEFAULT_PERIOD = "annual";

    private final CompanySyncService companySync;
    private final CompanyMetricsSyncService metricsSync;
    private final FinancialStatementsSyncService statementsSync;
    private final FinancialHealthSyncService healthSync;
    private final PriceTargetSyncService priceTargetSync;
    private final CompanyFullDataSyncService fullDataSync;

    // ── Company ────────────────────────────────────────────────────────────────

    @GetMapping("/company/{symbol}/sync")
    public ResponseEntity<?> syncCompany(@PathVariable String symbol) {
        return one(companySync.upsertCompany(symbol), "Company", symbol);
    }

    // ── Metrics & Ratios ───────────────────────────────────────────────────────

    @GetMapping("/key-metrics/{symbol}/sync")
    public ResponseEntity<?> syncKeyMetrics(@PathVariable String symbol,
                                            @RequestParam(defaultValue = DEFAULT_LIMIT) int limit,
                                            @RequestParam(defaultValue = DEFAULT_PERIOD) String period) {
        return many(metricsSync.upsertKeyMetrics(symbol, limit, period), "Key metrics", symbol);
    }

    @GetMapping("/financial-ratios/{symbol}/sync")
    public ResponseEntity<?> syncFinancialRatios(@PathVariable String symbol,
                                                 @RequestParam(defaultValue = DEFAULT_LIMIT) int limit,
                                                 @RequestParam(defaultValue = DEFAULT_PERIOD) String period) {
        return many(metricsSync.upsertFinancialRatios(symbol, limit, period), "Financial ratios", symbol);
    }

    // ── Financial Statements ───────────────────────────────────────────────────

    @GetMapping("/balance-sheets/{symbol}/sync")
    public ResponseEntity<?> syncBalanceSheets(@PathVariable String symbol,
                                               @RequestParam(defaultValue = DEFAULT_LIMIT) int limit,
                                               @RequestParam(defaultValue = DEFAULT_PERIOD) String period) {
        return many(statementsSync.upsertBalanceSheets(symbol, limit, period), "Balance sheets", symbol);
    }

    @GetMapping("/income-statements/{symbol}/sync")
    public ResponseEntity<?> syncIncomeStatements(@PathVariable String symbol,
                                                  @RequestParam(defaultValue = DEFAULT_LIMIT) int limit,
                                                  @RequestParam(defaultValue = DEFAULT_PERIOD) String period) {
        return many(statementsSync.upsertIncomeStatements(symbol, limit, period), "Income statements", symbol);
    }

    @GetMapping("/cash-flow-statements/{symbol}/sync")
    public ResponseEntity<?> syncCashFlowStatements(@PathVariable String symbol,
                                                    @RequestParam(defaultValue = DEFAULT_LIMIT) int limit,
                                                    @RequestParam(defaultValue = DEFAULT_PERIOD) String period) {
        return many(statementsSync.upsertCashFlowStatements(symbol, limit, period), "Cash flow statements", symbol);
    }

    // ── Health & Scores ────────────────────────────────────────────────────────

    @GetMapping("/financial-health/{symbol}/sync")
    public ResponseEntity<?> syncFinancialHealth(@PathVariable String symbol) {
        return many(healthSync.upsertFinancialHealth(symbol), "Financial health", symbol);
    }

    @GetMapping("/financial-scores/{symbol}/sync")
    public ResponseEntity<?> syncFinancialScores(@PathVariable String symbol) {
        return one(healthSync.upsertFinancialScores(symbol), "Financial scores", symbol);
    }

    // ── Price Targets ──────────────────────────────────────────────────────────

    @GetMapping("/price-target/{symbol}/sync")
    public ResponseEntity<?> syncPriceTarget(@PathVariable String symbol) {
        return one(priceTargetSync.upsertPriceTarget(symbol), "Price target", symbol);
    }

    @GetMapping("/price-target-summary/{symbol}/sync")
    public ResponseEntity<?> syncPriceTargetSummary(@PathVariable String symbol) {
        return one(priceTargetSync.upsertPriceTargetSummary(symbol), "Price target summary", symbol);
    }

    // ── Full Sync ──────────────────────────────────────────────────────────────

    @GetMapping("/full-data/{symbol}/sync")
    public ResponseEntity<FullSyncResult> syncFullData(@PathVariable String symbol,
                                                       @RequestParam(defaultValue = DEFAULT_LIMIT) int financialLimit,
                                                       @RequestParam(defaultValue = DEFAULT_LIMIT) int metricsLimit) {
        FullSyncResult result = fullDataSync.syncAll(symbol, financialLimit, metricsLimit);
        if (FullSyncResult.FAILED.equals(result.status())) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
        return ResponseEntity.ok(result);
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private static ResponseEntity<?> one(Optional<?> row, String what, String symbol) {
        return row.<ResponseEntity<?>>map(ResponseEntity::ok).orElseGet(() -> notFound(what, symbol));
    }

    private static ResponseEntity<?> many(Collection<?> rows, String what, String symbol) {
        return rows.isEmpty() ? notFound(what, symbol) : ResponseEntity.ok(rows);
    }

    private static ResponseEntity<Map<String, String>> notFound(String what, String symbol) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("detail", what + " not found for symbol: " + symbol));
    }
}
