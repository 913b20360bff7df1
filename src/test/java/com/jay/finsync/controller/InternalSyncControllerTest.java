package com.jay.finsync.controller;

import com.jay.finsync.entity.Company;
import com.jay.finsync.entity.CompanyFinancialHealth;
import com.jay.finsync.layer1_data.FmpHttpException;
import com.jay.finsync.layer1_data.FmpRateLimitException;
import com.jay.finsync.layer3_sync.CompanyFullDataSyncService;
import com.jay.finsync.layer3_sync.CompanyMetricsSyncService;
import com.jay.finsync.layer3_sync.CompanySyncService;
import com.jay.finsync.layer3_sync.FinancialHealthSyncService;
import com.jay.finsync.layer3_sync.FinancialStatementsSyncService;
import com.jay.finsync.layer3_sync.PriceTargetSyncService;
import com.jay.finsync.model.FullSyncResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(InternalSyncController.class)
@DisplayName("InternalSyncController")
class InternalSyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CompanySyncService companySync;

    @MockBean
    private CompanyMetricsSyncService metricsSync;

    @MockBean
    private FinancialStatementsSyncService statementsSync;

    @MockBean
    private FinancialHealthSyncService healthSync;

    @MockBean
    private PriceTargetSyncService priceTargetSync;

    @MockBean
    private CompanyFullDataSyncService fullDataSync;

    @Test
    void syncedCompanyIsReturned() throws Exception {
        when(companySync.upsertCompany("AAPL")).thenReturn(Optional.of(
            Company.builder().id(7L).symbol("AAPL").companyName("Apple Inc.").build()));

        mockMvc.perform(get("/internal/company/AAPL/sync"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.symbol").value("AAPL"))
            .andExpect(jsonPath("$.companyName").value("Apple Inc."));
    }

    @Test
    void emptySyncAnswers404WithDetail() throws Exception {
        when(metricsSync.upsertKeyMetrics(anyString(), anyInt(), anyString())).thenReturn(List.of());

        mockMvc.perform(get("/internal/key-metrics/AAPL/sync"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.detail").value("Key metrics not found for symbol: AAPL"));

        verify(metricsSync).upsertKeyMetrics("AAPL", 40, "annual");
    }

    @Test
    void queryParametersArePassedThrough() throws Exception {
        when(statementsSync.upsertBalanceSheets(anyString(), anyInt(), anyString())).thenReturn(List.of());

        mockMvc.perform(get("/internal/balance-sheets/MSFT/sync").param("limit", "8").param("period", "quarter"))
            .andExpect(status().isNotFound());

        verify(statementsSync).upsertBalanceSheets("MSFT", 8, "quarter");
    }

    @Test
    void healthRowsAreReturnedAsAList() throws Exception {
        when(healthSync.upsertFinancialHealth("AAPL")).thenReturn(List.of(CompanyFinancialHealth.builder()
            .symbol("AAPL").section("Liquidity & Solvency").metric("Current Ratio")
            .benchmark("1.0–2.0").value("1.5").status("healthy").insight("").build()));

        mockMvc.perform(get("/internal/financial-health/AAPL/sync"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].metric").value("Current Ratio"))
            .andExpect(jsonPath("$[0].value").value("1.5"))
            .andExpect(jsonPath("$[0].status").value("healthy"));
    }

    @Test
    void invalidPeriodIsABadRequest() throws Exception {
        when(metricsSync.upsertFinancialRatios("AAPL", 40, "monthly"))
            .thenThrow(new IllegalArgumentException("Period must be one of: annual, quarter, Q1, Q2, Q3, Q4, FY"));

        mockMvc.perform(get("/internal/financial-ratios/AAPL/sync").param("period", "monthly"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.message").value("Period must be one of: annual, quarter, Q1, Q2, Q3, Q4, FY"));
    }

    @Test
    void nonNumericLimitIsABadRequest() throws Exception {
        mockMvc.perform(get("/internal/income-statements/AAPL/sync").param("limit", "lots"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void upstreamFailuresMapToGatewayStatuses() throws Exception {
        when(priceTargetSync.upsertPriceTarget("AAPL")).thenThrow(new FmpRateLimitException("API rate limit exceeded"));
        when(priceTargetSync.upsertPriceTargetSummary("AAPL")).thenThrow(new FmpHttpException(503, "HTTP 503"));

        mockMvc.perform(get("/internal/price-target/AAPL/sync"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.message").value("API rate limit exceeded"));
        mockMvc.perform(get("/internal/price-target-summary/AAPL/sync"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("Upstream Error"));
    }

    @Test
    void fullSyncReturnsTheRunSummary() throws Exception {
        Map<String, String> steps = new LinkedHashMap<>();
        steps.put("company_profile", "success");
        steps.put("price_target", "failed: HTTP 503");
        when(fullDataSync.syncAll("AAPL", 40, 12)).thenReturn(
            new FullSyncResult("AAPL", FullSyncResult.COMPLETED_WITH_ERRORS, steps, 1, 0.5));

        mockMvc.perform(get("/internal/full-data/AAPL/sync").param("metricsLimit", "12"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("completed_with_errors"))
            .andExpect(jsonPath("$.steps.price_target").value("failed: HTTP 503"))
            .andExpect(jsonPath("$.totalApiCalls").value(1));
    }

    @Test
    void fullSyncWithOutOfRangeLimitIsABadRequest() throws Exception {
        when(fullDataSync.syncAll("AAPL", 0, 40))
            .thenThrow(new IllegalArgumentException("Limit must be between 1 and 100"));

        mockMvc.perform(get("/internal/full-data/AAPL/sync").param("financialLimit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Limit must be between 1 and 100"));
    }

    @Test
    void failedFullSyncIsAServerError() throws Exception {
        Map<String, String> steps = new LinkedHashMap<>();
        steps.put("company_profile", "failed: no profile returned for ZZZZ");
        when(fullDataSync.syncAll("ZZZZ", 40, 40)).thenReturn(
            new FullSyncResult("ZZZZ", FullSyncResult.FAILED, steps, 1, 0.1));

        mockMvc.perform(get("/internal/full-data/ZZZZ/sync"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.steps.company_profile").value("failed: no profile returned for ZZZZ"));
    }
}
