package com.jay.finsync.layer1_data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jay.finsync.config.SyncConfig;
import com.jay.finsync.layer1_data.dto.*;
import com.jay.finsync.model.enums.ReportingPeriod;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1: Financial Modeling Prep REST client.
 * Company profile, statements, key metrics, ratios, scores and analyst price targets
 * fetched directly via OkHttp and mapped with Jackson.
 *
 * Calls are spaced by rate_limit_delay_ms. HTTP 429 is retried with exponential backoff,
 * timeouts and connection failures are retried immediately, anything else fails at once.
 *
 * API base: https://financialmodelingprep.com/stable
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FmpClient {

    private static final String ERROR_MESSAGE_FIELD = "Error Message";

    private final SyncConfig config;
    private final ObjectMapper objectMapper = createMapper();
    private final Object rateLimitLock = new Object();

    private OkHttpClient http;
    private long lastRequestNanos;

    @PostConstruct
    public void init() {
        int timeout = config.fmp().getTimeoutSeconds();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(timeout, TimeUnit.SECONDS)
            .readTimeout(timeout, TimeUnit.SECONDS)
            .build();
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // FMP sends "" for unknown dates and numbers
        mapper.coercionConfigDefaults().setCoercion(CoercionInputShape.EmptyString, CoercionAction.AsNull);
        return mapper;
    }

    // ── Company ────────────────────────────────────────────────────────────────

    public Optional<FmpCompanyProfile> getCompanyProfile(String symbol) {
        validateSymbol(symbol);
        return single(get("profile", Map.of("symbol", symbol)), FmpCompanyProfile.class);
    }

    // ── Financial Statements ───────────────────────────────────────────────────

    public List<FmpIncomeStatement> getIncomeStatements(String symbol, String period, int limit) {
        return list(get("income-statement", periodParams(symbol, period, limit)), FmpIncomeStatement.class);
    }

    public List<FmpBalanceSheet> getBalanceSheets(String symbol, String period, int limit) {
        return list(get("balance-sheet-statement", periodParams(symbol, period, limit)), FmpBalanceSheet.class);
    }

    public List<FmpCashFlowStatement> getCashFlowStatements(String symbol, String period, int limit) {
        return list(get("cash-flow-statement", periodParams(symbol, period, limit)), FmpCashFlowStatement.class);
    }

    // ── Metrics & Ratios ───────────────────────────────────────────────────────

    public List<FmpKeyMetrics> getKeyMetrics(String symbol, String period, int limit) {
        return list(get("key-metrics", periodParams(symbol, period, limit)), FmpKeyMetrics.class);
    }

    public List<FmpFinancialRatios> getFinancialRatios(String symbol, String period, int limit) {
        return list(get("ratios", periodParams(symbol, period, limit)), FmpFinancialRatios.class);
    }

    public Optional<FmpFinancialScores> getFinancialScores(String symbol) {
        validateSymbol(symbol);
        return single(get("financial-scores", Map.of("symbol", symbol)), FmpFinancialScores.class);
    }

    // ── Analyst Price Targets ──────────────────────────────────────────────────

    public Optional<FmpPriceTargetConsensus> getPriceTarget(String symbol) {
        validateSymbol(symbol);
        return single(get("price-target-consensus", Map.of("symbol", symbol)), FmpPriceTargetConsensus.class);
    }

    public Optional<FmpPriceTargetSummary> getPriceTargetSummary(String symbol) {
        validateSymbol(symbol);
        return single(get("price-target-summary", Map.of("symbol", symbol)), FmpPriceTargetSummary.class);
    }

    // ── Validation ─────────────────────────────────────────────────────────────

    private Map<String, String> periodParams(String symbol, String period, int limit) {
        validateSymbol(symbol);
        ReportingPeriod reportingPeriod = ReportingPeriod.fromApiValue(period);
        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("Limit must be between 1 and 100");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("period", reportingPeriod.apiValue());
        params.put("limit", String.valueOf(limit));
        return params;
    }

    private static void validateSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be empty");
        }
    }

    // ── Response mapping ───────────────────────────────────────────────────────

    private <T> List<T> list(JsonNode data, Class<T> type) {
        if (data == null) return List.of();
        if (!data.isArray()) {
            log.warn("Expected list response for {}, got {}", type.getSimpleName(), data.getNodeType());
            return List.of();
        }
        List<T> items = new ArrayList<>(data.size());
        try {
            for (JsonNode item : data) {
                items.add(objectMapper.treeToValue(item, type));
            }
        } catch (JsonProcessingException e) {
            log.error("Error parsing {} response: {}", type.getSimpleName(), e.getMessage());
            return List.of();
        }
        return items;
    }

    private <T> Optional<T> single(JsonNode data, Class<T> type) {
        if (data == null) return Optional.empty();
        JsonNode item = data.isArray() ? data.path(0) : data;
        if (!item.isObject()) return Optional.empty();
        try {
            return Optional.of(objectMapper.treeToValue(item, type));
        } catch (JsonProcessingException e) {
            log.error("Error parsing {} response: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    // ── HTTP Helpers ───────────────────────────────────────────────────────────

    /**
     * GETs an endpoint with the api key added to the query.
     * Returns null when FMP answers with an empty body, array or object.
     */
    JsonNode get(String endpoint, Map<String, String> params) {
        SyncConfig.Fmp fmp = config.fmp();
        HttpUrl base = HttpUrl.parse(fmp.getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid FMP base url: " + fmp.getBaseUrl());
        }
        HttpUrl.Builder url = base.newBuilder().addPathSegments(endpoint);
        params.forEach(url::addQueryParameter);
        url.addQueryParameter("apikey", fmp.getApiKey());
        Request request = new Request.Builder().url(url.build()).get().build();

        applyRateLimiting();

        int maxRetries = Math.max(1, fmp.getMaxRetries());
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            boolean lastAttempt = attempt == maxRetries - 1;
            try (Response response = http.newCall(request).execute()) {
                if (response.code() == 429) {
                    if (lastAttempt) throw new FmpRateLimitException("API rate limit exceeded");
                    long waitMs = (long) (fmp.getBackoffFactor() * Math.pow(2, attempt) * 1000);
                    log.warn("Rate limit exceeded on {}. Retrying in {}ms...", endpoint, waitMs);
                    sleep(waitMs);
                    continue;
                }
                if (!response.isSuccessful()) {
                    log.error("HTTP error {} calling {}", response.code(), endpoint);
                    throw new FmpHttpException(response.code(), "HTTP " + response.code() + " calling " + endpoint);
                }
                ResponseBody body = response.body();
                return readBody(endpoint, body != null ? body.string() : "");
            } catch (JsonProcessingException e) {
                log.error("Invalid JSON response from {}: {}", endpoint, e.getOriginalMessage());
                throw new FmpException("Invalid JSON response from " + endpoint, e);
            } catch (InterruptedIOException e) {
                log.warn("Timeout calling {} (attempt {})", endpoint, attempt + 1);
                if (lastAttempt) throw new FmpTimeoutException("Request timeout for " + endpoint, e);
            } catch (IOException e) {
                log.error("Request failed for {} (attempt {}): {}", endpoint, attempt + 1, e.getMessage());
                if (lastAttempt) throw new FmpConnectionException("Failed to connect to " + endpoint, e);
            }
        }
        throw new FmpConnectionException("No attempt made for " + endpoint, null);
    }

    private JsonNode readBody(String endpoint, String body) throws JsonProcessingException {
        if (body.isBlank()) {
            log.warn("Empty response from {}", endpoint);
            return null;
        }
        JsonNode root = objectMapper.readTree(body);
        if (root == null || root.isNull() || root.isEmpty()) {
            log.warn("Empty response from {}", endpoint);
            return null;
        }
        if (root.isObject() && root.has(ERROR_MESSAGE_FIELD)) {
            String message = root.get(ERROR_MESSAGE_FIELD).asText();
            log.error("API error from {}: {}", endpoint, message);
            throw new FmpException(message);
        }
        return root;
    }

    private void applyRateLimiting() {
        long delayNanos = TimeUnit.MILLISECONDS.toNanos(config.fmp().getRateLimitDelayMs());
        synchronized (rateLimitLock) {
            long waitNanos = lastRequestNanos + delayNanos - System.nanoTime();
            if (lastRequestNanos != 0 && waitNanos > 0) {
                sleep(TimeUnit.NANOSECONDS.toMillis(waitNanos));
            }
            lastRequestNanos = System.nanoTime();
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FmpConnectionException("Interrupted while waiting to call FMP", e);
        }
    }
}
