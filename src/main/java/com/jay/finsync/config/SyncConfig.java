package com.jay.finsync.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;

/**
 * Loads and exposes the sync configuration from config.yaml.
 * Values are read once at startup and cached. Edit config.yaml and restart to apply changes.
 */
@Slf4j
@Component
public class SyncConfig {

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    private final String configFile;
    private final Environment env;

    // ── Sections ──────────────────────────────────────────────────────────────
    private Fmp fmp = new Fmp();
    private Sync sync = new Sync();

    public SyncConfig(@Value("${finsync.config-file:config.yaml}") String configFile, Environment env) {
        this.configFile = configFile;
        this.env = env;
    }

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            try (is) {
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                if (root.getFmp() != null) this.fmp = root.getFmp();
                if (root.getSync() != null) this.sync = root.getSync();
            }

            // Jackson reads ${VAR:default} as a literal string
            this.fmp.setApiKey(resolve(this.fmp.getApiKey()));
            this.fmp.setBaseUrl(resolve(this.fmp.getBaseUrl()));
            log.info("SyncConfig loaded from '{}'. FMP base url: {}, api key set: {}",
                configFile, fmp.getBaseUrl(), fmp.getApiKey() != null && !fmp.getApiKey().isBlank());
        } catch (Exception e) {
            log.error("Failed to load {}, using defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Fmp fmp()   { return fmp; }
    public Sync sync() { return sync; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Fmp fmp = new Fmp();
        private Sync sync = new Sync();
    }

    @Data public static class Fmp {
        private String apiKey = "";
        private String baseUrl = "https://financialmodelingprep.com/stable";
        private int timeoutSeconds = 10;
        private int maxRetries = 3;
        private double backoffFactor = 1.0;
        private long rateLimitDelayMs = 100;
    }

    @Data public static class Sync {
        private int financialLimit = 40;
        private int metricsLimit = 40;
        private String defaultPeriod = "annual";
        private long stepDelayMs = 500;
    }
}
