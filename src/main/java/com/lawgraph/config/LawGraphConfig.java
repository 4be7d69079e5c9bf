package com.lawgraph.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Engine settings under {@code law-graph.*}. Every getter below the nested
 * classes falls back to a default when the section is missing.
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "law-graph")
public class LawGraphConfig {

    private Context context;
    private Range range;
    private Verifier verifier;
    private Batch batch;

    // ============================================================
    // Context Tracker
    // ============================================================
    @Data
    public static class Context {
        private Integer recentLawCapacity;
    }

    // ============================================================
    // Range Expander
    // ============================================================
    @Data
    public static class Range {
        private Integer maxExpansion;
    }

    // ============================================================
    // Verifier
    // ============================================================
    @Data
    public static class Verifier {
        private Boolean enabled;
        private Double threshold;
        private Integer timeoutSeconds;
    }

    // ============================================================
    // Batch
    // ============================================================
    @Data
    public static class Batch {
        private Integer parallelism;
    }

    // ============================================================
    // Convenience Getters
    // ============================================================

    public int getRecentLawCapacity() {
        return context != null && context.getRecentLawCapacity() != null
                ? context.getRecentLawCapacity()
                : 10;
    }

    public int getMaxRangeExpansion() {
        return range != null && range.getMaxExpansion() != null
                ? range.getMaxExpansion()
                : 500;
    }

    public boolean isVerifierEnabled() {
        return verifier != null && Boolean.TRUE.equals(verifier.getEnabled());
    }

    public double getVerifierThreshold() {
        return verifier != null && verifier.getThreshold() != null
                ? verifier.getThreshold()
                : 0.5;
    }

    public int getVerifierTimeoutSeconds() {
        return verifier != null && verifier.getTimeoutSeconds() != null
                ? verifier.getTimeoutSeconds()
                : 10;
    }

    public int getBatchParallelism() {
        return batch != null && batch.getParallelism() != null
                ? batch.getParallelism()
                : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    // ============================================================
    // Initialization & Logging
    // ============================================================

    @PostConstruct
    public void init() {
        log.info("=".repeat(70));
        log.info("LAW GRAPH CONFIGURATION INITIALIZED");
        log.info("=".repeat(70));
        log.info("  - Recent-law memory capacity: {}", getRecentLawCapacity());
        log.info("  - Max range expansion: {}", getMaxRangeExpansion());
        log.info("  - Verifier enabled: {} (threshold {}, timeout {}s)",
                isVerifierEnabled(), getVerifierThreshold(), getVerifierTimeoutSeconds());
        log.info("  - Batch parallelism: {}", getBatchParallelism());
    }
}
