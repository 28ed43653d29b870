package com.example.keyseq_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Batching and backpressure limits for similarity lookups.
 */
@ConfigurationProperties(prefix = "similarity")
public class SimilarityProperties {

    private int batchMaxFrames = 200;
    private int batchMaxQueries = 10;
    private int batchRetryAttempts = 1;
    private long batchRetryBackoffMillis = 200;
    private int fallbackGroupSize = 5;
    private long fallbackGroupDelayMillis = 25;
    private int fallbackThreads = 8;
    private double fallbackDegradeFactor = 0.9;
    private long cacheTtlSeconds = 1800;
    private int cacheMaxEntries = 500_000;

    public int getBatchMaxFrames() {
        return batchMaxFrames;
    }

    public void setBatchMaxFrames(int batchMaxFrames) {
        this.batchMaxFrames = batchMaxFrames;
    }

    public int getBatchMaxQueries() {
        return batchMaxQueries;
    }

    public void setBatchMaxQueries(int batchMaxQueries) {
        this.batchMaxQueries = batchMaxQueries;
    }

    public int getBatchRetryAttempts() {
        return batchRetryAttempts;
    }

    public void setBatchRetryAttempts(int batchRetryAttempts) {
        this.batchRetryAttempts = batchRetryAttempts;
    }

    public long getBatchRetryBackoffMillis() {
        return batchRetryBackoffMillis;
    }

    public void setBatchRetryBackoffMillis(long batchRetryBackoffMillis) {
        this.batchRetryBackoffMillis = batchRetryBackoffMillis;
    }

    public int getFallbackGroupSize() {
        return fallbackGroupSize;
    }

    public void setFallbackGroupSize(int fallbackGroupSize) {
        this.fallbackGroupSize = fallbackGroupSize;
    }

    public long getFallbackGroupDelayMillis() {
        return fallbackGroupDelayMillis;
    }

    public void setFallbackGroupDelayMillis(long fallbackGroupDelayMillis) {
        this.fallbackGroupDelayMillis = fallbackGroupDelayMillis;
    }

    public int getFallbackThreads() {
        return fallbackThreads;
    }

    public void setFallbackThreads(int fallbackThreads) {
        this.fallbackThreads = fallbackThreads;
    }

    public double getFallbackDegradeFactor() {
        return fallbackDegradeFactor;
    }

    public void setFallbackDegradeFactor(double fallbackDegradeFactor) {
        this.fallbackDegradeFactor = fallbackDegradeFactor;
    }

    public long getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
        this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }
}
