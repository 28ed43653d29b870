package com.example.keyseq_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the keyframe retrieval service (text search, video frames, similarity).
 */
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {
    private String baseUrl = "http://127.0.0.1:8000";
    private long timeoutSeconds = 30;
    private int connectTimeoutMillis = 5_000;
    private int maxInMemoryBytes = 16 * 1024 * 1024;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public void setConnectTimeoutMillis(int connectTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    public int getMaxInMemoryBytes() {
        return maxInMemoryBytes;
    }

    public void setMaxInMemoryBytes(int maxInMemoryBytes) {
        this.maxInMemoryBytes = maxInMemoryBytes;
    }
}
