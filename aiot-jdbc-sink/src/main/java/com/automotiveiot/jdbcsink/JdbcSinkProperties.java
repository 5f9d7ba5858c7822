package com.automotiveiot.jdbcsink;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the driving record sink.
 */
@ConfigurationProperties("aiot.jdbc.sink")
public class JdbcSinkProperties {

    /**
     * 'true', 'false' or the location of a custom initialization script for the tables.
     */
    private String initialize = "false";

    /**
     * Enable detailed metrics collection (default: true).
     */
    private boolean enableMetrics = true;

    /**
     * Metrics prefix for Prometheus metrics (default: "aiot_jdbc_sink").
     */
    private String metricsPrefix = "aiot_jdbc_sink";

    /**
     * Retry a failed write of a derivation unit (default: true).
     */
    private boolean enableRetry = true;

    /**
     * Maximum number of attempts per derivation unit, first attempt included (default: 3).
     */
    private int maxRetryAttempts = 3;

    /**
     * Row limit applied to queries that do not set one (default: 100).
     */
    private int defaultQueryLimit = 100;

    public String getInitialize() {
        return this.initialize;
    }

    public void setInitialize(String initialize) {
        this.initialize = initialize;
    }

    public boolean isEnableMetrics() {
        return enableMetrics;
    }

    public void setEnableMetrics(boolean enableMetrics) {
        this.enableMetrics = enableMetrics;
    }

    public String getMetricsPrefix() {
        return metricsPrefix;
    }

    public void setMetricsPrefix(String metricsPrefix) {
        this.metricsPrefix = metricsPrefix;
    }

    public boolean isEnableRetry() {
        return enableRetry;
    }

    public void setEnableRetry(boolean enableRetry) {
        this.enableRetry = enableRetry;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public void setMaxRetryAttempts(int maxRetryAttempts) {
        this.maxRetryAttempts = maxRetryAttempts;
    }

    public int getDefaultQueryLimit() {
        return defaultQueryLimit;
    }

    public void setDefaultQueryLimit(int defaultQueryLimit) {
        this.defaultQueryLimit = defaultQueryLimit;
    }
}
