package de.bsommerfeld.dbkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class OptimizerConfig {

    @JsonProperty("slow-query-threshold-ms")
    private double slowQueryThresholdMs = 1000;

    @JsonProperty("enable-logging")
    private boolean enableLogging = true;

    @JsonProperty("metrics-cache-ttl-seconds")
    private long metricsCacheTtlSeconds = 300;

    public double getSlowQueryThresholdMs() {
        return slowQueryThresholdMs;
    }

    public void setSlowQueryThresholdMs(double slowQueryThresholdMs) {
        this.slowQueryThresholdMs = slowQueryThresholdMs;
    }

    public boolean isEnableLogging() {
        return enableLogging;
    }

    public void setEnableLogging(boolean enableLogging) {
        this.enableLogging = enableLogging;
    }

    public long getMetricsCacheTtlSeconds() {
        return metricsCacheTtlSeconds;
    }

    public void setMetricsCacheTtlSeconds(long metricsCacheTtlSeconds) {
        this.metricsCacheTtlSeconds = metricsCacheTtlSeconds;
    }
}
