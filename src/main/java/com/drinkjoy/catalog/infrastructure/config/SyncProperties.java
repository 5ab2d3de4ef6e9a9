package com.drinkjoy.catalog.infrastructure.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the background catalog synchronization
 */
@Component
@Validated
@ConfigurationProperties(prefix = "drinkjoy.sync")
public class SyncProperties {

    private boolean enabled = true;
    private boolean autoStart = false;
    private Duration interval = Duration.ofSeconds(60);
    private String sourceId;

    @Min(1)
    private int maxAttempts = 3;
    private Duration retryDelay = Duration.ofSeconds(5);
    @Min(1)
    private int errorThreshold = 5;
    @Min(1)
    private long healthMaxAgeMinutes = 30;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public boolean hasSourceId() {
        return sourceId != null && !sourceId.isBlank();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public int getErrorThreshold() {
        return errorThreshold;
    }

    public void setErrorThreshold(int errorThreshold) {
        this.errorThreshold = errorThreshold;
    }

    public long getHealthMaxAgeMinutes() {
        return healthMaxAgeMinutes;
    }

    public void setHealthMaxAgeMinutes(long healthMaxAgeMinutes) {
        this.healthMaxAgeMinutes = healthMaxAgeMinutes;
    }
}
