package com.familyledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Engine tuning. Define under 'familyledger.engine' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "familyledger.engine")
public class EngineConfig {

    /** Total attempts for a unit of work that hits a transient storage fault. */
    private int storageRetryAttempts = 3;

    private Duration storageRetryBackoff = Duration.ofMillis(100);

    private int defaultTraversalDepth = 10;

    private int maxTraversalDepth = 50;

    public int getStorageRetryAttempts() {
        return storageRetryAttempts;
    }

    public void setStorageRetryAttempts(int storageRetryAttempts) {
        this.storageRetryAttempts = storageRetryAttempts;
    }

    public Duration getStorageRetryBackoff() {
        return storageRetryBackoff;
    }

    public void setStorageRetryBackoff(Duration storageRetryBackoff) {
        this.storageRetryBackoff = storageRetryBackoff;
    }

    public int getDefaultTraversalDepth() {
        return defaultTraversalDepth;
    }

    public void setDefaultTraversalDepth(int defaultTraversalDepth) {
        this.defaultTraversalDepth = defaultTraversalDepth;
    }

    public int getMaxTraversalDepth() {
        return maxTraversalDepth;
    }

    public void setMaxTraversalDepth(int maxTraversalDepth) {
        this.maxTraversalDepth = maxTraversalDepth;
    }
}
