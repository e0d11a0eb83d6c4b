package io.pulse4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for Pulse scheduler behavior.
 */
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {
    private int maxConcurrency = 20; // global
    private int defaultConcurrency = 5; // per job name
    private int lockLimit = 0; // global, 0 = unlimited
    private int batchSize = 5;
    private Duration defaultLockLifetime = Duration.ofMinutes(10);
    private Duration maxBackoffDelay = Duration.ofHours(1);
    private Duration processEvery = Duration.ofSeconds(5);
    private boolean cleanupFinishedJobs = true;
    private String workerId;
    private boolean ensureIndexesOnStartup = false;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    public void setDefaultConcurrency(int defaultConcurrency) {
        this.defaultConcurrency = defaultConcurrency;
    }

    public int getLockLimit() {
        return lockLimit;
    }

    public void setLockLimit(int lockLimit) {
        this.lockLimit = lockLimit;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    /**
     * Age after which a claimed job is considered abandoned and may be claimed again.
     */
    public Duration getDefaultLockLifetime() {
        return defaultLockLifetime;
    }

    public void setDefaultLockLifetime(Duration defaultLockLifetime) {
        this.defaultLockLifetime = defaultLockLifetime;
    }

    /**
     * Upper bound of exponential retry delays.
     */
    public Duration getMaxBackoffDelay() {
        return maxBackoffDelay;
    }

    public void setMaxBackoffDelay(Duration maxBackoffDelay) {
        this.maxBackoffDelay = maxBackoffDelay;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    /**
     * Delete jobs that completed successfully and have no further run.
     */
    public boolean isCleanupFinishedJobs() {
        return cleanupFinishedJobs;
    }

    public void setCleanupFinishedJobs(boolean cleanupFinishedJobs) {
        this.cleanupFinishedJobs = cleanupFinishedJobs;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
