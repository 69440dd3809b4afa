package com.changesentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * The {@code cycle:} section of the sentinel configuration: fan-out width,
 * per-fetch timeout, cycle deadline and report history size.
 */
public class CycleSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int maxConcurrentFetches = 8;
    private long fetchTimeoutSeconds = 10;
    private long deadlineSeconds = 60;
    private int historySize = 20;

    void collectErrors(List<String> errors) {
        if (maxConcurrentFetches < 1) {
            errors.add("cycle.maxConcurrentFetches must be >= 1, got: " + maxConcurrentFetches);
        }
        if (fetchTimeoutSeconds < 1) {
            errors.add("cycle.fetchTimeoutSeconds must be >= 1, got: " + fetchTimeoutSeconds);
        }
        if (deadlineSeconds < fetchTimeoutSeconds) {
            errors.add("cycle.deadlineSeconds must be >= fetchTimeoutSeconds, got: " + deadlineSeconds);
        }
        if (historySize < 1) {
            errors.add("cycle.historySize must be >= 1, got: " + historySize);
        }
    }

    public Duration fetchTimeout() {
        return Duration.ofSeconds(fetchTimeoutSeconds);
    }

    public Duration deadline() {
        return Duration.ofSeconds(deadlineSeconds);
    }

    public int getMaxConcurrentFetches() {
        return maxConcurrentFetches;
    }

    public void setMaxConcurrentFetches(int maxConcurrentFetches) {
        this.maxConcurrentFetches = maxConcurrentFetches;
    }

    public long getFetchTimeoutSeconds() {
        return fetchTimeoutSeconds;
    }

    public void setFetchTimeoutSeconds(long fetchTimeoutSeconds) {
        this.fetchTimeoutSeconds = fetchTimeoutSeconds;
    }

    public long getDeadlineSeconds() {
        return deadlineSeconds;
    }

    public void setDeadlineSeconds(long deadlineSeconds) {
        this.deadlineSeconds = deadlineSeconds;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    @Override
    public String toString() {
        return "CycleSettings{" +
                "maxConcurrentFetches=" + maxConcurrentFetches +
                ", fetchTimeoutSeconds=" + fetchTimeoutSeconds +
                ", deadlineSeconds=" + deadlineSeconds +
                ", historySize=" + historySize +
                '}';
    }
}
