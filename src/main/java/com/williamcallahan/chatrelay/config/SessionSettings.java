package com.williamcallahan.chatrelay.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Session lifecycle configuration: inactivity thresholds, sweep cadence and snapshot location.
 */
public class SessionSettings {

    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(600);
    private static final Duration WARNING_DEF = Duration.ofSeconds(300);
    private static final Duration SWEEP_DEF = Duration.ofSeconds(30);
    private static final Duration SNAPSHOT_DEF = Duration.ofMinutes(5);
    private static final String SNAPSHOT_PATH_DEF = "sessions.json";
    private static final String TIMEOUT_KEY = "app.session.timeout";
    private static final String WARNING_KEY = "app.session.warning-threshold";
    private static final String SWEEP_KEY = "app.session.sweep-interval";
    private static final String SNAPSHOT_KEY = "app.session.snapshot-interval";
    private static final String SNAPSHOT_PATH_KEY = "app.session.snapshot-path";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String WARNING_ORDER_MSG =
            "app.session.warning-threshold must be shorter than app.session.timeout.";

    private Duration timeout = TIMEOUT_DEF;
    private Duration warningThreshold = WARNING_DEF;
    private Duration sweepInterval = SWEEP_DEF;
    private Duration snapshotInterval = SNAPSHOT_DEF;
    private String snapshotPath = SNAPSHOT_PATH_DEF;

    /**
     * Validates session settings.
     */
    public void validateConfiguration() {
        requirePositive(TIMEOUT_KEY, timeout);
        requirePositive(WARNING_KEY, warningThreshold);
        requirePositive(SWEEP_KEY, sweepInterval);
        requirePositive(SNAPSHOT_KEY, snapshotInterval);
        if (snapshotPath == null || snapshotPath.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, SNAPSHOT_PATH_KEY));
        }
        if (warningThreshold.compareTo(timeout) >= 0) {
            throw new IllegalArgumentException(WARNING_ORDER_MSG);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getWarningThreshold() {
        return warningThreshold;
    }

    public void setWarningThreshold(Duration warningThreshold) {
        this.warningThreshold = warningThreshold;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getSnapshotInterval() {
        return snapshotInterval;
    }

    public void setSnapshotInterval(Duration snapshotInterval) {
        this.snapshotInterval = snapshotInterval;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(String snapshotPath) {
        this.snapshotPath = snapshotPath;
    }

    private static void requirePositive(String propertyKey, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
