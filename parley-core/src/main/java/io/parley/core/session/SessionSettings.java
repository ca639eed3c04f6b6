package io.parley.core.session;

import java.time.Duration;

public record SessionSettings(Duration timeout, int maxSessions, Duration sweepInterval) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);
    public static final int DEFAULT_MAX_SESSIONS = 1000;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(10);

    public SessionSettings {
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        maxSessions = maxSessions <= 0 ? DEFAULT_MAX_SESSIONS : maxSessions;
        sweepInterval = sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()
            ? DEFAULT_SWEEP_INTERVAL
            : sweepInterval;
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_TIMEOUT, DEFAULT_MAX_SESSIONS, DEFAULT_SWEEP_INTERVAL);
    }
}
