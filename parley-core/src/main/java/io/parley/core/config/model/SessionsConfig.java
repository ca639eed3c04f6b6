package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.parley.core.session.SessionSettings;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionsConfig(
    @JsonAlias({"timeout_minutes"}) int timeoutMinutes,
    @JsonAlias({"max_sessions"}) int maxSessions,
    @JsonAlias({"sweep_interval_minutes"}) int sweepIntervalMinutes
) {

    public static SessionsConfig defaults() {
        return new SessionsConfig(30, 1000, 10);
    }

    public SessionSettings toSettings() {
        return new SessionSettings(
            Duration.ofMinutes(timeoutMinutes),
            maxSessions,
            Duration.ofMinutes(sweepIntervalMinutes)
        );
    }
}
