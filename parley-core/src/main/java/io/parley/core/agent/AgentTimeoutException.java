package io.parley.core.agent;

import java.time.Duration;

public final class AgentTimeoutException extends RuntimeException {

    public AgentTimeoutException(String sessionId, Duration deadline) {
        super("Agent work for session " + sessionId + " did not finish within " + deadline.toSeconds() + "s");
    }
}
