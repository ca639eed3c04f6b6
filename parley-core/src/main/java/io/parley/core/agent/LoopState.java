package io.parley.core.agent;

public enum LoopState {
    SENDING,
    AWAITING_TOOL_DECISION,
    EXECUTING,
    DONE,
    EXHAUSTED
}
