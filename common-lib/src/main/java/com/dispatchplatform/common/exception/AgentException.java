package com.dispatchplatform.common.exception;

/**
 * Failure inside one bureau agent. The orchestrator contains it to that agent, so the other
 * agents of the same incident still run.
 */
public class AgentException extends DispatchException {

    private final String agentId;

    public AgentException(String agentId, String message, Throwable cause) {
        super("[" + agentId + "] " + message, cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
