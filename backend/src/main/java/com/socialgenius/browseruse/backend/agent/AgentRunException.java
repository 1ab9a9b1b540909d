package com.socialgenius.browseruse.backend.agent;

/**
 * The agent could not complete a run.
 */
public class AgentRunException extends RuntimeException {

    public AgentRunException(String message) {
        super(message);
    }

    public AgentRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
