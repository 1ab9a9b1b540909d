package com.socialgenius.browseruse.backend.agent;

/**
 * Receives intermediate agent output while a run is in progress.
 * Called from the agent's thread, concurrently with the caller waiting on the run.
 */
@FunctionalInterface
public interface AgentMessageListener {

    AgentMessageListener NO_OP = message -> { };

    void onMessage(String message);
}
