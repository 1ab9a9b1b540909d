package com.socialgenius.browseruse.backend.agent;

/**
 * The browser automation agent: executes a natural-language instruction against a
 * browsing context and reports what it ended up seeing.
 * <p>
 * A call may block for a long time and may throw. Callers bound it with their own
 * deadline; implementations are not required to react to interruption.
 */
public interface BrowserAgent {

    /**
     * Runs the instruction to completion.
     *
     * @param request  instruction and trace id
     * @param context  browsing context the agent drives
     * @param listener receives intermediate agent output when
     *                 {@link #supportsMessageStreaming()} is true; otherwise never called
     * @return the agent's final output
     * @throws AgentRunException if the agent could not complete the run
     */
    AgentResult run(AgentRequest request, BrowsingContext context, AgentMessageListener listener);

    /**
     * Whether {@link #run} forwards intermediate messages to its listener.
     */
    default boolean supportsMessageStreaming() {
        return false;
    }
}
