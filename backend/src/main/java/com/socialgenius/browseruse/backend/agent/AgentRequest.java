package com.socialgenius.browseruse.backend.agent;

/**
 * Instruction handed to the agent. {@code toString} omits the instruction because
 * login instructions embed credentials.
 */
public record AgentRequest(String instruction, String traceId) {

    @Override
    public String toString() {
        return "AgentRequest[traceId=" + traceId + ", instruction=<" +
                (instruction == null ? 0 : instruction.length()) + " chars>]";
    }
}
