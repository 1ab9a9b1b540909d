package com.socialgenius.browseruse.backend.agent;

/**
 * Final output of an agent run.
 *
 * @param finalResult the agent's closing report, may be null when it produced none
 * @param done        whether the agent considered its task finished
 */
public record AgentResult(String finalResult, boolean done) {

    public String finalResultOrEmpty() {
        return finalResult == null ? "" : finalResult;
    }
}
