package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.agent.AgentInvoker;
import com.socialgenius.browseruse.backend.agent.AgentMessageListener;
import com.socialgenius.browseruse.backend.agent.AgentRequest;
import com.socialgenius.browseruse.backend.agent.BrowserGate;
import com.socialgenius.browseruse.backend.agent.BrowserLease;
import com.socialgenius.browseruse.backend.config.AutomationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Synchronous one-shot agent runs for free-form instructions.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final AgentInvoker agentInvoker;
    private final BrowserGate browserGate;
    private final AutomationProperties properties;

    public QueryService(AgentInvoker agentInvoker, BrowserGate browserGate, AutomationProperties properties) {
        this.agentInvoker = agentInvoker;
        this.browserGate = browserGate;
        this.properties = properties;
    }

    /**
     * Runs {@code task} on the shared browser and returns the agent's final report.
     *
     * @throws IllegalArgumentException if the task is blank
     * @throws TimeoutException if the browser stayed busy or the agent overran the query deadline
     */
    public String query(String task) throws TimeoutException, InterruptedException {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("Task cannot be empty");
        }
        String traceId = "query-" + UUID.randomUUID().toString().substring(0, 8);
        Duration timeout = properties.getQuery().getTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();

        log.info("[TRACE:{}] Running free-form query ({} chars)", traceId, task.length());
        try (BrowserLease lease = browserGate.acquire(timeout)) {
            return agentInvoker.invoke(lease, new AgentRequest(task, traceId), AgentMessageListener.NO_OP,
                    Duration.ofNanos(deadline - System.nanoTime())).finalResultOrEmpty();
        }
    }
}
