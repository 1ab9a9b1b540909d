package com.socialgenius.browseruse.backend.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs agent calls, and the browser work around them, under a wall-clock deadline.
 * <p>
 * On expiry the call is abandoned, not interrupted: it keeps running on its own thread
 * and the lease stays held until it returns, so the next job never shares the browser
 * with a run that is still in flight.
 */
@Component
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    private final BrowserAgent agent;
    private final ExecutorService agentCallExecutor;

    public AgentInvoker(BrowserAgent agent, @Qualifier("agentCallExecutor") ExecutorService agentCallExecutor) {
        this.agent = agent;
        this.agentCallExecutor = agentCallExecutor;
    }

    /**
     * @throws TimeoutException if the deadline elapsed first, or had already elapsed, in which
     *         case the agent is never started
     * @throws AgentRunException if the agent failed; other runtime failures propagate unchanged
     */
    public AgentResult invoke(BrowserLease lease, AgentRequest request, AgentMessageListener listener,
            Duration timeout) throws TimeoutException, InterruptedException {
        AgentMessageListener effective = agent.supportsMessageStreaming() && listener != null
                ? listener
                : AgentMessageListener.NO_OP;
        return runWithin(lease, request.traceId(), "Agent call",
                () -> agent.run(request, lease.context(), effective), timeout);
    }

    /**
     * Runs browser work for the lease holder under the same rules as an agent call: nothing
     * starts once {@code timeout} is used up, and overdue work keeps the lease until it returns.
     */
    public <T> T runWithin(BrowserLease lease, String traceId, String step, Supplier<T> work,
            Duration timeout) throws TimeoutException, InterruptedException {
        if (timeout.isNegative() || timeout.isZero()) {
            log.warn("[TRACE:{}] {} skipped, deadline already passed", traceId, step);
            throw new TimeoutException(step + " skipped, deadline already passed");
        }

        CompletableFuture<T> call = CompletableFuture.supplyAsync(work, agentCallExecutor);

        try {
            return call.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("[TRACE:{}] {} exceeded {} ms, abandoning it", traceId, step, timeout.toMillis());
            lease.releaseWhenDone(call);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new AgentRunException(step + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            lease.releaseWhenDone(call);
            throw e;
        }
    }

    public boolean supportsMessageStreaming() {
        return agent.supportsMessageStreaming();
    }
}
