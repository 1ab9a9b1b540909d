package com.socialgenius.browseruse.backend.agent;

import com.socialgenius.browseruse.backend.support.FakeBrowsingContext;
import com.socialgenius.browseruse.backend.support.ScriptedBrowserAgent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class AgentInvokerTest {

    private final ScriptedBrowserAgent agent = new ScriptedBrowserAgent();
    private final ExecutorService calls = Executors.newCachedThreadPool();
    private final AgentInvoker invoker = new AgentInvoker(agent, calls);
    private final BrowserGate gate = new BrowserGate(new FakeBrowsingContext());

    @AfterEach
    void tearDown() {
        agent.release();
        calls.shutdownNow();
    }

    @Test
    void shouldReturnAgentResultAndForwardMessages() throws Exception {
        agent.emitting("one", "two").reporting("done");
        List<String> received = new ArrayList<>();

        try (BrowserLease lease = gate.acquire(Duration.ofSeconds(1))) {
            AgentResult result = invoker.invoke(lease, new AgentRequest("go", "t-1"), received::add,
                    Duration.ofSeconds(5));

            assertEquals("done", result.finalResult());
        }
        assertEquals(List.of("one", "two"), received);
        assertTrue(invoker.supportsMessageStreaming());
    }

    @Test
    void shouldNotForwardMessagesWithoutStreamingSupport() throws Exception {
        agent.withoutStreaming().emitting("hidden").reporting("done");
        List<String> received = new ArrayList<>();

        try (BrowserLease lease = gate.acquire(Duration.ofSeconds(1))) {
            invoker.invoke(lease, new AgentRequest("go", "t-1"), received::add, Duration.ofSeconds(5));
        }
        assertTrue(received.isEmpty());
    }

    @Test
    void shouldPropagateAgentFailure() throws Exception {
        agent.failingWith(new AgentRunException("bad run"));

        try (BrowserLease lease = gate.acquire(Duration.ofSeconds(1))) {
            AgentRunException thrown = assertThrows(AgentRunException.class,
                    () -> invoker.invoke(lease, new AgentRequest("go", "t-1"), null, Duration.ofSeconds(5)));
            assertEquals("bad run", thrown.getMessage());
        }
        assertFalse(gate.isBusy());
    }

    @Test
    void shouldAbandonOverdueCallAndKeepLease() throws Exception {
        // Given
        agent.blocking().reporting("late");
        BrowserLease lease = gate.acquire(Duration.ofSeconds(1));

        // When
        assertThrows(TimeoutException.class,
                () -> invoker.invoke(lease, new AgentRequest("go", "t-1"), null, Duration.ofMillis(100)));
        lease.close();

        // Then
        assertTrue(gate.isBusy());
        agent.release();
        long deadline = System.currentTimeMillis() + 3000;
        while (gate.isBusy() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(gate.isBusy());
    }

    @Test
    void shouldNotStartAgentOnceDeadlineHasPassed() throws Exception {
        agent.reporting("done");

        try (BrowserLease lease = gate.acquire(Duration.ofSeconds(1))) {
            assertThrows(TimeoutException.class,
                    () -> invoker.invoke(lease, new AgentRequest("go", "t-1"), null, Duration.ofMillis(-5)));
        }

        assertEquals(0, agent.runs());
        assertFalse(gate.isBusy());
    }

    @Test
    void shouldBoundBrowserWorkByDeadlineAndKeepLeaseUntilItReturns() throws Exception {
        // Given
        CountDownLatch stalled = new CountDownLatch(1);
        BrowserLease lease = gate.acquire(Duration.ofSeconds(1));

        // When
        assertThrows(TimeoutException.class, () -> invoker.runWithin(lease, "t-1", "Screenshot", () -> {
            try {
                stalled.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }, Duration.ofMillis(100)));
        lease.close();

        // Then
        assertTrue(gate.isBusy());
        stalled.countDown();
        long deadline = System.currentTimeMillis() + 3000;
        while (gate.isBusy() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(gate.isBusy());
    }
}
