package com.socialgenius.browseruse.backend.agent;

import com.socialgenius.browseruse.backend.support.FakeBrowsingContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class BrowserGateTest {

    private final FakeBrowsingContext context = new FakeBrowsingContext();
    private final BrowserGate gate = new BrowserGate(context);

    @Test
    void shouldGrantOneLeaseAtATime() throws Exception {
        try (BrowserLease lease = gate.acquire(Duration.ofMillis(100))) {
            assertSame(context, lease.context());
            assertTrue(gate.isBusy());
            assertThrows(TimeoutException.class, () -> gate.acquire(Duration.ofMillis(50)));
        }
        assertFalse(gate.isBusy());
    }

    @Test
    void shouldReleaseOnlyOnce() throws Exception {
        BrowserLease lease = gate.acquire(Duration.ofMillis(100));

        lease.close();
        lease.close();

        assertTrue(lease.isReleased());
        BrowserLease next = gate.acquire(Duration.ofMillis(100));
        assertThrows(TimeoutException.class, () -> gate.acquire(Duration.ofMillis(50)));
        next.close();
    }

    @Test
    void shouldDeferReleaseUntilWorkFinishes() throws Exception {
        // Given
        CompletableFuture<String> work = new CompletableFuture<>();
        BrowserLease lease = gate.acquire(Duration.ofMillis(100));

        // When
        lease.releaseWhenDone(work);
        lease.close();

        // Then
        assertFalse(lease.isReleased());
        assertTrue(gate.isBusy());
        work.complete("done");
        assertTrue(lease.isReleased());
        assertFalse(gate.isBusy());
    }

    @Test
    void shouldReleaseDeferredLeaseWhenWorkFails() throws Exception {
        CompletableFuture<String> work = new CompletableFuture<>();
        BrowserLease lease = gate.acquire(Duration.ofMillis(100));
        lease.releaseWhenDone(work);
        lease.close();

        work.completeExceptionally(new AgentRunException("boom"));

        assertFalse(gate.isBusy());
    }
}
