package com.socialgenius.browseruse.backend.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serializes access to the single shared browsing context. Jobs queue here in
 * arrival order; at most one agent run drives the browser at any time.
 */
@Component
public class BrowserGate {

    private static final Logger log = LoggerFactory.getLogger(BrowserGate.class);

    private final Semaphore permit = new Semaphore(1, true);
    private final BrowsingContext context;

    public BrowserGate(BrowsingContext context) {
        this.context = context;
    }

    /**
     * Waits up to {@code timeout} for the browsing context.
     *
     * @throws TimeoutException if the context stayed busy for the whole timeout
     */
    public BrowserLease acquire(Duration timeout) throws InterruptedException, TimeoutException {
        long waitMillis = Math.max(0, timeout.toMillis());
        if (!permit.tryAcquire(waitMillis, TimeUnit.MILLISECONDS)) {
            log.warn("[BROWSER] Context {} still busy after {} ms", context.id(), waitMillis);
            throw new TimeoutException("Browser busy for " + waitMillis + " ms");
        }
        return new BrowserLease(permit, context);
    }

    public boolean isBusy() {
        return permit.availablePermits() == 0;
    }

    /**
     * Approximate number of callers waiting for the context.
     */
    public int queuedCount() {
        return permit.getQueueLength();
    }
}
