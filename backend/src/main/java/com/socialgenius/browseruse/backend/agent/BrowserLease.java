package com.socialgenius.browseruse.backend.agent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive use of the shared browsing context, obtained from {@link BrowserGate}.
 * Closing releases it exactly once.
 */
public final class BrowserLease implements AutoCloseable {

    private final Semaphore permit;
    private final BrowsingContext context;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean deferred;

    BrowserLease(Semaphore permit, BrowsingContext context) {
        this.permit = permit;
        this.context = context;
    }

    public BrowsingContext context() {
        return context;
    }

    /**
     * Keeps the context locked until {@code work} finishes, even after the holder closes
     * the lease. Used when a caller gives up on an agent call that is still driving the browser.
     */
    public void releaseWhenDone(CompletableFuture<?> work) {
        deferred = true;
        work.whenComplete((result, error) -> release());
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!deferred) {
            release();
        }
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            permit.release();
        }
    }
}
