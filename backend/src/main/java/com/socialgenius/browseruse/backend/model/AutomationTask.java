package com.socialgenius.browseruse.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One submitted automation job. Instances are immutable snapshots; the task store
 * swaps in a new snapshot on the single terminal transition.
 */
@Value
@Builder(toBuilder = true)
public class AutomationTask {

    String id;

    String accountKey;

    @Builder.Default
    TaskStatus status = TaskStatus.PENDING;

    Instant createdAt;

    Instant completedAt;

    TaskResult result;

    String message;

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
