package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.config.AutomationProperties;
import com.socialgenius.browseruse.backend.exception.TaskNotFoundException;
import com.socialgenius.browseruse.backend.model.AuthErrorCode;
import com.socialgenius.browseruse.backend.model.AutomationTask;
import com.socialgenius.browseruse.backend.model.TaskResult;
import com.socialgenius.browseruse.backend.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory registry of automation tasks.
 * <p>
 * A task is written twice at most: once on creation and once on its terminal transition.
 * Every transition goes through {@link ConcurrentHashMap#computeIfPresent}, so a late or
 * duplicate completion can never overwrite a task that is already terminal.
 */
@Component
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    static final String TERMINATED_MESSAGE = "Task terminated by user";

    private final Map<String, AutomationTask> tasks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    @Autowired
    public TaskStore(Clock clock, AutomationProperties properties) {
        this(clock, properties.getTasks().getRetention());
    }

    TaskStore(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * Registers a new pending task.
     */
    public AutomationTask create(String accountKey) {
        AutomationTask task = AutomationTask.builder()
                .id(UUID.randomUUID().toString())
                .accountKey(accountKey)
                .status(TaskStatus.PENDING)
                .createdAt(clock.instant())
                .build();
        tasks.put(task.getId(), task);
        return task;
    }

    public Optional<AutomationTask> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public AutomationTask get(String taskId) {
        return find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Moves a pending task into a terminal state.
     *
     * @return true if this call performed the transition, false if the task was already
     *         terminal and nothing changed
     * @throws TaskNotFoundException if the task does not exist
     */
    public boolean complete(String taskId, TaskStatus status, TaskResult result, String message) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        AtomicBoolean applied = new AtomicBoolean();
        AutomationTask updated = tasks.computeIfPresent(taskId, (id, current) -> {
            if (current.isTerminal()) {
                return current;
            }
            applied.set(true);
            return current.toBuilder()
                    .status(status)
                    .completedAt(clock.instant())
                    .result(result)
                    .message(message)
                    .build();
        });
        if (updated == null) {
            throw new TaskNotFoundException(taskId);
        }
        if (!applied.get()) {
            log.warn("[TASK] Ignoring {} write for task {}: already {}", status.getValue(), taskId,
                    updated.getStatus().getValue());
        }
        return applied.get();
    }

    /**
     * Marks a pending task as failed with {@link AuthErrorCode#TERMINATED}. Work already
     * running for the task is not interrupted; its eventual result is discarded.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public Termination terminate(String taskId) {
        TaskResult result = TaskResult.failure(AuthErrorCode.TERMINATED, TERMINATED_MESSAGE);
        boolean terminated = complete(taskId, TaskStatus.FAILED, result, TERMINATED_MESSAGE);
        if (terminated) {
            log.info("[TASK] Task {} terminated by user request", taskId);
        }
        return new Termination(terminated, get(taskId));
    }

    /**
     * Drops terminal tasks that finished more than the retention window ago.
     *
     * @return number of tasks removed
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (AutomationTask task : tasks.values()) {
            if (task.isTerminal() && task.getCompletedAt() != null && task.getCompletedAt().isBefore(cutoff)
                    && tasks.remove(task.getId(), task)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[TASK] Swept {} finished tasks", removed);
        }
        return removed;
    }

    public int size() {
        return tasks.size();
    }

    public long pendingCount() {
        return tasks.values().stream().filter(task -> !task.isTerminal()).count();
    }

    /**
     * Outcome of a terminate request.
     *
     * @param terminated whether this request performed the transition
     * @param task       the task as it is now
     */
    public record Termination(boolean terminated, AutomationTask task) {
    }
}
