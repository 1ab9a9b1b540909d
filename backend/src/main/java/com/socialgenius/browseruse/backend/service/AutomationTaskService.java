package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.config.AutomationProperties;
import com.socialgenius.browseruse.backend.dto.GoogleAuthRequest;
import com.socialgenius.browseruse.backend.model.AuthErrorCode;
import com.socialgenius.browseruse.backend.model.AutomationTask;
import com.socialgenius.browseruse.backend.model.TaskResult;
import com.socialgenius.browseruse.backend.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for login tasks: registers them, hands them to the background pool and
 * answers status and terminate requests.
 */
@Service
public class AutomationTaskService {

    private static final Logger log = LoggerFactory.getLogger(AutomationTaskService.class);

    private final TaskStore taskStore;
    private final AutomationTaskExecutor taskExecutor;
    private final TaskExecutor jobExecutor;
    private final AutomationProperties properties;

    public AutomationTaskService(TaskStore taskStore,
            AutomationTaskExecutor taskExecutor,
            @Qualifier("jobExecutor") TaskExecutor jobExecutor,
            AutomationProperties properties) {
        this.taskStore = taskStore;
        this.taskExecutor = taskExecutor;
        this.jobExecutor = jobExecutor;
        this.properties = properties;
    }

    /**
     * Registers a pending task and schedules its run. Returns as soon as the task is
     * registered; the login itself happens on the job pool.
     */
    public AutomationTask submitGoogleAuth(GoogleAuthRequest request) {
        AutomationTask task = taskStore.create(request.getBusinessId());
        LoginJob job = new LoginJob(
                task.getId(),
                request.getBusinessId(),
                request.getEmail(),
                request.getPassword(),
                request.getUrl() == null || request.getUrl().isBlank() ? GoogleAuthRequest.DEFAULT_URL
                        : request.getUrl(),
                request.getTimeout() == null ? properties.getTasks().getDefaultTimeout()
                        : Duration.ofMillis(request.getTimeout()),
                LoginOptions.from(request.getAdvancedOptions(), request.isReuseSession()));

        log.info("[TASK] Created Google auth task {} for business {}", task.getId(), request.getBusinessId());
        try {
            jobExecutor.execute(() -> taskExecutor.execute(job));
        } catch (RejectedExecutionException e) {
            log.error("[TASK] Could not schedule task {}: {}", task.getId(), e.getMessage());
            taskStore.complete(task.getId(), TaskStatus.FAILED,
                    TaskResult.failure(AuthErrorCode.AUTH_ERROR, "Authentication task failed: " + e.getMessage()),
                    "Error during authentication: " + e.getMessage());
        }
        return task;
    }

    /**
     * @throws com.socialgenius.browseruse.backend.exception.TaskNotFoundException if unknown or already swept
     */
    public AutomationTask getTask(String taskId) {
        taskStore.sweep();
        return taskStore.get(taskId);
    }

    public TaskStore.Termination terminate(String taskId) {
        return taskStore.terminate(taskId);
    }

    @Scheduled(fixedDelayString = "${automation.tasks.sweep-interval:PT5M}")
    public void sweepFinishedTasks() {
        int removed = taskStore.sweep();
        if (removed > 0) {
            log.info("[TASK] Removed {} finished tasks past retention", removed);
        }
    }
}
