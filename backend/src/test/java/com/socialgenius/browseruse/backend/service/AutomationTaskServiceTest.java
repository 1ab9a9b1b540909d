package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.config.AutomationProperties;
import com.socialgenius.browseruse.backend.dto.GoogleAuthRequest;
import com.socialgenius.browseruse.backend.exception.TaskNotFoundException;
import com.socialgenius.browseruse.backend.model.AuthErrorCode;
import com.socialgenius.browseruse.backend.model.AutomationTask;
import com.socialgenius.browseruse.backend.model.TaskResult;
import com.socialgenius.browseruse.backend.model.TaskStatus;
import com.socialgenius.browseruse.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutomationTaskServiceTest {

    @Mock
    private AutomationTaskExecutor taskExecutor;

    private final List<Runnable> scheduled = new ArrayList<>();
    private final TaskExecutor queueingExecutor = scheduled::add;
    private MutableClock clock;
    private TaskStore taskStore;
    private AutomationTaskService service;
    private AutomationProperties properties;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        taskStore = new TaskStore(clock, Duration.ofHours(1));
        properties = new AutomationProperties();
        service = new AutomationTaskService(taskStore, taskExecutor, queueingExecutor, properties);
    }

    @Test
    void shouldRegisterTaskWithoutRunningIt() {
        // When
        AutomationTask task = service.submitGoogleAuth(request());

        // Then
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(1, scheduled.size());
        verifyNoInteractions(taskExecutor);
    }

    @Test
    void shouldBuildJobFromRequest() {
        // Given
        GoogleAuthRequest request = request();
        request.setReuseSession(false);
        request.setAdvancedOptions(Map.of("persist_session", false));
        request.setUrl(" ");
        AutomationTask task = service.submitGoogleAuth(request);

        // When
        scheduled.get(0).run();

        // Then
        ArgumentCaptor<LoginJob> job = ArgumentCaptor.forClass(LoginJob.class);
        verify(taskExecutor).execute(job.capture());
        assertEquals(task.getId(), job.getValue().taskId());
        assertEquals("biz-1", job.getValue().businessId());
        assertEquals(GoogleAuthRequest.DEFAULT_URL, job.getValue().url());
        assertEquals(Duration.ofSeconds(30), job.getValue().timeout());
        assertFalse(job.getValue().options().reuseSession());
        assertFalse(job.getValue().options().persistSession());
    }

    @Test
    void shouldUseConfiguredDefaultTimeoutWhenRequestHasNone() {
        // Given
        properties.getTasks().setDefaultTimeout(Duration.ofSeconds(45));
        GoogleAuthRequest request = request();
        request.setTimeout(null);
        service.submitGoogleAuth(request);

        // When
        scheduled.get(0).run();

        // Then
        ArgumentCaptor<LoginJob> job = ArgumentCaptor.forClass(LoginJob.class);
        verify(taskExecutor).execute(job.capture());
        assertEquals(Duration.ofSeconds(45), job.getValue().timeout());
    }

    @Test
    void shouldFailTaskWhenPoolRejectsIt() {
        AutomationTaskService saturated = new AutomationTaskService(taskStore, taskExecutor, runnable -> {
            throw new TaskRejectedException("queue full");
        }, properties);

        AutomationTask task = saturated.submitGoogleAuth(request());

        AutomationTask stored = taskStore.get(task.getId());
        assertEquals(TaskStatus.FAILED, stored.getStatus());
        assertEquals(AuthErrorCode.AUTH_ERROR, stored.getResult().getErrorCode());
    }

    @Test
    void shouldSweepBeforeReadingStatus() {
        // Given
        AutomationTask task = service.submitGoogleAuth(request());
        taskStore.complete(task.getId(), TaskStatus.COMPLETED, TaskResult.builder().success(true).build(), null);
        assertEquals(TaskStatus.COMPLETED, service.getTask(task.getId()).getStatus());

        // When
        clock.advance(Duration.ofMinutes(61));

        // Then
        assertThrows(TaskNotFoundException.class, () -> service.getTask(task.getId()));
    }

    @Test
    void shouldSweepOnSchedule() {
        AutomationTask task = service.submitGoogleAuth(request());
        taskStore.complete(task.getId(), TaskStatus.FAILED, TaskResult.failure(AuthErrorCode.TIMEOUT, "t"), "t");
        clock.advance(Duration.ofHours(2));

        service.sweepFinishedTasks();

        assertEquals(0, taskStore.size());
        verify(taskExecutor, never()).execute(any());
    }

    private static GoogleAuthRequest request() {
        return GoogleAuthRequest.builder()
                .email("owner@example.com")
                .password("s3cret")
                .businessId("biz-1")
                .timeout(30000L)
                .build();
    }
}
