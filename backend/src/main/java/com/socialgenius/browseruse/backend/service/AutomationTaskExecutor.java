package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.agent.AgentInvoker;
import com.socialgenius.browseruse.backend.agent.AgentRequest;
import com.socialgenius.browseruse.backend.agent.AgentResult;
import com.socialgenius.browseruse.backend.agent.BrowserGate;
import com.socialgenius.browseruse.backend.agent.BrowserLease;
import com.socialgenius.browseruse.backend.agent.BrowsingContext;
import com.socialgenius.browseruse.backend.config.AutomationProperties;
import com.socialgenius.browseruse.backend.model.AuthErrorCode;
import com.socialgenius.browseruse.backend.model.AutomationTask;
import com.socialgenius.browseruse.backend.model.BrowserSession;
import com.socialgenius.browseruse.backend.model.TaskResult;
import com.socialgenius.browseruse.backend.model.TaskStatus;
import com.socialgenius.browseruse.backend.service.HeartbeatScheduler.Heartbeat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Runs one login job to its terminal state.
 * <p>
 * The job holds the shared browser for its whole run. Everything done with the browser,
 * from session restore to the final screenshots, counts against the job's deadline. The
 * final report is classified and, on success, the resulting session is stored.
 * Exactly one terminal write reaches the {@link TaskStore}; nothing is thrown to the caller.
 */
@Service
public class AutomationTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(AutomationTaskExecutor.class);

    private static final int DETAILS_LIMIT = 500;
    static final String TIMEOUT_MESSAGE = "Authentication task timed out";

    private final TaskStore taskStore;
    private final SessionStore sessionStore;
    private final OutcomeClassifier classifier;
    private final AgentInvoker agentInvoker;
    private final BrowserGate browserGate;
    private final HeartbeatScheduler heartbeats;
    private final ScreenshotStorageService screenshots;
    private final LoginInstructionFactory instructions;
    private final AutomationProperties properties;
    private final Clock clock;

    public AutomationTaskExecutor(TaskStore taskStore,
            SessionStore sessionStore,
            OutcomeClassifier classifier,
            AgentInvoker agentInvoker,
            BrowserGate browserGate,
            HeartbeatScheduler heartbeats,
            ScreenshotStorageService screenshots,
            LoginInstructionFactory instructions,
            AutomationProperties properties,
            Clock clock) {
        this.taskStore = taskStore;
        this.sessionStore = sessionStore;
        this.classifier = classifier;
        this.agentInvoker = agentInvoker;
        this.browserGate = browserGate;
        this.heartbeats = heartbeats;
        this.screenshots = screenshots;
        this.instructions = instructions;
        this.properties = properties;
        this.clock = clock;
    }

    public void execute(LoginJob job) {
        String traceId = newTraceId();
        ProgressTracker tracker = new ProgressTracker(traceId, clock, classifier.rules().successPhrases());

        Optional<AutomationTask> current = taskStore.find(job.taskId());
        if (current.isEmpty() || current.get().isTerminal()) {
            log.info("[TRACE:{}] Task {} is no longer pending, skipping run", traceId, job.taskId());
            return;
        }

        log.info("[TRACE:{}] Starting Google authentication for business {}, task {}",
                traceId, job.businessId(), job.taskId());
        log.info("[TRACE:{}] Authentication parameters: URL={}, timeout={}ms, options={}",
                traceId, job.url(), job.timeout().toMillis(), job.options());

        try {
            runLogin(job, tracker);
        } catch (TimeoutException e) {
            log.warn("[TRACE:{}] Authentication task {} timed out after {} seconds",
                    traceId, job.taskId(), job.timeout().toSeconds());
            finish(job, TaskStatus.FAILED, TaskResult.failure(AuthErrorCode.TIMEOUT, TIMEOUT_MESSAGE),
                    TIMEOUT_MESSAGE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failWithError(job, traceId, e);
        } catch (Exception e) {
            failWithError(job, traceId, e);
        }
    }

    private void runLogin(LoginJob job, ProgressTracker tracker) throws TimeoutException, InterruptedException {
        String traceId = tracker.getTraceId();
        long deadline = System.nanoTime() + job.timeout().toNanos();
        String instruction = instructions.build(job);

        try (BrowserLease lease = browserGate.acquire(job.timeout())) {
            BrowsingContext context = lease.context();

            agentInvoker.runWithin(lease, traceId, "Browser preparation", () -> {
                if (job.options().reuseSession()) {
                    restoreSession(job, context, tracker);
                }
                return capture(context, job, "initial", tracker);
            }, remaining(deadline));

            if (!agentInvoker.supportsMessageStreaming()) {
                log.warn("[TRACE:{}] Agent doesn't support message callbacks - progress tracking limited", traceId);
            }

            log.info("[TRACE:{}] Starting authentication task with timeout of {} seconds",
                    traceId, job.timeout().toSeconds());
            long started = System.nanoTime();
            AgentResult result;
            try (Heartbeat heartbeat = heartbeats.start(traceId, properties.getTasks().getHeartbeatInterval())) {
                result = agentInvoker.invoke(lease, new AgentRequest(instruction, traceId), tracker,
                        remaining(deadline));
            } catch (TimeoutException e) {
                tracker.recordExecutionError(TIMEOUT_MESSAGE);
                throw e;
            } catch (RuntimeException e) {
                log.error("[TRACE:{}] Authentication task execution error: {}", traceId, e.getMessage());
                tracker.recordExecutionError(e.getMessage());
                captureErrorState(lease, job, tracker, deadline);
                throw e;
            }
            log.info("[TRACE:{}] Authentication task completed in {} ms", traceId,
                    Duration.ofNanos(System.nanoTime() - started).toMillis());

            AgentResult report = result;
            Verdict verdict = agentInvoker.runWithin(lease, traceId, "Result capture",
                    () -> judge(job, context, tracker, report), remaining(deadline));
            finish(job, verdict.status(), verdict.result(), null);
        }
    }

    private Verdict judge(LoginJob job, BrowsingContext context, ProgressTracker tracker, AgentResult result) {
        String traceId = tracker.getTraceId();
        capture(context, job, "completed", tracker);
        String finalResult = result.finalResultOrEmpty();
        log.info("[TRACE:{}] Authentication task {} completed with result: {} chars",
                traceId, job.taskId(), finalResult.length());

        Optional<String> finalScreenshot = capture(context, job, "final_state", tracker);
        screenshots.capturePageHtml(context, job.businessId(), job.taskId());
        String screenshotsDir = screenshots.taskDirectory(job.businessId(), job.taskId()).toString();

        Outcome outcome = classifier.classify(finalResult);
        ProgressTrace trace = tracker.snapshot();
        if (outcome.success()) {
            log.info("[TRACE:{}] Authentication successful for task {}, business {}",
                    traceId, job.taskId(), job.businessId());
            SessionCapture capture = persistSession(job, context, traceId);
            return new Verdict(TaskStatus.COMPLETED, TaskResult.builder()
                    .success(true)
                    .message(outcome.message())
                    .screenshot(finalScreenshot.orElse(null))
                    .screenshotsDir(screenshotsDir)
                    .sessionSaved(capture.saved())
                    .cookiesCount(capture.cookiesCount())
                    .progressPercent(trace.progressPercent())
                    .stepsCompleted(trace.stepsCompleted().size())
                    .build());
        }
        log.info("[TRACE:{}] Authentication task {} failed with code {}",
                traceId, job.taskId(), outcome.code());
        return new Verdict(TaskStatus.COMPLETED, TaskResult.builder()
                .success(false)
                .error(outcome.message())
                .errorCode(outcome.code())
                .message(outcome.message())
                .screenshot(finalScreenshot.orElse(null))
                .screenshotsDir(screenshotsDir)
                .details(finalResult.substring(0, Math.min(DETAILS_LIMIT, finalResult.length())))
                .progressPercent(trace.progressPercent())
                .stepsCompleted(trace.stepsCompleted().size())
                .build());
    }

    private void captureErrorState(BrowserLease lease, LoginJob job, ProgressTracker tracker, long deadline)
            throws InterruptedException {
        try {
            agentInvoker.runWithin(lease, tracker.getTraceId(), "Error screenshot",
                    () -> capture(lease.context(), job, "error_state", tracker), remaining(deadline));
        } catch (TimeoutException e) {
            log.warn("[TRACE:{}] No error screenshot taken: {}", tracker.getTraceId(), e.getMessage());
        }
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(deadlineNanos - System.nanoTime());
    }

    private void restoreSession(LoginJob job, BrowsingContext context, ProgressTracker tracker) {
        Optional<BrowserSession> stored = sessionStore.load(job.businessId());
        if (stored.isEmpty()) {
            return;
        }
        if (sessionStore.isExpired(stored.get())) {
            log.info("[TRACE:{}] Stored session for business {} is expired, logging in from scratch",
                    tracker.getTraceId(), job.businessId());
            return;
        }
        if (sessionStore.apply(stored.get(), context)) {
            tracker.markPoint("session_restored");
        }
    }

    private SessionCapture persistSession(LoginJob job, BrowsingContext context, String traceId) {
        if (!job.options().persistSession()) {
            log.info("[TRACE:{}] Session persistence disabled for business {}", traceId, job.businessId());
            return new SessionCapture(false, 0);
        }
        try {
            BrowserSession session = sessionStore.extract(job.businessId(), context);
            boolean saved = session.hasCookies() && sessionStore.save(session);
            log.info("[TRACE:{}] Session {} for business {} with {} cookies", traceId,
                    saved ? "saved successfully" : "not saved", job.businessId(), session.cookieCount());
            return new SessionCapture(saved, session.cookieCount());
        } catch (RuntimeException e) {
            log.error("[TRACE:{}] Error saving session for business {}: {}", traceId, job.businessId(),
                    e.getMessage());
            return new SessionCapture(false, 0);
        }
    }

    private Optional<String> capture(BrowsingContext context, LoginJob job, String point, ProgressTracker tracker) {
        tracker.markPoint(point);
        return screenshots.captureScreenshot(context, job.businessId(), job.taskId(), point);
    }

    private void failWithError(LoginJob job, String traceId, Exception e) {
        String errorMessage = String.valueOf(e.getMessage());
        log.error("[TRACE:{}] Authentication task {} failed with exception: {}", traceId, job.taskId(),
                errorMessage, e);
        finish(job, TaskStatus.FAILED,
                TaskResult.failure(AuthErrorCode.AUTH_ERROR, "Authentication task failed: " + errorMessage),
                "Error during authentication: " + errorMessage);
    }

    private void finish(LoginJob job, TaskStatus status, TaskResult result, String message) {
        try {
            if (!taskStore.complete(job.taskId(), status, result, message)) {
                log.info("[TASK] Discarded late result for task {}", job.taskId());
            }
        } catch (RuntimeException e) {
            // The task was swept or never registered; there is nobody left to report to
            log.warn("[TASK] Could not record result for task {}: {}", job.taskId(), e.getMessage());
        }
    }

    static String newTraceId() {
        return "auth-" + System.currentTimeMillis() / 1000 + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private record SessionCapture(boolean saved, int cookiesCount) {
    }

    private record Verdict(TaskStatus status, TaskResult result) {
    }
}
