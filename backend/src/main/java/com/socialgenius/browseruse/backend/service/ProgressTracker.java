package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.agent.AgentMessageListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects progress signals streamed by the agent during a single job.
 * <p>
 * Purely advisory: it never decides how a job ends. The tracker receives messages on the
 * agent's thread while the job thread reads snapshots, so all state is thread-safe.
 */
public class ProgressTracker implements AgentMessageListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private static final String PROGRESS_MARKER = "PROGRESS:";
    private static final Pattern STEP_PATTERN = Pattern.compile("Step (\\d+) completed");
    private static final List<String> ERROR_PHRASES =
            List.of("error", "failed", "couldn't", "unable to", "not found");
    private static final int PERCENT_PER_STEP = 8;
    private static final int MAX_PERCENT = 90;

    private final String traceId;
    private final Clock clock;
    private final List<String> successPhrases;

    private final Map<String, Instant> pointsReached = new LinkedHashMap<>();
    private final List<ProgressTrace.Step> steps = new CopyOnWriteArrayList<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private volatile Integer progressPercent;
    private volatile boolean successDetected;
    private volatile String successMessage;
    private volatile String executionError;

    public ProgressTracker(String traceId, Clock clock, List<String> successPhrases) {
        this.traceId = traceId;
        this.clock = clock;
        this.successPhrases = successPhrases;
    }

    @Override
    public void onMessage(String message) {
        if (message == null || message.isEmpty()) {
            return;
        }
        try {
            int markerAt = message.indexOf(PROGRESS_MARKER);
            if (markerAt >= 0) {
                recordProgress(firstLine(message.substring(markerAt + PROGRESS_MARKER.length()).trim()));
            }

            String lower = message.toLowerCase(Locale.ROOT);
            if (ERROR_PHRASES.stream().anyMatch(lower::contains)) {
                String errorLine = firstLine(message);
                warnings.add(errorLine);
                log.warn("[TRACE:{}] Possible error in agent output: {}", traceId, errorLine);
            }

            if (successPhrases.stream().anyMatch(lower::contains)) {
                successDetected = true;
                successMessage = firstLine(message);
                log.info("[TRACE:{}] Success indicator detected in agent output", traceId);
            }
        } catch (RuntimeException e) {
            // A malformed message must not disturb the agent thread that delivered it
            log.error("[TRACE:{}] Error in progress tracking callback: {}", traceId, e.getMessage());
        }
    }

    /**
     * Records that the flow reached a named checkpoint, e.g. a screenshot point.
     */
    public void markPoint(String pointName) {
        Instant now = clock.instant();
        synchronized (pointsReached) {
            pointsReached.put(pointName, now);
        }
    }

    public void recordExecutionError(String error) {
        this.executionError = error;
    }

    public ProgressTrace snapshot() {
        Map<String, Instant> points;
        synchronized (pointsReached) {
            points = Map.copyOf(pointsReached);
        }
        return new ProgressTrace(points, List.copyOf(steps), progressPercent, List.copyOf(warnings),
                successDetected, successMessage, executionError);
    }

    public String getTraceId() {
        return traceId;
    }

    private void recordProgress(String progressLine) {
        log.info("[TRACE:{}] Progress update: {}", traceId, progressLine);
        steps.add(new ProgressTrace.Step(clock.instant(), progressLine));

        Matcher matcher = STEP_PATTERN.matcher(progressLine);
        if (matcher.find()) {
            try {
                int step = Integer.parseInt(matcher.group(1));
                progressPercent = Math.min(MAX_PERCENT, Math.min(step, MAX_PERCENT) * PERCENT_PER_STEP);
                log.info("[TRACE:{}] Progress: {}%", traceId, progressPercent);
            } catch (NumberFormatException e) {
                log.debug("[TRACE:{}] Step number out of range in '{}'", traceId, progressLine);
            }
        }
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }
}
