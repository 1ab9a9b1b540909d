package com.socialgenius.browseruse.backend.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of what a {@link ProgressTracker} has observed for one job.
 */
public record ProgressTrace(
        Map<String, Instant> pointsReached,
        List<Step> stepsCompleted,
        Integer progressPercent,
        List<String> warnings,
        boolean successDetected,
        String successMessage,
        String executionError) {

    public record Step(Instant time, String message) {
    }
}
