package com.socialgenius.browseruse.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Structured outcome attached to a task when it reaches a terminal state.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResult {

    boolean success;

    String message;

    String error;

    @JsonProperty("error_code")
    AuthErrorCode errorCode;

    String screenshot;

    @JsonProperty("screenshots_dir")
    String screenshotsDir;

    @JsonProperty("session_saved")
    Boolean sessionSaved;

    @JsonProperty("cookies_count")
    Integer cookiesCount;

    // Leading part of the agent output, kept for diagnosing unrecognized failures
    String details;

    @JsonProperty("progress_percent")
    Integer progressPercent;

    @JsonProperty("steps_completed")
    Integer stepsCompleted;

    public static TaskResult failure(AuthErrorCode errorCode, String error) {
        return TaskResult.builder()
                .success(false)
                .error(error)
                .errorCode(errorCode)
                .build();
    }
}
