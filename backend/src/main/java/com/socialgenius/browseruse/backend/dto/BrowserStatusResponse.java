package com.socialgenius.browseruse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "State of the shared browser")
public class BrowserStatusResponse {

    @Schema(description = "active when idle, busy while a job holds the browser")
    private String status;

    @JsonProperty("active_sessions_count")
    private int activeSessionsCount;

    @JsonProperty("queued_jobs")
    private int queuedJobs;

    @JsonProperty("pending_tasks")
    private long pendingTasks;

    @JsonProperty("streaming_supported")
    private boolean streamingSupported;
}
