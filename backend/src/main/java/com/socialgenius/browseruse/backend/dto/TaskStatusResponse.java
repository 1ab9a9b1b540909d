package com.socialgenius.browseruse.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.socialgenius.browseruse.backend.model.AutomationTask;
import com.socialgenius.browseruse.backend.model.TaskResult;
import com.socialgenius.browseruse.backend.model.TaskStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Poll response for a single task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Task status response")
public class TaskStatusResponse {

    @JsonProperty("task_id")
    private String taskId;

    private TaskStatus status;

    @Schema(description = "Structured outcome, present once the task is terminal")
    private TaskResult result;

    private String message;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    public static TaskStatusResponse from(AutomationTask task) {
        return TaskStatusResponse.builder()
                .taskId(task.getId())
                .status(task.getStatus())
                .result(task.getResult())
                .message(task.getMessage())
                .createdAt(task.getCreatedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }
}
