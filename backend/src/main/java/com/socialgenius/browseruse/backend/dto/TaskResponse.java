package com.socialgenius.browseruse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.socialgenius.browseruse.backend.model.TaskStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Accepted task")
public class TaskResponse {

    @JsonProperty("task_id")
    private String taskId;

    private TaskStatus status;
}
