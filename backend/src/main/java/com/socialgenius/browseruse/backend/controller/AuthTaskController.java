package com.socialgenius.browseruse.backend.controller;

import com.socialgenius.browseruse.backend.dto.GoogleAuthRequest;
import com.socialgenius.browseruse.backend.dto.MessageResponse;
import com.socialgenius.browseruse.backend.dto.TaskResponse;
import com.socialgenius.browseruse.backend.dto.TaskStatusResponse;
import com.socialgenius.browseruse.backend.model.AutomationTask;
import com.socialgenius.browseruse.backend.service.AutomationTaskService;
import com.socialgenius.browseruse.backend.service.TaskStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1")
@Tag(name = "Tasks", description = "Google login task management")
public class AuthTaskController {

    private final AutomationTaskService taskService;

    public AuthTaskController(AutomationTaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping("/google-auth")
    @Operation(summary = "Start Google login", description = "Queue a background Google login for a business account")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Task accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<TaskResponse> googleAuth(@Valid @RequestBody GoogleAuthRequest request) {
        AutomationTask task = taskService.submitGoogleAuth(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskResponse.builder()
                .taskId(task.getId())
                .status(task.getStatus())
                .build());
    }

    @GetMapping("/task/{taskId}")
    @Operation(summary = "Get task status", description = "Poll the status and result of a task")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task found"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    public ResponseEntity<TaskStatusResponse> getTask(
            @Parameter(description = "Task ID") @PathVariable String taskId) {

        return ResponseEntity.ok(TaskStatusResponse.from(taskService.getTask(taskId)));
    }

    @GetMapping("/terminate/{taskId}")
    @Operation(summary = "Terminate task", description = "Mark a pending task as terminated")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task terminated or already finished"),
            @ApiResponse(responseCode = "404", description = "Task not found")
    })
    public ResponseEntity<MessageResponse> terminate(
            @Parameter(description = "Task ID") @PathVariable String taskId) {

        TaskStore.Termination termination = taskService.terminate(taskId);
        if (termination.terminated()) {
            return ResponseEntity.ok(new MessageResponse("Task terminated"));
        }
        return ResponseEntity.ok(new MessageResponse(
                "Task is already " + termination.task().getStatus().getValue()));
    }
}
