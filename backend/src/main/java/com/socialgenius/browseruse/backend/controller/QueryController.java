package com.socialgenius.browseruse.backend.controller;

import com.socialgenius.browseruse.backend.agent.AgentInvoker;
import com.socialgenius.browseruse.backend.agent.BrowserGate;
import com.socialgenius.browseruse.backend.dto.BrowserStatusResponse;
import com.socialgenius.browseruse.backend.dto.QueryRequest;
import com.socialgenius.browseruse.backend.dto.QueryResponse;
import com.socialgenius.browseruse.backend.service.QueryService;
import com.socialgenius.browseruse.backend.service.SessionStore;
import com.socialgenius.browseruse.backend.service.TaskStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/v1")
@Tag(name = "Browser", description = "Direct agent queries and browser state")
public class QueryController {

    private final QueryService queryService;
    private final BrowserGate browserGate;
    private final SessionStore sessionStore;
    private final TaskStore taskStore;
    private final AgentInvoker agentInvoker;

    public QueryController(QueryService queryService, BrowserGate browserGate, SessionStore sessionStore,
            TaskStore taskStore, AgentInvoker agentInvoker) {
        this.queryService = queryService;
        this.browserGate = browserGate;
        this.sessionStore = sessionStore;
        this.taskStore = taskStore;
        this.agentInvoker = agentInvoker;
    }

    @PostMapping("/query")
    @Operation(summary = "Run query", description = "Run a free-form instruction on the shared browser and wait for the result")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Agent finished"),
            @ApiResponse(responseCode = "400", description = "Task cannot be empty"),
            @ApiResponse(responseCode = "504", description = "Agent did not finish in time")
    })
    public ResponseEntity<QueryResponse> query(@RequestBody QueryRequest request)
            throws TimeoutException, InterruptedException {

        return ResponseEntity.ok(new QueryResponse(queryService.query(request.getTask())));
    }

    @GetMapping("/browser/status")
    @Operation(summary = "Browser status", description = "Whether the shared browser is idle and how much work is queued")
    public ResponseEntity<BrowserStatusResponse> browserStatus() {
        return ResponseEntity.ok(BrowserStatusResponse.builder()
                .status(browserGate.isBusy() ? "busy" : "active")
                .activeSessionsCount(sessionStore.cachedCount())
                .queuedJobs(browserGate.queuedCount())
                .pendingTasks(taskStore.pendingCount())
                .streamingSupported(agentInvoker.supportsMessageStreaming())
                .build());
    }
}
