package com.socialgenius.browseruse.backend.controller;

import com.socialgenius.browseruse.backend.dto.ScreenshotListing;
import com.socialgenius.browseruse.backend.exception.ArtifactNotFoundException;
import com.socialgenius.browseruse.backend.service.ScreenshotStorageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;

@RestController
@RequestMapping("/v1/screenshot")
@Tag(name = "Screenshots", description = "Artifacts captured during tasks")
public class ScreenshotController {

    private final ScreenshotStorageService screenshotStorageService;

    public ScreenshotController(ScreenshotStorageService screenshotStorageService) {
        this.screenshotStorageService = screenshotStorageService;
    }

    @GetMapping("/{businessId}/{taskId}")
    @Operation(summary = "List screenshots", description = "List the screenshots and HTML captures of a task")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Listing returned"),
            @ApiResponse(responseCode = "404", description = "No screenshots for this task")
    })
    public ResponseEntity<ScreenshotListing> listScreenshots(
            @Parameter(description = "Business ID") @PathVariable String businessId,
            @Parameter(description = "Task ID") @PathVariable String taskId) {

        return screenshotStorageService.list(businessId, taskId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ArtifactNotFoundException("No screenshots found for this task"));
    }

    @GetMapping("/{businessId}/{taskId}/{fileName}")
    @Operation(summary = "Download screenshot", description = "Download one captured file of a task")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "File returned"),
            @ApiResponse(responseCode = "404", description = "Screenshot not found")
    })
    public ResponseEntity<Resource> getScreenshot(
            @Parameter(description = "Business ID") @PathVariable String businessId,
            @Parameter(description = "Task ID") @PathVariable String taskId,
            @Parameter(description = "File name") @PathVariable String fileName) {

        Path file = screenshotStorageService.find(businessId, taskId, fileName)
                .orElseThrow(() -> new ArtifactNotFoundException("Screenshot not found"));
        MediaType mediaType = fileName.endsWith(".html") ? MediaType.TEXT_HTML : MediaType.IMAGE_PNG;
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + taskId + "_" + fileName + "\"")
                .contentType(mediaType)
                .body(new FileSystemResource(file));
    }
}
