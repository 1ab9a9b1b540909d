package com.socialgenius.browseruse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Artifacts captured for one task")
public class ScreenshotListing {

    @JsonProperty("business_id")
    private String businessId;

    @JsonProperty("task_id")
    private String taskId;

    @Schema(description = "PNG file names")
    private List<String> screenshots;

    @JsonProperty("html_files")
    @Schema(description = "Captured page HTML file names")
    private List<String> htmlFiles;

    private String directory;
}
