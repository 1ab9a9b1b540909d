package com.socialgenius.browseruse.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Free-form instruction for the browser agent")
public class QueryRequest {

    @Schema(description = "What the agent should do", example = "Find the opening hours of the Louvre")
    private String task;
}
