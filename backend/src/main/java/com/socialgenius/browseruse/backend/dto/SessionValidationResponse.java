package com.socialgenius.browseruse.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of re-checking a stored session in the browser")
public class SessionValidationResponse {

    private boolean valid;

    private String message;

    @Schema(description = "Path of the screenshot taken during the check")
    private String screenshot;

    private String error;

    public static SessionValidationResponse invalid(String message) {
        return SessionValidationResponse.builder().valid(false).message(message).build();
    }
}
