package com.socialgenius.browseruse.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request to log a business account into Google.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to start a Google login task")
public class GoogleAuthRequest {

    public static final String DEFAULT_URL = "https://accounts.google.com/ServiceLogin";

    @NotBlank
    @Schema(description = "Google account email", example = "owner@example.com")
    private String email;

    @NotBlank
    @ToString.Exclude
    @Schema(description = "Google account password")
    private String password;

    @Builder.Default
    @Schema(description = "Login page to start from", example = DEFAULT_URL)
    private String url = DEFAULT_URL;

    @NotBlank
    @Schema(description = "Business the stored session belongs to", example = "biz-42")
    private String businessId;

    @Positive
    @Schema(description = "Task deadline in milliseconds, automation.tasks.default-timeout when omitted",
            example = "90000")
    private Long timeout;

    @JsonProperty("advanced_options")
    @Builder.Default
    @Schema(description = "reuse_session, persist_session, human_delay_min, human_delay_max, max_captcha_attempts")
    private Map<String, Object> advancedOptions = new LinkedHashMap<>();

    @Builder.Default
    @Schema(description = "Restore a stored session before logging in")
    private boolean reuseSession = true;
}
