package com.socialgenius.browseruse.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Stored session summary for a business")
public class SessionStatusResponse {

    @JsonProperty("has_session")
    private boolean hasSession;

    @JsonProperty("cookies_count")
    private Integer cookiesCount;

    @JsonProperty("last_updated")
    private Instant lastUpdated;

    @JsonProperty("is_expired")
    private Boolean expired;

    private String message;

    private String error;
}
