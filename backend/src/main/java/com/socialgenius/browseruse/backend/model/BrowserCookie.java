package com.socialgenius.browseruse.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A browser cookie as exchanged with the browsing context.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrowserCookie {

    private String name;
    private String value;
    private String domain;
    private String path;

    // Seconds since the epoch, -1 for a session cookie
    private Double expires;

    private Boolean httpOnly;
    private Boolean secure;
    private String sameSite;
}
