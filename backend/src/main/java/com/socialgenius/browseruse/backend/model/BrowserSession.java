package com.socialgenius.browseruse.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stored authentication state of one account: cookies plus web storage.
 * One document per account; a save replaces the previous one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "browser_sessions")
public class BrowserSession {

    @Id
    private String accountKey;

    @Builder.Default
    private List<BrowserCookie> cookies = new ArrayList<>();

    @Builder.Default
    private Map<String, String> localStorage = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> sessionStorage = new LinkedHashMap<>();

    private Instant lastUpdated;

    // e.g. associated_session_id
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    /**
     * A session without cookies cannot restore a login and is treated as absent.
     */
    public boolean hasCookies() {
        return cookies != null && !cookies.isEmpty();
    }

    public int cookieCount() {
        return cookies == null ? 0 : cookies.size();
    }

    public int storageItemCount() {
        return (localStorage == null ? 0 : localStorage.size())
                + (sessionStorage == null ? 0 : sessionStorage.size());
    }
}
