package com.socialgenius.browseruse.backend.agent;

import com.socialgenius.browseruse.backend.model.BrowserCookie;

import java.util.List;
import java.util.Map;

/**
 * The browser state an agent operates on. Every operation may fail with
 * {@link BrowserOperationException}.
 */
public interface BrowsingContext {

    String id();

    List<BrowserCookie> cookies();

    void addCookie(BrowserCookie cookie);

    Map<String, String> localStorage();

    Map<String, String> sessionStorage();

    void setLocalStorageItem(String key, String value);

    void setSessionStorageItem(String key, String value);

    /**
     * PNG screenshot of the current page.
     */
    byte[] screenshot();

    String pageContent();

    String currentUrl();
}
