package com.socialgenius.browseruse.backend.service;

import java.time.Duration;

/**
 * Everything a background login run needs.
 */
public record LoginJob(String taskId, String businessId, String email, String password, String url,
        Duration timeout, LoginOptions options) {

    @Override
    public String toString() {
        return "LoginJob[taskId=" + taskId + ", businessId=" + businessId + ", url=" + url
                + ", timeout=" + timeout + ", options=" + options + "]";
    }
}
