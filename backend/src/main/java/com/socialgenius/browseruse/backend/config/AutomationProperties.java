package com.socialgenius.browseruse.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the automation service, bound from the {@code automation.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "automation")
public class AutomationProperties {

    private Agent agent = new Agent();
    private Tasks tasks = new Tasks();
    private Sessions sessions = new Sessions();
    private Screenshots screenshots = new Screenshots();
    private Validation validation = new Validation();
    private Query query = new Query();
    private Cors cors = new Cors();

    @Data
    public static class Agent {
        /** Base URL of the browser-use sidecar. */
        private String url = "http://localhost:8765";
        private Duration connectTimeout = Duration.ofSeconds(10);
        /** Upper bound for a single cookie, storage, screenshot or content request. */
        private Duration requestTimeout = Duration.ofSeconds(30);
        /** Identifier of the shared browsing context on the sidecar. */
        private String contextId = "default";
    }

    @Data
    public static class Tasks {
        /** How long finished tasks stay visible to pollers. */
        private Duration retention = Duration.ofHours(1);
        private Duration defaultTimeout = Duration.ofSeconds(90);
        private int workerThreads = 4;
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Sessions {
        /** Age after which a stored session is reported as expired. */
        private Duration retention = Duration.ofDays(7);
    }

    @Data
    public static class Screenshots {
        private String dir = "screenshots";
    }

    @Data
    public static class Validation {
        private String url = "https://myaccount.google.com/";
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Query {
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }
}
