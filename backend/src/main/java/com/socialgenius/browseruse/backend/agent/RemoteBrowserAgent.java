package com.socialgenius.browseruse.backend.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialgenius.browseruse.backend.config.AutomationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * {@link BrowserAgent} backed by the browser-use sidecar.
 * <p>
 * {@code POST /agent/run} answers with newline-delimited JSON: zero or more
 * {@code {"type":"message","text":...}} lines while the agent works, then a single
 * {@code {"type":"result","final_result":...,"done":...}} or {@code {"type":"error","message":...}}.
 */
@Component
public class RemoteBrowserAgent implements BrowserAgent {

    private static final Logger log = LoggerFactory.getLogger(RemoteBrowserAgent.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String agentUrl;

    @Autowired
    public RemoteBrowserAgent(HttpClient agentHttpClient, ObjectMapper objectMapper,
            AutomationProperties properties) {
        this(agentHttpClient, objectMapper, properties.getAgent().getUrl());
    }

    RemoteBrowserAgent(HttpClient httpClient, ObjectMapper objectMapper, String agentUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.agentUrl = agentUrl;
    }

    @Override
    public AgentResult run(AgentRequest request, BrowsingContext context, AgentMessageListener listener) {
        String fullUrl = agentUrl + "/agent/run";
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("task", request.instruction());
        body.put("context_id", context.id());
        body.put("trace_id", request.traceId());

        HttpResponse<Stream<String>> response;
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(fullUrl))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/x-ndjson")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            log.info("[AGENT HTTP] Starting agent run at {} (trace {})", fullUrl, request.traceId());
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new AgentRunException("Failed to reach agent at " + fullUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentRunException("Interrupted while starting agent run", e);
        }

        try (Stream<String> lines = response.body()) {
            if (response.statusCode() != 200) {
                throw new AgentRunException("Agent returned status " + response.statusCode());
            }
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                if (line.isBlank()) {
                    continue;
                }
                JsonNode event = objectMapper.readTree(line);
                String type = event.path("type").asText();
                switch (type) {
                    case "message" -> listener.onMessage(event.path("text").asText(""));
                    case "result" -> {
                        JsonNode finalResult = event.get("final_result");
                        return new AgentResult(
                                finalResult == null || finalResult.isNull() ? null : finalResult.asText(),
                                event.path("done").asBoolean(true));
                    }
                    case "error" -> throw new AgentRunException(event.path("message").asText("Agent run failed"));
                    default -> log.debug("[AGENT HTTP] Ignoring event of type '{}'", type);
                }
            }
        } catch (IOException e) {
            throw new AgentRunException("Malformed agent output: " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new AgentRunException("Agent stream broke: " + e.getMessage(), e);
        }
        throw new AgentRunException("Agent stream ended without a result");
    }

    @Override
    public boolean supportsMessageStreaming() {
        return true;
    }
}
