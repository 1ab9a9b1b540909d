package com.socialgenius.browseruse.backend.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socialgenius.browseruse.backend.model.BrowserCookie;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link BrowsingContext} backed by the browser-use sidecar's {@code /browser/{id}/*} endpoints.
 * Every request is bounded by the configured request timeout.
 */
public class RemoteBrowsingContext implements BrowsingContext {

    private static final TypeReference<List<BrowserCookie>> COOKIE_LIST = new TypeReference<>() { };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String contextId;
    private final Duration requestTimeout;

    public RemoteBrowsingContext(HttpClient httpClient, ObjectMapper objectMapper, String agentUrl, String contextId,
            Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = agentUrl + "/browser/" + contextId;
        this.contextId = contextId;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String id() {
        return contextId;
    }

    @Override
    public List<BrowserCookie> cookies() {
        String body = sendForString(get("/cookies"));
        try {
            return objectMapper.readValue(body, COOKIE_LIST);
        } catch (JsonProcessingException e) {
            throw new BrowserOperationException("Unreadable cookie list: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void addCookie(BrowserCookie cookie) {
        sendForString(post("/cookies", List.of(cookie)));
    }

    @Override
    public Map<String, String> localStorage() {
        return evaluateToMap("Object.assign({}, localStorage)");
    }

    @Override
    public Map<String, String> sessionStorage() {
        return evaluateToMap("Object.assign({}, sessionStorage)");
    }

    @Override
    public void setLocalStorageItem(String key, String value) {
        evaluate("localStorage.setItem(" + jsString(key) + ", " + jsString(value) + ")");
    }

    @Override
    public void setSessionStorageItem(String key, String value) {
        evaluate("sessionStorage.setItem(" + jsString(key) + ", " + jsString(value) + ")");
    }

    @Override
    public byte[] screenshot() {
        HttpResponse<byte[]> response = send(get("/screenshot"), HttpResponse.BodyHandlers.ofByteArray());
        return response.body();
    }

    @Override
    public String pageContent() {
        return readPage().path("html").asText("");
    }

    @Override
    public String currentUrl() {
        return readPage().path("url").asText("");
    }

    private JsonNode readPage() {
        try {
            return objectMapper.readTree(sendForString(get("/content")));
        } catch (JsonProcessingException e) {
            throw new BrowserOperationException("Unreadable page content: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, String> evaluateToMap(String expression) {
        JsonNode value = evaluate(expression);
        Map<String, String> items = new LinkedHashMap<>();
        if (value != null && value.isObject()) {
            value.fields().forEachRemaining(entry -> items.put(entry.getKey(), entry.getValue().asText()));
        }
        return items;
    }

    private JsonNode evaluate(String expression) {
        try {
            return objectMapper.readTree(sendForString(post("/evaluate", Map.of("expression", expression))))
                    .get("value");
        } catch (JsonProcessingException e) {
            throw new BrowserOperationException("Unreadable evaluate response: " + e.getOriginalMessage(), e);
        }
    }

    private String jsString(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BrowserOperationException("Cannot encode storage value", e);
        }
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(requestTimeout).GET().build();
    }

    private HttpRequest post(String path, Object body) {
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new BrowserOperationException("Cannot encode request to " + path, e);
        }
    }

    private String sendForString(HttpRequest request) {
        return send(request, HttpResponse.BodyHandlers.ofString()).body();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            HttpResponse<T> response = httpClient.send(request, handler);
            if (response.statusCode() / 100 != 2) {
                throw new BrowserOperationException(
                        request.method() + " " + request.uri().getPath() + " returned status " + response.statusCode());
            }
            return response;
        } catch (HttpTimeoutException e) {
            throw new BrowserOperationException(request.method() + " " + request.uri().getPath()
                    + " timed out after " + requestTimeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new BrowserOperationException("Browser sidecar unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserOperationException("Interrupted during browser operation", e);
        }
    }
}
