package com.vaultsearch.plugin;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultsearch.similarity.ScoredResult;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Client for the vault plugin's {@code POST /search/smart} endpoint.
 *
 * <p>{@link #search} returns {@code null} when the client is not configured,
 * on 401/403/404 and on any other non-2xx, non-5xx status. 5xx responses and
 * transport failures are retried up to {@code retries} more times with no
 * delay; when attempts run out a {@link PluginSearchException} is thrown.
 */
public class PluginSearchClient {
    private static final Logger log = LoggerFactory.getLogger(PluginSearchClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String SEARCH_PATH = "/search/smart";

    private final OkHttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final int retries;
    private final ObjectMapper mapper = new ObjectMapper();

    public PluginSearchClient(OkHttpClient httpClient, String baseUrl, String apiKey, Duration timeout, int retries) {
        this.httpClient = httpClient.newBuilder()
                .callTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.retries = Math.max(0, retries);
    }

    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    public List<ScoredResult> search(String query, int limit) throws PluginSearchException {
        if (!isConfigured()) {
            return null;
        }
        HttpUrl url = HttpUrl.parse(baseUrl.strip().replaceAll("/+$", "") + SEARCH_PATH);
        if (url == null) {
            log.warn("Plugin base URL is not a valid HTTP URL: {}", baseUrl);
            return null;
        }

        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(mapper.writeValueAsString(Map.of("query", query, "limit", limit)), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode plugin search payload", e);
        }

        int maxAttempts = retries + 1;
        PluginSearchException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                int status = response.code();
                if (status == 401 || status == 403 || status == 404) {
                    log.debug("Plugin search rejected with HTTP {}; treating as unavailable", status);
                    return null;
                }
                if (status >= 500 && status < 600) {
                    lastFailure = new PluginSearchException("Plugin search failed with HTTP " + status, status, attempt);
                    log.warn("Plugin search attempt {}/{} failed with HTTP {}", attempt, maxAttempts, status);
                    continue;
                }
                if (!response.isSuccessful()) {
                    log.debug("Plugin search returned HTTP {}; treating as unavailable", status);
                    return null;
                }
                ResponseBody body = response.body();
                return parseResults(body == null ? "" : body.string());
            } catch (IOException e) {
                lastFailure = new PluginSearchException("Plugin search transport failure: " + e.getMessage(), e, attempt);
                log.warn("Plugin search attempt {}/{} failed: {}", attempt, maxAttempts, e.toString());
            }
        }
        throw lastFailure;
    }

    List<ScoredResult> parseResults(String body) {
        JsonNode root;
        try {
            root = body.isBlank() ? null : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Plugin search returned an unparseable body", e);
            return List.of();
        }
        JsonNode items = null;
        if (root != null && root.path("results").isArray()) {
            items = root.path("results");
        } else if (root != null && root.isArray()) {
            items = root;
        }
        if (items == null) {
            return List.of();
        }

        List<ScoredResult> results = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            JsonNode path = item.path("path");
            if (!path.isTextual() || path.asText().isBlank()) {
                continue;
            }
            JsonNode score = item.path("score");
            JsonNode preview = item.path("preview");
            results.add(new ScoredResult(
                    path.asText().replace('\\', '/'),
                    score.isNumber() ? score.asDouble() : 0d,
                    preview.isTextual() ? preview.asText() : null));
        }
        return results;
    }
}
