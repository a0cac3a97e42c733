package com.vaultsearch.embed;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("input", text);
            if (model != null && !model.isBlank()) {
                body.put("model", model);
            }
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    throw new EmbeddingFailedException("Embedding endpoint returned HTTP " + response.code());
                }
                JsonNode vectorNode = mapper.readTree(responseBody.string()).path("embedding");
                if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                    throw new EmbeddingFailedException("Embedding endpoint returned no embedding array");
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble();
                }
                return out;
            }
        } catch (IOException e) {
            throw new EmbeddingFailedException("Embedding endpoint call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return model == null || model.isBlank() ? "external-v1" : "external-" + model;
    }
}
