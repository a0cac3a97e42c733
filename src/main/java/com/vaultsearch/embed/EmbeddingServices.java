package com.vaultsearch.embed;

import java.time.Duration;
import java.util.Locale;

import com.vaultsearch.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    public static final String HASHING = "hashing";
    public static final String EXTERNAL = "external";

    private EmbeddingServices() {
    }

    public static boolean isKnownBackend(String backend) {
        if (backend == null) {
            return false;
        }
        String normalized = backend.toLowerCase(Locale.ROOT);
        return HASHING.equals(normalized) || EXTERNAL.equals(normalized);
    }

    public static EmbeddingBackendLoader loader(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String backend = config.getBackend() == null ? HASHING : config.getBackend().toLowerCase(Locale.ROOT);
        switch (backend) {
            case HASHING:
                return () -> new HashingEmbeddingService(config.getDimension());
            case EXTERNAL:
                return () -> {
                    if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
                        throw new IllegalStateException("embedding.endpoint is required for the external backend");
                    }
                    OkHttpClient bounded = httpClient.newBuilder()
                            .callTimeout(Duration.ofMillis(Math.max(0, config.getTimeoutMs())))
                            .build();
                    return new ExternalProviderEmbeddingService(
                            bounded,
                            config.getEndpoint(),
                            config.getModel(),
                            config.getApiKey(),
                            config.getDimension());
                };
            default:
                throw new IllegalArgumentException("Unknown embedding backend: " + config.getBackend());
        }
    }

    public static ConcurrencyLimitedEmbedder fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        return new ConcurrencyLimitedEmbedder(
                loader(config, httpClient),
                config.getMaxConcurrency(),
                Duration.ofMillis(config.getTimeoutMs()));
    }
}
