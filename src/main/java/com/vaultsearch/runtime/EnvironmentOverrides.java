package com.vaultsearch.runtime;

import java.util.Locale;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vaultsearch.embed.EmbeddingServices;
import com.vaultsearch.retrieval.PluginFailurePolicy;
import com.vaultsearch.retrieval.SearchMode;

/**
 * Layers environment variables over a file-based {@link AppConfig}. Unset or
 * blank keys leave the file value in place; values that do not parse are
 * logged and ignored.
 */
public final class EnvironmentOverrides {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentOverrides.class);

    private EnvironmentOverrides() {
    }

    public static AppConfig apply(AppConfig config, Map<String, String> env) {
        AppConfig.SearchConfig search = config.getSearch();
        AppConfig.VectorStoreConfig vectorStore = config.getVectorStore();
        AppConfig.PluginConfig plugin = config.getPlugin();
        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        AppConfig.VaultConfig vault = config.getVault();

        String mode = value(env, "SMART_SEARCH_MODE");
        if (mode != null) {
            try {
                search.setMode(SearchMode.parse(mode));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring SMART_SEARCH_MODE={}: expected auto, plugin, local or lexical", mode);
            }
        }

        String smartEnvDir = value(env, "SMART_ENV_DIR");
        if (smartEnvDir != null) {
            vectorStore.setRoot(smartEnvDir);
        }
        applyLong(env, "SMART_ENV_CACHE_TTL_MS", vectorStore::setTtlMs);
        applyInt(env, "SMART_ENV_CACHE_MAX", vectorStore::setMaxItems);
        String model = value(env, "SMART_ENV_MODEL");
        if (model != null) {
            vectorStore.setPreferredModel(model);
        }

        // The Obsidian REST server hosts both the search plugin and the vault API.
        String baseUrl = value(env, "OBSIDIAN_BASE_URL");
        if (baseUrl != null) {
            plugin.setBaseUrl(baseUrl);
            vault.setBaseUrl(baseUrl);
        }
        String apiKey = value(env, "OBSIDIAN_API_KEY");
        if (apiKey != null) {
            plugin.setApiKey(apiKey);
            vault.setApiKey(apiKey);
        }
        applyLong(env, "PLUGIN_TIMEOUT_MS", plugin::setTimeoutMs);
        applyInt(env, "PLUGIN_RETRIES", plugin::setRetries);
        String policy = value(env, "PLUGIN_FAILURE_POLICY");
        if (policy != null) {
            try {
                plugin.setFailurePolicy(PluginFailurePolicy.parse(policy));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring PLUGIN_FAILURE_POLICY={}: expected continue or fail", policy);
            }
        }

        String backend = value(env, "QUERY_EMBEDDER");
        if (backend != null) {
            if (EmbeddingServices.isKnownBackend(backend)) {
                embedding.setBackend(backend.toLowerCase(Locale.ROOT));
            } else {
                log.warn("Ignoring unknown QUERY_EMBEDDER={}", backend);
            }
        }
        String enabled = value(env, "ENABLE_QUERY_EMBEDDING");
        if (enabled != null) {
            boolean requested = Boolean.parseBoolean(enabled);
            if (requested && !EmbeddingServices.isKnownBackend(embedding.getBackend())) {
                log.warn("ENABLE_QUERY_EMBEDDING set but backend {} is unknown; query embedding stays off",
                        embedding.getBackend());
                embedding.setEnabled(false);
            } else {
                embedding.setEnabled(requested);
            }
        }
        applyInt(env, "EMBED_MAX_CONCURRENCY", embedding::setMaxConcurrency);
        applyLong(env, "EMBED_TIMEOUT_MS", embedding::setTimeoutMs);
        applyInt(env, "EMBED_DIMENSION", embedding::setDimension);
        String endpoint = value(env, "EMBEDDING_URL");
        if (endpoint != null) {
            embedding.setEndpoint(endpoint);
        }
        String embeddingKey = value(env, "EMBEDDING_API_KEY");
        if (embeddingKey != null) {
            embedding.setApiKey(embeddingKey);
        }

        String vaultDir = value(env, "VAULT_DIR");
        if (vaultDir != null) {
            vault.setDirectory(vaultDir);
        }
        return config;
    }

    private static String value(Map<String, String> env, String key) {
        String raw = env.get(key);
        return raw == null || raw.isBlank() ? null : raw.strip();
    }

    private static void applyInt(Map<String, String> env, String key, IntConsumer setter) {
        String raw = value(env, key);
        if (raw == null) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", key, raw);
        }
    }

    private static void applyLong(Map<String, String> env, String key, LongConsumer setter) {
        String raw = value(env, key);
        if (raw == null) {
            return;
        }
        try {
            setter.accept(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not an integer", key, raw);
        }
    }
}
