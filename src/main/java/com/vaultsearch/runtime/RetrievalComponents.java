package com.vaultsearch.runtime;

import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vaultsearch.embed.ConcurrencyLimitedEmbedder;
import com.vaultsearch.embed.EmbeddingServices;
import com.vaultsearch.plugin.PluginSearchClient;
import com.vaultsearch.retrieval.RetrievalAggregator;
import com.vaultsearch.retrieval.RetrievalSettings;
import com.vaultsearch.vault.DirectoryVaultDocumentSource;
import com.vaultsearch.vault.RestVaultDocumentSource;
import com.vaultsearch.vault.VaultDocumentSource;
import com.vaultsearch.vectors.SmartEnvVectorStore;
import com.vaultsearch.vectors.VectorCache;

import okhttp3.OkHttpClient;

/**
 * Builds the aggregator and its providers from an {@link AppConfig}. All HTTP
 * collaborators share one {@link OkHttpClient}.
 */
public class RetrievalComponents implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalComponents.class);

    private final OkHttpClient httpClient;
    private final PluginSearchClient plugin;
    private final VectorCache vectorCache;
    private final ConcurrencyLimitedEmbedder embedder;
    private final VaultDocumentSource vault;
    private final RetrievalAggregator aggregator;

    public RetrievalComponents(AppConfig config) {
        this(config, new OkHttpClient());
    }

    public RetrievalComponents(AppConfig config, OkHttpClient httpClient) {
        this.httpClient = httpClient;

        AppConfig.PluginConfig pluginConfig = config.getPlugin();
        this.plugin = new PluginSearchClient(
                httpClient,
                pluginConfig.getBaseUrl(),
                pluginConfig.getApiKey(),
                Duration.ofMillis(pluginConfig.getTimeoutMs()),
                pluginConfig.getRetries());

        AppConfig.VectorStoreConfig storeConfig = config.getVectorStore();
        this.vectorCache = storeConfig.isConfigured()
                ? new VectorCache(
                        new SmartEnvVectorStore(Path.of(storeConfig.getRoot()), storeConfig.getPreferredModel()),
                        Duration.ofMillis(storeConfig.getTtlMs()),
                        storeConfig.getMaxItems())
                : null;

        AppConfig.EmbeddingConfig embeddingConfig = config.getEmbedding();
        this.embedder = embeddingConfig.isEnabled()
                ? EmbeddingServices.fromConfig(embeddingConfig, httpClient)
                : null;

        this.vault = vaultSource(config.getVault(), httpClient);

        AppConfig.SearchConfig search = config.getSearch();
        this.aggregator = new RetrievalAggregator(
                plugin.isConfigured() ? plugin : null,
                vectorCache,
                embedder,
                vault,
                new RetrievalSettings(
                        search.getMode(),
                        pluginConfig.getFailurePolicy(),
                        search.getDefaultLimit(),
                        search.getMaxLimit()));

        log.info("Retrieval providers mode={} plugin={} vectorStore={} embedder={} vault={}",
                search.getMode(),
                plugin.isConfigured() ? "on" : "off",
                vectorCache == null ? "off" : storeConfig.getRoot(),
                embedder == null ? "off" : embeddingConfig.getBackend(),
                vault == null ? "off" : vault.getClass().getSimpleName());
    }

    public RetrievalAggregator aggregator() {
        return aggregator;
    }

    public VectorCache vectorCache() {
        return vectorCache;
    }

    public ConcurrencyLimitedEmbedder embedder() {
        return embedder;
    }

    public VaultDocumentSource vault() {
        return vault;
    }

    @Override
    public void close() {
        if (embedder != null) {
            embedder.close();
        }
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private static VaultDocumentSource vaultSource(AppConfig.VaultConfig config, OkHttpClient httpClient) {
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            try {
                return new RestVaultDocumentSource(
                        httpClient,
                        config.getBaseUrl(),
                        config.getApiKey(),
                        Duration.ofMillis(config.getTimeoutMs()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid vault.baseUrl {}; falling back to vault.directory", config.getBaseUrl());
            }
        }
        if (config.getDirectory() != null && !config.getDirectory().isBlank()) {
            return new DirectoryVaultDocumentSource(Path.of(config.getDirectory()));
        }
        return null;
    }
}
