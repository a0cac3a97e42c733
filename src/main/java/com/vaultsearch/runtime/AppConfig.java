package com.vaultsearch.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vaultsearch.retrieval.PluginFailurePolicy;
import com.vaultsearch.retrieval.SearchMode;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private SearchConfig search = new SearchConfig();
    private VectorStoreConfig vectorStore = new VectorStoreConfig();
    private PluginConfig plugin = new PluginConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private VaultConfig vault = new VaultConfig();

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public VectorStoreConfig getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(VectorStoreConfig vectorStore) {
        this.vectorStore = vectorStore == null ? new VectorStoreConfig() : vectorStore;
    }

    public PluginConfig getPlugin() {
        return plugin;
    }

    public void setPlugin(PluginConfig plugin) {
        this.plugin = plugin == null ? new PluginConfig() : plugin;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public VaultConfig getVault() {
        return vault;
    }

    public void setVault(VaultConfig vault) {
        this.vault = vault == null ? new VaultConfig() : vault;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private SearchMode mode = SearchMode.AUTO;
        private int defaultLimit = 10;
        private int maxLimit = 50;

        public SearchMode getMode() {
            return mode;
        }

        public void setMode(SearchMode mode) {
            this.mode = mode == null ? SearchMode.AUTO : mode;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorStoreConfig {
        private String root;
        private long ttlMs = 60000;
        private int maxItems = 0;
        private String preferredModel;

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public boolean isConfigured() {
            return root != null && !root.isBlank();
        }

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public int getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }

        public String getPreferredModel() {
            return preferredModel;
        }

        public void setPreferredModel(String preferredModel) {
            this.preferredModel = preferredModel;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PluginConfig {
        private String baseUrl;
        private String apiKey;
        private long timeoutMs = 15000;
        private int retries = 2;
        private PluginFailurePolicy failurePolicy = PluginFailurePolicy.CONTINUE;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public PluginFailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(PluginFailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy == null ? PluginFailurePolicy.CONTINUE : failurePolicy;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private boolean enabled = false;
        private String backend = "hashing";
        private int dimension = 384;
        private int maxConcurrency = 1;
        private long timeoutMs = 20000;
        private String endpoint;
        private String model;
        private String apiKey;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VaultConfig {
        private String baseUrl;
        private String apiKey;
        private String directory;
        private long timeoutMs = 15000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
