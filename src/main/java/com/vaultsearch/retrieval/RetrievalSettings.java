package com.vaultsearch.retrieval;

public record RetrievalSettings(SearchMode mode, PluginFailurePolicy pluginFailurePolicy, int defaultLimit, int maxLimit) {

    public RetrievalSettings {
        mode = mode == null ? SearchMode.AUTO : mode;
        pluginFailurePolicy = pluginFailurePolicy == null ? PluginFailurePolicy.CONTINUE : pluginFailurePolicy;
        maxLimit = Math.max(1, maxLimit);
        defaultLimit = Math.max(1, Math.min(defaultLimit, maxLimit));
    }

    public static RetrievalSettings defaults() {
        return new RetrievalSettings(SearchMode.AUTO, PluginFailurePolicy.CONTINUE, 10, 50);
    }

    int clampLimit(int requested) {
        if (requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }
}
