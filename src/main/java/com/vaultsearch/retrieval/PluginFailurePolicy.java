package com.vaultsearch.retrieval;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * What the aggregator does when the plugin exhausted its retries.
 */
public enum PluginFailurePolicy {
    /** Log and fall through to the local providers. */
    CONTINUE,
    /** The plugin is the only intended backend: fail the query. */
    FAIL;

    @JsonCreator
    public static PluginFailurePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return CONTINUE;
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
