package com.vaultsearch.retrieval;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum SearchMode {
    AUTO,
    PLUGIN,
    LOCAL,
    LEXICAL;

    boolean allowsPlugin() {
        return this == AUTO || this == PLUGIN;
    }

    boolean allowsVectors() {
        return this == AUTO || this == LOCAL;
    }

    boolean allowsLexical() {
        return this != PLUGIN;
    }

    @JsonCreator
    public static SearchMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
