package com.vaultsearch.retrieval;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RetrievalMethod {
    PLUGIN,
    CACHE,
    EMBED,
    LEXICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
