package com.vaultsearch.embed;

public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    default String version() {
        return "embedder-v1";
    }
}
