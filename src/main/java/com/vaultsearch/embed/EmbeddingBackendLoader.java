package com.vaultsearch.embed;

@FunctionalInterface
public interface EmbeddingBackendLoader {
    EmbeddingService load() throws Exception;
}
