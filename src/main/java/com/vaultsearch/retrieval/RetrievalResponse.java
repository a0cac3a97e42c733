package com.vaultsearch.retrieval;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.vaultsearch.similarity.ScoredResult;

public record RetrievalResponse(
        RetrievalMethod method,
        List<ScoredResult> results,
        String encoderLabel,
        int dimension,
        int poolSize,
        long elapsedMs) {

    public RetrievalResponse {
        results = List.copyOf(results);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return results.isEmpty();
    }
}
