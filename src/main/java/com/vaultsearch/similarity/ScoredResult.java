package com.vaultsearch.similarity;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScoredResult(String path, double score, String preview) {

    public ScoredResult {
        if (!Double.isFinite(score)) {
            score = 0d;
        }
    }

    public ScoredResult(String path, double score) {
        this(path, score, null);
    }
}
