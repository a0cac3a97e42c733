package com.vaultsearch.lexical;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.vaultsearch.similarity.ScoredResult;
import com.vaultsearch.similarity.SimilarityRanker;

/**
 * TF-IDF index over a fixed corpus snapshot. Weights use
 * {@code ln(N / (1 + df))}; build a new instance when the corpus changes.
 * Every query scores every document, which only suits small vaults. When
 * two documents share an id only the first is indexed.
 */
public final class TfIdfIndex {
    private final Map<String, List<String>> perDocumentTokens;
    private final Map<String, Double> idfWeights;
    private final Map<String, Integer> termPositions;
    private final Map<String, double[]> documentVectors;

    public TfIdfIndex(Collection<CorpusDocument> documents) {
        Map<String, List<String>> tokens = new LinkedHashMap<>();
        Map<String, Integer> documentFrequency = new LinkedHashMap<>();
        for (CorpusDocument document : documents) {
            if (tokens.containsKey(document.id())) {
                // first document wins for a repeated id
                continue;
            }
            List<String> documentTokens = tokenize(document.text());
            tokens.put(document.id(), documentTokens);
            for (String term : new HashSet<>(documentTokens)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        int documentCount = tokens.size();
        Map<String, Double> idf = new LinkedHashMap<>();
        Map<String, Integer> positions = new HashMap<>();
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            idf.put(entry.getKey(), Math.log((double) documentCount / (1 + entry.getValue())));
            positions.put(entry.getKey(), positions.size());
        }

        this.perDocumentTokens = Collections.unmodifiableMap(tokens);
        this.idfWeights = Collections.unmodifiableMap(idf);
        this.termPositions = positions;

        Map<String, double[]> vectors = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : tokens.entrySet()) {
            vectors.put(entry.getKey(), weightedVector(entry.getValue()));
        }
        this.documentVectors = vectors;
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    /**
     * Scores every indexed document against {@code query}, highest first.
     * Terms outside the indexed vocabulary are ignored.
     */
    public List<ScoredResult> search(String query) {
        double[] queryVector = weightedVector(tokenize(query));
        List<ScoredResult> results = new ArrayList<>(documentVectors.size());
        for (Map.Entry<String, double[]> entry : documentVectors.entrySet()) {
            results.add(new ScoredResult(entry.getKey(), SimilarityRanker.cosine(queryVector, entry.getValue())));
        }
        results.sort(Comparator.comparingDouble(ScoredResult::score).reversed());
        return results;
    }

    public int size() {
        return perDocumentTokens.size();
    }

    public int vocabularySize() {
        return idfWeights.size();
    }

    public Set<String> documentIds() {
        return perDocumentTokens.keySet();
    }

    public List<String> tokens(String documentId) {
        return perDocumentTokens.getOrDefault(documentId, List.of());
    }

    public double idf(String term) {
        return idfWeights.getOrDefault(term, 0d);
    }

    private double[] weightedVector(List<String> tokens) {
        double[] vector = new double[termPositions.size()];
        for (String token : tokens) {
            Integer position = termPositions.get(token);
            if (position != null) {
                vector[position] += 1d;
            }
        }
        for (Map.Entry<String, Integer> entry : termPositions.entrySet()) {
            vector[entry.getValue()] *= idfWeights.get(entry.getKey());
        }
        return vector;
    }
}
