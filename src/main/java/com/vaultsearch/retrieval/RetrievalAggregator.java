package com.vaultsearch.retrieval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vaultsearch.embed.ConcurrencyLimitedEmbedder;
import com.vaultsearch.embed.EmbedTimeoutException;
import com.vaultsearch.embed.EmbeddingFailedException;
import com.vaultsearch.lexical.CorpusDocument;
import com.vaultsearch.lexical.TfIdfIndex;
import com.vaultsearch.plugin.PluginSearchClient;
import com.vaultsearch.plugin.PluginSearchException;
import com.vaultsearch.similarity.NoteVector;
import com.vaultsearch.similarity.ScoredResult;
import com.vaultsearch.similarity.SimilarityRanker;
import com.vaultsearch.vault.NotePaths;
import com.vaultsearch.vault.VaultDocumentSource;
import com.vaultsearch.vectors.VectorCache;

/**
 * Answers a query from the first provider that yields results, in the order
 * plugin, cached neighbours of an anchor note, embedded query against the
 * cached vectors, TF-IDF over the vault. Scores from different providers are
 * never merged.
 *
 * <p>Any collaborator may be {@code null}, which skips its step.
 */
public class RetrievalAggregator {
    private static final Logger log = LoggerFactory.getLogger(RetrievalAggregator.class);
    static final String PLUGIN_LABEL = "plugin";
    static final String LEXICAL_LABEL = "tfidf";

    private final PluginSearchClient plugin;
    private final VectorCache vectorCache;
    private final ConcurrencyLimitedEmbedder embedder;
    private final VaultDocumentSource vault;
    private final RetrievalSettings settings;

    public RetrievalAggregator(PluginSearchClient plugin,
            VectorCache vectorCache,
            ConcurrencyLimitedEmbedder embedder,
            VaultDocumentSource vault,
            RetrievalSettings settings) {
        this.plugin = plugin;
        this.vectorCache = vectorCache;
        this.embedder = embedder;
        this.vault = vault;
        this.settings = settings == null ? RetrievalSettings.defaults() : settings;
    }

    public RetrievalResponse retrieve(RetrievalRequest request) throws PluginSearchException {
        long started = System.nanoTime();
        int limit = settings.clampLimit(request.limit());
        SearchMode mode = settings.mode();

        if (!request.hasQuery() && !request.hasAnchor()) {
            return finish(new Outcome(RetrievalMethod.LEXICAL, List.of(), LEXICAL_LABEL, 0, 0), limit, started);
        }

        Outcome last = null;
        if (mode.allowsPlugin() && request.hasQuery() && plugin != null) {
            last = tryPlugin(request.query(), limit);
            if (last.hasResults()) {
                return finish(last, limit, started);
            }
        }
        if (mode.allowsVectors() && vectorCache != null) {
            if (request.hasAnchor()) {
                last = tryCache(request.anchorPath(), limit);
                if (last.hasResults()) {
                    return finish(last, limit, started);
                }
            }
            if (request.hasQuery() && embedder != null) {
                last = tryEmbed(request.query(), limit);
                if (last.hasResults()) {
                    return finish(last, limit, started);
                }
            }
        }
        if (mode.allowsLexical()) {
            last = tryLexical(request, limit);
        }
        if (last == null) {
            last = new Outcome(RetrievalMethod.LEXICAL, List.of(), LEXICAL_LABEL, 0, 0);
        }
        return finish(last, limit, started);
    }

    public void invalidateCache() {
        if (vectorCache != null) {
            vectorCache.invalidate();
        }
    }

    public void warmUp() {
        if (embedder != null) {
            embedder.warmUp();
        }
    }

    private Outcome tryPlugin(String query, int limit) throws PluginSearchException {
        List<ScoredResult> results;
        try {
            results = plugin.search(query, limit);
        } catch (PluginSearchException e) {
            if (settings.pluginFailurePolicy() == PluginFailurePolicy.FAIL) {
                throw e;
            }
            log.warn("Plugin search failed after {} attempts, using fallback: {}", e.attempts(), e.getMessage());
            results = null;
        }
        if (results == null) {
            log.debug("Plugin provider unavailable");
        }
        return new Outcome(RetrievalMethod.PLUGIN, results, PLUGIN_LABEL, 0, results == null ? 0 : results.size());
    }

    private Outcome tryCache(String anchorPath, int limit) {
        List<NoteVector> pool = vectorCache.vectors();
        Optional<NoteVector> anchor = NotePaths.find(pool, NoteVector::path, anchorPath);
        if (anchor.isEmpty()) {
            log.debug("No stored vector for anchor {}", anchorPath);
            return new Outcome(RetrievalMethod.CACHE, null, vectorCache.label(), 0, pool.size());
        }
        NoteVector origin = anchor.get();
        List<NoteVector> others = pool.stream()
                .filter(candidate -> !candidate.path().equals(origin.path()))
                .toList();
        List<ScoredResult> results = SimilarityRanker.topK(origin.vector(), origin.norm(), others, limit);
        return new Outcome(RetrievalMethod.CACHE, results, vectorCache.label(), origin.dimension(), others.size());
    }

    private Outcome tryEmbed(String query, int limit) {
        List<NoteVector> pool = vectorCache.vectors();
        int poolSize = pool.size();
        if (poolSize == 0) {
            return new Outcome(RetrievalMethod.EMBED, null, embedder.label(), 0, 0);
        }
        float[] queryVector;
        try {
            queryVector = embedder.embed(query);
        } catch (EmbedTimeoutException | EmbeddingFailedException e) {
            log.warn("Query embedding unavailable, using fallback: {}", e.getMessage());
            return new Outcome(RetrievalMethod.EMBED, null, embedder.label(), 0, poolSize);
        }
        List<ScoredResult> results =
                SimilarityRanker.topK(queryVector, SimilarityRanker.norm(queryVector), pool, limit);
        return new Outcome(RetrievalMethod.EMBED, results, embedder.label(), queryVector.length, poolSize);
    }

    private Outcome tryLexical(RetrievalRequest request, int limit) {
        if (vault == null) {
            return new Outcome(RetrievalMethod.LEXICAL, List.of(), LEXICAL_LABEL, 0, 0);
        }
        List<CorpusDocument> corpus;
        try {
            corpus = vault.documents();
        } catch (IOException e) {
            log.warn("Unable to read vault corpus for lexical search", e);
            return new Outcome(RetrievalMethod.LEXICAL, List.of(), LEXICAL_LABEL, 0, 0);
        }

        String text = request.query();
        String excluded = null;
        if (!request.hasQuery()) {
            Optional<CorpusDocument> anchor = NotePaths.find(corpus, CorpusDocument::id, request.anchorPath());
            if (anchor.isEmpty()) {
                return new Outcome(RetrievalMethod.LEXICAL, List.of(), LEXICAL_LABEL, 0, corpus.size());
            }
            text = anchor.get().text();
            excluded = anchor.get().id();
        }

        TfIdfIndex index = new TfIdfIndex(corpus);
        List<ScoredResult> results = new ArrayList<>();
        for (ScoredResult result : index.search(text)) {
            if (result.score() > 0d && !result.path().equals(excluded)) {
                results.add(result);
            }
        }
        return new Outcome(RetrievalMethod.LEXICAL, results, LEXICAL_LABEL, index.vocabularySize(), index.size());
    }

    private RetrievalResponse finish(Outcome outcome, int limit, long started) {
        List<ScoredResult> ordered = new ArrayList<>(outcome.results() == null ? List.of() : outcome.results());
        ordered.sort(Comparator.comparingDouble(ScoredResult::score).reversed());
        List<ScoredResult> limited = ordered.size() > limit ? ordered.subList(0, limit) : ordered;
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        log.debug("Retrieval finished method={} results={} poolSize={} elapsedMs={}",
                outcome.method().wireName(), limited.size(), outcome.poolSize(), elapsedMs);
        return new RetrievalResponse(
                outcome.method(),
                limited,
                outcome.encoderLabel(),
                outcome.dimension(),
                outcome.poolSize(),
                elapsedMs);
    }

    private record Outcome(RetrievalMethod method,
            List<ScoredResult> results,
            String encoderLabel,
            int dimension,
            int poolSize) {

        boolean hasResults() {
            return results != null && !results.isEmpty();
        }
    }
}
