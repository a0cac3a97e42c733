package com.vaultsearch.retrieval;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vaultsearch.embed.ConcurrencyLimitedEmbedder;
import com.vaultsearch.embed.EmbeddingService;
import com.vaultsearch.lexical.CorpusDocument;
import com.vaultsearch.plugin.PluginSearchClient;
import com.vaultsearch.plugin.PluginSearchException;
import com.vaultsearch.similarity.NoteVector;
import com.vaultsearch.similarity.ScoredResult;
import com.vaultsearch.vault.VaultDocumentSource;
import com.vaultsearch.vectors.NoteVectorSource;
import com.vaultsearch.vectors.SmartEnvVectorStore;
import com.vaultsearch.vectors.VectorCache;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrievalAggregatorTest {

    private static final List<NoteVector> POOL = List.of(
            NoteVector.of("vault/a.md", new float[] { 1f, 0f }),
            NoteVector.of("vault/b.md", new float[] { 0.9f, 0.1f }),
            NoteVector.of("vault/c.md", new float[] { 0f, 1f }));

    private static final VaultDocumentSource THREE_NOTES = () -> List.of(
            new CorpusDocument("a.md", "the quick brown fox"),
            new CorpusDocument("b.md", "lazy dogs sleep all afternoon"),
            new CorpusDocument("c.md", "rainy weather today"));

    @TempDir
    Path tempDir;

    private MockWebServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stopServer() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldFallBackToLexicalWhenNoOtherProviderIsConfigured() throws Exception {
        RetrievalAggregator aggregator = new RetrievalAggregator(null, null, null, THREE_NOTES, null);

        RetrievalResponse response = aggregator.retrieve(RetrievalRequest.ofQuery("the quick brown fox", 5));

        assertEquals(RetrievalMethod.LEXICAL, response.method());
        assertEquals("tfidf", response.encoderLabel());
        assertEquals(3, response.poolSize());
        assertEquals("a.md", response.results().get(0).path());
        assertEquals(1d, response.results().get(0).score(), 1e-9);
        assertEquals(1, response.results().size());
    }

    @Test
    void shouldReturnPluginResultsWithoutConsultingCache() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"results\":[{\"path\":\"a.md\",\"score\":0.9}]}"));
        CountingSource source = new CountingSource(POOL);
        RetrievalAggregator aggregator = new RetrievalAggregator(
                plugin(2),
                new VectorCache(source, Duration.ofMinutes(1), 0),
                null,
                THREE_NOTES,
                null);

        RetrievalResponse response = aggregator.retrieve(new RetrievalRequest("fox", "vault/a.md", 5));

        assertEquals(RetrievalMethod.PLUGIN, response.method());
        assertEquals(List.of(new ScoredResult("a.md", 0.9)), response.results());
        assertEquals(0, source.loads.get());
    }

    @Test
    void shouldLoadValidRecordAndSkipCorruptOne() throws Exception {
        Path multi = Files.createDirectories(tempDir.resolve("multi"));
        Files.writeString(multi.resolve("x.ajson"), """
                {"path": "x.md", "embeddings": {"m": {"vec": [1, 0, 0]}}}
                """);
        Files.writeString(multi.resolve("corrupt.ajson"), "{\"path\": \"y.md\", \"embeddings\": ");
        VectorCache cache = new VectorCache(new SmartEnvVectorStore(tempDir, null), Duration.ofMinutes(1), 0);

        assertEquals(1, cache.vectors().size());
        List<ScoredResult> results = cache.query(new float[] { 1f, 0f, 0f }, 5);
        assertEquals("x.md", results.get(0).path());
        assertEquals(1d, results.get(0).score(), 1e-9);
    }

    @Test
    void shouldRankCachedNeighboursOfAnchorExcludingItself() throws Exception {
        RetrievalAggregator aggregator = new RetrievalAggregator(
                null, new VectorCache(new CountingSource(POOL), Duration.ofMinutes(1), 0), null, THREE_NOTES, null);

        RetrievalResponse response = aggregator.retrieve(RetrievalRequest.fromAnchor("/home/me/vault/a.md", 5));

        assertEquals(RetrievalMethod.CACHE, response.method());
        assertEquals(List.of("vault/b.md", "vault/c.md"), paths(response));
        assertEquals(2, response.dimension());
        assertEquals(2, response.poolSize());
        assertEquals("vectors", response.encoderLabel());
    }

    @Test
    void shouldUseAnchorNoteTextForLexicalSearchWhenAnchorHasNoVector() throws Exception {
        VaultDocumentSource vault = () -> List.of(
                new CorpusDocument("alpha.md", "kayak river paddle"),
                new CorpusDocument("beta.md", "river fishing boat"),
                new CorpusDocument("gamma.md", "mountain hiking boots"),
                new CorpusDocument("delta.md", "city museum tour"));
        RetrievalAggregator aggregator = new RetrievalAggregator(
                null, new VectorCache(new CountingSource(POOL), Duration.ofMinutes(1), 0), null, vault, null);

        RetrievalResponse response = aggregator.retrieve(RetrievalRequest.fromAnchor("alpha.md", 5));

        assertEquals(RetrievalMethod.LEXICAL, response.method());
        assertEquals(List.of("beta.md"), paths(response));
    }

    @Test
    void shouldEmbedQueryAndRankAgainstCachedPool() throws Exception {
        try (ConcurrencyLimitedEmbedder embedder = new ConcurrencyLimitedEmbedder(
                () -> new FixedEmbeddingService(new float[] { 1f, 0f }, null), 1, Duration.ofSeconds(5))) {
            RetrievalAggregator aggregator = new RetrievalAggregator(
                    null, new VectorCache(new CountingSource(POOL), Duration.ofMinutes(1), 0), embedder, THREE_NOTES,
                    null);

            RetrievalResponse response = aggregator.retrieve(RetrievalRequest.ofQuery("boats", 2));

            assertEquals(RetrievalMethod.EMBED, response.method());
            assertEquals(List.of("vault/a.md", "vault/b.md"), paths(response));
            assertEquals("fixed-v1", response.encoderLabel());
            assertEquals(2, response.dimension());
            assertEquals(3, response.poolSize());
        }
    }

    @Test
    void embeddedQueryShouldReadVectorPoolOncePerRequest() throws Exception {
        CountingSource source = new CountingSource(POOL);
        try (ConcurrencyLimitedEmbedder embedder = new ConcurrencyLimitedEmbedder(
                () -> new FixedEmbeddingService(new float[] { 0f, 1f }, null), 1, Duration.ofSeconds(5))) {
            RetrievalAggregator aggregator = new RetrievalAggregator(
                    null, new VectorCache(source, Duration.ZERO, 0), embedder, THREE_NOTES, null);

            RetrievalResponse response = aggregator.retrieve(RetrievalRequest.ofQuery("weather", 1));

            assertEquals(RetrievalMethod.EMBED, response.method());
            assertEquals(List.of("vault/c.md"), paths(response));
            assertEquals(3, response.poolSize());
            assertEquals(1, source.loads.get());
        }
    }

    @Test
    void shouldFallBackToLexicalWhenEmbeddingTimesOut() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        try (ConcurrencyLimitedEmbedder embedder = new ConcurrencyLimitedEmbedder(
                () -> new FixedEmbeddingService(new float[] { 1f, 0f }, never), 1, Duration.ofMillis(50))) {
            RetrievalAggregator aggregator = new RetrievalAggregator(
                    null, new VectorCache(new CountingSource(POOL), Duration.ofMinutes(1), 0), embedder, THREE_NOTES,
                    null);

            RetrievalResponse response = aggregator.retrieve(RetrievalRequest.ofQuery("rainy weather", 5));

            assertEquals(RetrievalMethod.LEXICAL, response.method());
            assertEquals(List.of("c.md"), paths(response));
        }
    }

    @Test
    void shouldContinueAfterPluginFailureByDefault() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        RetrievalAggregator aggregator = new RetrievalAggregator(plugin(0), null, null, THREE_NOTES, null);

        RetrievalResponse response = aggregator.retrieve(RetrievalRequest.ofQuery("lazy dogs", 5));

        assertEquals(RetrievalMethod.LEXICAL, response.method());
        assertEquals(List.of("b.md"), paths(response));
    }

    @Test
    void shouldFailQueryWhenPolicyIsFail() {
        server.enqueue(new MockResponse().setResponseCode(500));
        RetrievalAggregator aggregator = new RetrievalAggregator(plugin(0), null, null, THREE_NOTES,
                new RetrievalSettings(SearchMode.AUTO, PluginFailurePolicy.FAIL, 10, 50));

        PluginSearchException failure = assertThrows(PluginSearchException.class,
                () -> aggregator.retrieve(RetrievalRequest.ofQuery("lazy dogs", 5)));

        assertEquals(500, failure.statusCode());
    }

    @Test
    void lexicalModeShouldSkipPluginAndVectors() throws Exception {
        CountingSource source = new CountingSource(POOL);
        RetrievalAggregator aggregator = new RetrievalAggregator(plugin(0),
                new VectorCache(source, Duration.ofMinutes(1), 0), null, THREE_NOTES,
                new RetrievalSettings(SearchMode.LEXICAL, null, 10, 50));

        RetrievalResponse response = aggregator.retrieve(new RetrievalRequest("rainy", "vault/a.md", 5));

        assertEquals(RetrievalMethod.LEXICAL, response.method());
        assertEquals(0, server.getRequestCount());
        assertEquals(0, source.loads.get());
    }

    @Test
    void pluginModeShouldNotFallBackToLocalProviders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        RetrievalAggregator aggregator = new RetrievalAggregator(plugin(2), null, null, THREE_NOTES,
                new RetrievalSettings(SearchMode.PLUGIN, null, 10, 50));

        RetrievalResponse response = aggregator.retrieve(RetrievalRequest.ofQuery("the quick brown fox", 5));

        assertEquals(RetrievalMethod.PLUGIN, response.method());
        assertTrue(response.isEmpty());
    }

    @Test
    void localModeShouldSkipPlugin() throws Exception {
        RetrievalAggregator aggregator = new RetrievalAggregator(plugin(0),
                new VectorCache(new CountingSource(POOL), Duration.ofMinutes(1), 0), null, THREE_NOTES,
                new RetrievalSettings(SearchMode.LOCAL, null, 10, 50));

        RetrievalResponse response = aggregator.retrieve(RetrievalRequest.fromAnchor("vault/c.md", 1));

        assertEquals(RetrievalMethod.CACHE, response.method());
        assertEquals(List.of("vault/b.md"), paths(response));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void shouldReturnEmptyLexicalResponseForEmptyInput() throws Exception {
        RetrievalAggregator aggregator = new RetrievalAggregator(plugin(0), null, null, THREE_NOTES, null);

        RetrievalResponse response = aggregator.retrieve(new RetrievalRequest("  ", null, 5));

        assertEquals(RetrievalMethod.LEXICAL, response.method());
        assertTrue(response.isEmpty());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void shouldReturnEmptyResultWhenNothingMatches() throws Exception {
        RetrievalAggregator aggregator = new RetrievalAggregator(null, null, null, THREE_NOTES, null);

        RetrievalResponse response = aggregator.retrieve(RetrievalRequest.ofQuery("submarine", 5));

        assertEquals(RetrievalMethod.LEXICAL, response.method());
        assertTrue(response.isEmpty());
    }

    @Test
    void shouldTreatUnreadableVaultAsEmpty() throws Exception {
        VaultDocumentSource failing = () -> {
            throw new IOException("vault offline");
        };
        RetrievalAggregator aggregator = new RetrievalAggregator(null, null, null, failing, null);

        assertTrue(aggregator.retrieve(RetrievalRequest.ofQuery("fox", 5)).isEmpty());
    }

    @Test
    void shouldClampLimitToConfiguredBounds() throws Exception {
        List<NoteVector> many = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            many.add(NoteVector.of("n" + i + ".md", new float[] { 1f, i }));
        }
        RetrievalAggregator aggregator = new RetrievalAggregator(
                null, new VectorCache(new CountingSource(many), Duration.ofMinutes(1), 0), null, null,
                new RetrievalSettings(SearchMode.AUTO, null, 3, 5));

        assertEquals(3, aggregator.retrieve(RetrievalRequest.fromAnchor("n0.md", 0)).results().size());
        assertEquals(5, aggregator.retrieve(RetrievalRequest.fromAnchor("n0.md", 100)).results().size());
    }

    @Test
    void invalidateCacheShouldForceReload() throws Exception {
        CountingSource source = new CountingSource(POOL);
        RetrievalAggregator aggregator = new RetrievalAggregator(
                null, new VectorCache(source, Duration.ofMinutes(1), 0), null, null, null);

        aggregator.retrieve(RetrievalRequest.fromAnchor("vault/a.md", 5));
        aggregator.invalidateCache();
        aggregator.retrieve(RetrievalRequest.fromAnchor("vault/a.md", 5));

        assertEquals(2, source.loads.get());
    }

    private PluginSearchClient plugin(int retries) {
        return new PluginSearchClient(new OkHttpClient(), server.url("/").toString(), "key",
                Duration.ofSeconds(5), retries);
    }

    private static List<String> paths(RetrievalResponse response) {
        return response.results().stream().map(ScoredResult::path).toList();
    }

    private static final class CountingSource implements NoteVectorSource {
        private final List<NoteVector> vectors;
        private final AtomicInteger loads = new AtomicInteger();

        private CountingSource(List<NoteVector> vectors) {
            this.vectors = vectors;
        }

        @Override
        public List<NoteVector> loadAll() {
            loads.incrementAndGet();
            return vectors;
        }
    }

    private static final class FixedEmbeddingService implements EmbeddingService {
        private final float[] vector;
        private final CountDownLatch gate;

        private FixedEmbeddingService(float[] vector, CountDownLatch gate) {
            this.vector = vector;
            this.gate = gate;
        }

        @Override
        public float[] embed(String text) {
            if (gate != null) {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return vector.clone();
        }

        @Override
        public int dimension() {
            return vector.length;
        }

        @Override
        public String version() {
            return "fixed-v1";
        }
    }
}
