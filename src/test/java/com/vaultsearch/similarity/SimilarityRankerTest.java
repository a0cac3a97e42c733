package com.vaultsearch.similarity;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimilarityRankerTest {

    @Test
    void cosineShouldBeSymmetricAndBounded() {
        float[] a = { 0.2f, -1.5f, 3f, 0.7f };
        float[] b = { 1f, 0.5f, -0.25f, 2f };

        double ab = SimilarityRanker.cosine(a, b);
        double ba = SimilarityRanker.cosine(b, a);

        assertEquals(ab, ba, 1e-12);
        assertTrue(ab >= -1d && ab <= 1d);
        assertEquals(1d, SimilarityRanker.cosine(a, a), 1e-6);
    }

    @Test
    void cosineShouldReturnZeroForZeroVector() {
        assertEquals(0d, SimilarityRanker.cosine(new float[] { 0f, 0f }, new float[] { 1f, 2f }));
        assertEquals(0d, SimilarityRanker.cosine(new double[] { 0d, 0d }, new double[] { 0d, 0d }));
    }

    @Test
    void strictCosineShouldRejectMismatchedLengths() {
        DimensionMismatchException error = assertThrows(DimensionMismatchException.class,
                () -> SimilarityRanker.cosine(new float[] { 1f, 2f, 3f }, new float[] { 1f, 2f }));

        assertEquals(3, error.left());
        assertEquals(2, error.right());
        assertThrows(DimensionMismatchException.class,
                () -> SimilarityRanker.cosine(new double[] { 1d }, new double[] { 1d, 2d }));
    }

    @Test
    void tolerantCosineShouldCompareSharedPrefixOnly() {
        double score = SimilarityRanker.tolerantCosine(new float[] { 1f, 0f, 9f }, new float[] { 1f, 0f });

        assertEquals(1d, score, 1e-9);
    }

    @Test
    void topKShouldOrderDescendingAndTruncate() {
        List<NoteVector> pool = List.of(
                NoteVector.of("far.md", new float[] { 0f, 1f }),
                NoteVector.of("near.md", new float[] { 1f, 0.1f }),
                NoteVector.of("mid.md", new float[] { 1f, 1f }));
        float[] anchor = { 1f, 0f };

        List<ScoredResult> results = SimilarityRanker.topK(anchor, SimilarityRanker.norm(anchor), pool, 2);

        assertEquals(2, results.size());
        assertEquals("near.md", results.get(0).path());
        assertEquals("mid.md", results.get(1).path());
        assertTrue(results.get(0).score() >= results.get(1).score());
    }

    @Test
    void topKShouldKeepPoolOrderForTies() {
        List<NoteVector> pool = List.of(
                NoteVector.of("b.md", new float[] { 2f, 0f }),
                NoteVector.of("a.md", new float[] { 1f, 0f }),
                NoteVector.of("c.md", new float[] { 3f, 0f }));
        float[] anchor = { 1f, 0f };

        List<ScoredResult> results = SimilarityRanker.topK(anchor, 1f, pool, 10);

        assertEquals(List.of("b.md", "a.md", "c.md"), results.stream().map(ScoredResult::path).toList());
    }

    @Test
    void topKShouldHandleEmptyPoolAndNonPositiveK() {
        float[] anchor = { 1f };

        assertTrue(SimilarityRanker.topK(anchor, 1f, List.of(), 5).isEmpty());
        assertTrue(SimilarityRanker.topK(anchor, 1f, List.of(NoteVector.of("x.md", anchor)), 0).isEmpty());
    }

    @Test
    void topKShouldToleratePoolEntriesOfOtherDimensions() {
        List<NoteVector> pool = List.of(
                NoteVector.of("short.md", new float[] { 1f }),
                NoteVector.of("zero.md", new float[] { 0f, 0f, 0f }));
        float[] anchor = { 1f, 0f, 0f };

        List<ScoredResult> results = SimilarityRanker.topK(anchor, 1f, pool, 5);

        assertEquals(2, results.size());
        assertEquals("short.md", results.get(0).path());
        assertEquals(0d, results.get(1).score());
    }

    @Test
    void scoredResultShouldCoerceNonFiniteScores() {
        assertEquals(0d, new ScoredResult("x.md", Double.NaN).score());
        assertEquals(0d, new ScoredResult("x.md", Double.POSITIVE_INFINITY, "p").score());
    }

    @Test
    void noteVectorShouldNotExposeItsArray() {
        float[] source = { 1f, 0f };
        NoteVector stored = NoteVector.of("a.md", source);

        source[0] = 0f;
        stored.vector()[1] = 9f;

        assertArrayEquals(new float[] { 1f, 0f }, stored.vector());
        assertEquals(1d, SimilarityRanker.topK(new float[] { 1f, 0f }, 1f, List.of(stored), 1).get(0).score(), 1e-9);
    }
}
