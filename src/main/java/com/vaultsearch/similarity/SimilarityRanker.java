package com.vaultsearch.similarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class SimilarityRanker {
    private SimilarityRanker() {
    }

    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        return cosineOverPrefix(a, b, a.length);
    }

    public static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        double denominator = Math.sqrt(aNorm) * Math.sqrt(bNorm);
        return denominator == 0d ? 0d : dot / denominator;
    }

    /**
     * Cosine over the shared prefix {@code min(a.length, b.length)}. Trailing
     * components of the longer vector are ignored, so vectors from different
     * encoders compare without failing but the score loses meaning.
     */
    public static double tolerantCosine(float[] a, float[] b) {
        return cosineOverPrefix(a, b, Math.min(a.length, b.length));
    }

    public static float norm(float[] vector) {
        double sum = 0d;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return (float) Math.sqrt(sum);
    }

    /**
     * Ranks {@code pool} against {@code anchor} using each entry's precomputed
     * norm. Dot products run over the shared prefix; a zero norm counts as 1.
     * Ties keep pool order.
     */
    public static List<ScoredResult> topK(float[] anchor, float anchorNorm, List<NoteVector> pool, int k) {
        if (k <= 0 || pool.isEmpty()) {
            return List.of();
        }
        double safeAnchorNorm = anchorNorm == 0f ? 1d : anchorNorm;
        List<ScoredResult> scored = new ArrayList<>(pool.size());
        for (NoteVector candidate : pool) {
            double candidateNorm = candidate.norm() == 0f ? 1d : candidate.norm();
            double score = dot(anchor, candidate.components()) / (safeAnchorNorm * candidateNorm);
            scored.add(new ScoredResult(candidate.path(), score));
        }
        scored.sort(Comparator.comparingDouble(ScoredResult::score).reversed());
        return scored.size() > k ? List.copyOf(scored.subList(0, k)) : List.copyOf(scored);
    }

    private static double dot(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double sum = 0d;
        for (int i = 0; i < len; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    private static double cosineOverPrefix(float[] a, float[] b, int len) {
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < len; i++) {
            dot += (double) a[i] * b[i];
            aNorm += (double) a[i] * a[i];
            bNorm += (double) b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        return dot / Math.sqrt(aNorm * bNorm);
    }
}
