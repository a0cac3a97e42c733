package com.vaultsearch.similarity;

/**
 * A stored note embedding. The array is copied on the way in and out, so a
 * published pool cannot be changed through it.
 */
public record NoteVector(String path, float[] vector, float norm) {

    public NoteVector {
        vector = vector.clone();
    }

    public static NoteVector of(String path, float[] vector) {
        return new NoteVector(path, vector, SimilarityRanker.norm(vector));
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimension() {
        return vector.length;
    }

    float[] components() {
        return vector;
    }
}
