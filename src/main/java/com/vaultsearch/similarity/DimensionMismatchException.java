package com.vaultsearch.similarity;

public class DimensionMismatchException extends IllegalArgumentException {
    private final int left;
    private final int right;

    public DimensionMismatchException(int left, int right) {
        super("Vectors must be of same length: " + left + " != " + right);
        this.left = left;
        this.right = right;
    }

    public int left() {
        return left;
    }

    public int right() {
        return right;
    }
}
