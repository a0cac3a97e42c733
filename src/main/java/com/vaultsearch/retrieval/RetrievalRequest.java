package com.vaultsearch.retrieval;

public record RetrievalRequest(String query, String anchorPath, int limit) {

    public static RetrievalRequest ofQuery(String query, int limit) {
        return new RetrievalRequest(query, null, limit);
    }

    public static RetrievalRequest fromAnchor(String anchorPath, int limit) {
        return new RetrievalRequest(null, anchorPath, limit);
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }

    public boolean hasAnchor() {
        return anchorPath != null && !anchorPath.isBlank();
    }
}
