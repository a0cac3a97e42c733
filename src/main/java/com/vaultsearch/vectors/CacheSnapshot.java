package com.vaultsearch.vectors;

import java.time.Instant;
import java.util.List;

import com.vaultsearch.similarity.NoteVector;

public record CacheSnapshot(Instant expiresAt, List<NoteVector> vectors) {

    public CacheSnapshot {
        vectors = List.copyOf(vectors);
    }

    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt);
    }

    public int size() {
        return vectors.size();
    }
}
