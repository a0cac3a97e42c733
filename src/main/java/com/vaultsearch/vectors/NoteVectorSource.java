package com.vaultsearch.vectors;

import java.util.List;

import com.vaultsearch.similarity.NoteVector;

public interface NoteVectorSource {
    List<NoteVector> loadAll();

    default String label() {
        return "vectors";
    }
}
