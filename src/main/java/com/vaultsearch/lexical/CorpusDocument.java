package com.vaultsearch.lexical;

public record CorpusDocument(String id, String text) {

    public CorpusDocument {
        text = text == null ? "" : text;
    }
}
