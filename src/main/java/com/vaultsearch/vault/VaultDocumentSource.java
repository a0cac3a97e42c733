package com.vaultsearch.vault;

import java.io.IOException;
import java.util.List;

import com.vaultsearch.lexical.CorpusDocument;

public interface VaultDocumentSource {
    List<CorpusDocument> documents() throws IOException;
}
