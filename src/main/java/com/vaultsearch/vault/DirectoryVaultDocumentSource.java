package com.vaultsearch.vault;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vaultsearch.lexical.CorpusDocument;

public class DirectoryVaultDocumentSource implements VaultDocumentSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryVaultDocumentSource.class);
    private final Path vaultRoot;

    public DirectoryVaultDocumentSource(Path vaultRoot) {
        this.vaultRoot = vaultRoot;
    }

    @Override
    public List<CorpusDocument> documents() throws IOException {
        if (!Files.isDirectory(vaultRoot)) {
            return List.of();
        }
        List<Path> notes;
        try (Stream<Path> walk = Files.walk(vaultRoot)) {
            notes = walk.filter(Files::isRegularFile)
                    .filter(RestVaultDocumentSource::isNote)
                    .sorted()
                    .toList();
        }
        List<CorpusDocument> documents = new ArrayList<>(notes.size());
        for (Path note : notes) {
            String relative = vaultRoot.relativize(note).toString().replace('\\', '/');
            try {
                documents.add(new CorpusDocument(relative, Files.readString(note, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Skipping unreadable note {}", note, e);
            }
        }
        return documents;
    }
}
