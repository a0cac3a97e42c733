package com.vaultsearch.vectors;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultsearch.similarity.NoteVector;
import com.vaultsearch.vault.NotePaths;

/**
 * Reads the per-note embeddings an external indexer writes under
 * {@code <root>/multi/**.ajson}. Files are visited in path order so the
 * returned list is stable across loads.
 *
 * <p>When a record holds vectors for several models, {@code preferredModel}
 * picks one; without it the first model key of the file is used, which is
 * deterministic per file but not across models.
 */
public class SmartEnvVectorStore implements NoteVectorSource {
    private static final Logger log = LoggerFactory.getLogger(SmartEnvVectorStore.class);
    static final String SUBDIRECTORY = "multi";
    static final String SUFFIX = ".ajson";
    private static final String SOURCE_KEY_PREFIX = "smart_sources:";
    private static final List<String> PATH_FIELDS = List.of("path", "notePath", "filePath", "source");

    private final Path root;
    private final String preferredModel;
    private final ObjectMapper mapper = new ObjectMapper();
    private volatile String lastModel;

    public SmartEnvVectorStore(Path root, String preferredModel) {
        this.root = root;
        this.preferredModel = preferredModel == null || preferredModel.isBlank() ? null : preferredModel;
    }

    @Override
    public List<NoteVector> loadAll() {
        if (root == null) {
            return List.of();
        }
        Path directory = root.resolve(SUBDIRECTORY);
        if (!Files.isDirectory(directory)) {
            log.debug("Vector store directory {} missing; empty pool", directory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Unable to list vector store {}", directory, e);
            return List.of();
        }

        List<NoteVector> vectors = new ArrayList<>(files.size());
        int skipped = 0;
        for (Path file : files) {
            try {
                vectors.add(read(file));
            } catch (MalformedRecordException e) {
                skipped++;
                log.warn("Skipping malformed vector record: {}", e.getMessage());
            } catch (IOException e) {
                skipped++;
                log.warn("Skipping unreadable vector record {}", file, e);
            }
        }
        log.debug("Loaded {} note vectors from {} ({} skipped)", vectors.size(), directory, skipped);
        return vectors;
    }

    @Override
    public String label() {
        if (preferredModel != null) {
            return preferredModel;
        }
        return lastModel == null ? "smart-env" : lastModel;
    }

    NoteVector read(Path file) throws IOException {
        String raw = Files.readString(file, StandardCharsets.UTF_8).strip();
        if (raw.isEmpty()) {
            throw new MalformedRecordException(file, "empty file");
        }
        JsonNode root;
        try {
            root = mapper.readTree(raw.startsWith("{") ? raw : asObject(raw));
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(file, e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedRecordException(file, "not a JSON object");
        }

        String key = null;
        JsonNode record = root;
        if (!root.path("embeddings").isObject()) {
            Map.Entry<String, JsonNode> entry = selectEntry(root);
            if (entry == null) {
                throw new MalformedRecordException(file, "no embeddings");
            }
            key = entry.getKey();
            record = entry.getValue();
        }

        float[] vector = extractVector(file, record.path("embeddings"));
        return NoteVector.of(notePath(file, key, record), vector);
    }

    private static String asObject(String fragment) {
        String body = fragment;
        while (body.endsWith(",")) {
            body = body.substring(0, body.length() - 1).stripTrailing();
        }
        return "{" + body + "}";
    }

    private static Map.Entry<String, JsonNode> selectEntry(JsonNode root) {
        Map.Entry<String, JsonNode> last = null;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().path("embeddings").isObject()) {
                continue;
            }
            if (field.getKey().startsWith(SOURCE_KEY_PREFIX)) {
                return field;
            }
            last = field;
        }
        return last;
    }

    private float[] extractVector(Path file, JsonNode embeddings) throws MalformedRecordException {
        JsonNode selected = null;
        String model = null;
        if (preferredModel != null && embeddings.path(preferredModel).path("vec").isArray()) {
            selected = embeddings.path(preferredModel).path("vec");
            model = preferredModel;
        } else {
            Iterator<Map.Entry<String, JsonNode>> models = embeddings.fields();
            while (models.hasNext()) {
                Map.Entry<String, JsonNode> candidate = models.next();
                if (candidate.getValue().path("vec").isArray()) {
                    selected = candidate.getValue().path("vec");
                    model = candidate.getKey();
                    break;
                }
            }
        }
        if (selected == null || selected.isEmpty()) {
            throw new MalformedRecordException(file, "no vec array");
        }

        float[] vector = new float[selected.size()];
        for (int i = 0; i < selected.size(); i++) {
            JsonNode value = selected.get(i);
            if (!value.isNumber()) {
                throw new MalformedRecordException(file, "non-numeric vec entry at " + i);
            }
            vector[i] = value.floatValue();
        }
        lastModel = model;
        return vector;
    }

    private static String notePath(Path file, String key, JsonNode record) {
        for (String field : PATH_FIELDS) {
            JsonNode value = record.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return NotePaths.toPosix(value.asText());
            }
        }
        if (key != null && key.startsWith(SOURCE_KEY_PREFIX) && key.length() > SOURCE_KEY_PREFIX.length()) {
            return NotePaths.toPosix(key.substring(SOURCE_KEY_PREFIX.length()));
        }
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - SUFFIX.length());
    }
}
