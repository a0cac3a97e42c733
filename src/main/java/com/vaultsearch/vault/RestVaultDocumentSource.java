package com.vaultsearch.vault;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultsearch.lexical.CorpusDocument;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Reads markdown notes through the vault application's Local REST API.
 * Directory listings come from {@code GET /vault/<dir>/} as a {@code files}
 * array in which sub-directories end with a slash.
 */
public class RestVaultDocumentSource implements VaultDocumentSource {
    private static final Logger log = LoggerFactory.getLogger(RestVaultDocumentSource.class);
    private static final String NOTE_SUFFIX = ".md";

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final ObjectMapper mapper = new ObjectMapper();

    public RestVaultDocumentSource(OkHttpClient httpClient, String baseUrl, String apiKey, Duration timeout) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Vault base URL is not a valid HTTP URL: " + baseUrl);
        }
        this.httpClient = httpClient.newBuilder()
                .callTimeout(timeout)
                .build();
        this.baseUrl = parsed;
        this.apiKey = apiKey;
    }

    @Override
    public List<CorpusDocument> documents() throws IOException {
        List<String> notes = listNotes();
        List<CorpusDocument> documents = new ArrayList<>(notes.size());
        for (String note : notes) {
            try {
                documents.add(new CorpusDocument(note, read(note)));
            } catch (IOException e) {
                log.warn("Skipping note {}: {}", note, e.getMessage());
            }
        }
        log.debug("Read {} of {} notes from vault", documents.size(), notes.size());
        return documents;
    }

    List<String> listNotes() throws IOException {
        List<String> notes = new ArrayList<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add("");
        while (!pending.isEmpty()) {
            String directory = pending.poll();
            JsonNode listing = mapper.readTree(get(vaultUrl(directory, true), "application/json"));
            for (JsonNode entry : listing.path("files")) {
                if (!entry.isTextual() || !isVaultRelative(entry.asText())) {
                    continue;
                }
                String name = directory + entry.asText();
                if (name.endsWith("/")) {
                    pending.add(name);
                } else if (isNote(name)) {
                    notes.add(name);
                }
            }
        }
        return notes;
    }

    String read(String notePath) throws IOException {
        return get(vaultUrl(notePath, false), "text/markdown");
    }

    static boolean isVaultRelative(String entry) {
        if (entry.isEmpty() || entry.startsWith("/")) {
            return false;
        }
        for (String segment : entry.split("/")) {
            if (segment.equals(".") || segment.equals("..")) {
                return false;
            }
        }
        return true;
    }

    static boolean isNote(Path path) {
        return isNote(path.getFileName().toString());
    }

    static boolean isNote(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(NOTE_SUFFIX);
    }

    private HttpUrl vaultUrl(String path, boolean directory) {
        HttpUrl.Builder builder = baseUrl.newBuilder().addPathSegment("vault");
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                builder.addPathSegment(segment);
            }
        }
        if (directory) {
            builder.addPathSegment("");
        }
        return builder.build();
    }

    private String get(HttpUrl url, String accept) throws IOException {
        Request.Builder request = new Request.Builder()
                .url(url)
                .header("Accept", accept)
                .get();
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("GET " + url.encodedPath() + " returned HTTP " + response.code());
            }
            return body.string();
        }
    }
}
