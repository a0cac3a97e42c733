package com.vaultsearch;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vaultsearch.plugin.PluginSearchException;
import com.vaultsearch.retrieval.RetrievalAggregator;
import com.vaultsearch.retrieval.RetrievalRequest;
import com.vaultsearch.retrieval.RetrievalResponse;
import com.vaultsearch.retrieval.SearchMode;
import com.vaultsearch.runtime.AppConfig;
import com.vaultsearch.runtime.EnvironmentOverrides;
import com.vaultsearch.runtime.RetrievalComponents;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "vault-search",
        mixinStandardHelpOptions = true,
        version = "vault-search 0.1.0",
        description = "Similar-note retrieval over an Obsidian vault.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final String BUNDLED_CONFIG = "/application.yml";

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "search")
    Mode mode;

    @Option(names = "--query", description = "Free-text query")
    String query;

    @Option(names = "--from", description = "Vault path of the note to find neighbours for")
    String fromPath;

    @Option(names = "--limit", description = "Maximum number of results (default from config)", defaultValue = "0")
    int limit;

    @Option(names = "--search-mode", description = "Override search.mode: ${COMPLETION-CANDIDATES}")
    SearchMode searchMode;

    private final ObjectMapper jsonMapper = new ObjectMapper();

    enum Mode {
        search,
        interactive
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = EnvironmentOverrides.apply(loadConfig(Path.of(configPath)), environment());
        if (searchMode != null) {
            config.getSearch().setMode(searchMode);
        }
        log.info("Starting vault-search in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (RetrievalComponents components = createComponents(config)) {
            RetrievalAggregator aggregator = components.aggregator();
            if (mode == Mode.interactive) {
                aggregator.warmUp();
                runInteractive(aggregator);
                return 0;
            }
            boolean hasQuery = query != null && !query.isBlank();
            boolean hasFrom = fromPath != null && !fromPath.isBlank();
            if (!hasQuery && !hasFrom) {
                log.error("--query or --from is required in search mode");
                return 2;
            }
            try {
                RetrievalResponse response = aggregator.retrieve(new RetrievalRequest(query, fromPath, limit));
                output().println(jsonMapper.writeValueAsString(response));
            } catch (PluginSearchException e) {
                log.error("Plugin search failed and plugin.failurePolicy is FAIL", e);
                return 1;
            }
        }
        return 0;
    }

    Map<String, String> environment() {
        return System.getenv();
    }

    BufferedReader input() {
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    PrintStream output() {
        return System.out;
    }

    RetrievalComponents createComponents(AppConfig config) {
        return new RetrievalComponents(config);
    }

    static AppConfig loadConfig(Path config) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        if (Files.exists(config)) {
            return mapper.readValue(config.toFile(), AppConfig.class);
        }
        try (InputStream bundled = Main.class.getResourceAsStream(BUNDLED_CONFIG)) {
            if (bundled == null) {
                return new AppConfig();
            }
            log.info("Config file {} not found, using bundled defaults", config);
            return mapper.readValue(bundled, AppConfig.class);
        }
    }

    private void runInteractive(RetrievalAggregator aggregator) throws IOException {
        BufferedReader reader = input();
        PrintStream out = output();
        out.println("vault-search ready. Type a query, /from <path>, /reindex, /help or /exit.");
        while (true) {
            out.print("search> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            line = line.strip();
            if (line.isEmpty()) {
                continue;
            }
            if ("/exit".equals(line) || "/quit".equals(line)) {
                break;
            }
            if ("/help".equals(line)) {
                out.println("Commands: /from <path>, /reindex, /help, /exit. Any other line is a query.");
                continue;
            }
            if ("/reindex".equals(line)) {
                aggregator.invalidateCache();
                out.println("Vector cache cleared; next query reloads it.");
                continue;
            }

            RetrievalRequest request = line.startsWith("/from ")
                    ? RetrievalRequest.fromAnchor(line.substring("/from ".length()).strip(), limit)
                    : RetrievalRequest.ofQuery(line, limit);
            try {
                out.println(render(aggregator.retrieve(request)));
            } catch (PluginSearchException e) {
                log.error("Plugin search failed: {}", e.getMessage());
            }
        }
    }

    private String render(RetrievalResponse response) throws JsonProcessingException {
        return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
    }
}
