package com.anamnesis;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.anamnesis.model.Conversation;
import com.anamnesis.parser.FormatParser;
import com.anamnesis.parser.FormatTag;
import com.anamnesis.parser.ParseException;
import com.anamnesis.parser.ValidationError;
import com.anamnesis.pipeline.IngestionException;
import com.anamnesis.rdf.RdfGenerator;
import com.anamnesis.reasoning.ReasoningEngine;
import com.anamnesis.reasoning.ReasoningException;
import com.anamnesis.runtime.AppConfig;
import com.anamnesis.runtime.IngestionRuntime;
import com.anamnesis.store.SparqlHttpTriplestoreClient;
import com.anamnesis.store.StoreException;
import com.anamnesis.store.TriplestoreClient;
import com.anamnesis.worker.LocalWorkerHandler;
import com.anamnesis.worker.ProcessWorkerChannelFactory;
import com.anamnesis.worker.WorkerChannelFactory;
import com.anamnesis.worker.WorkerKind;
import com.anamnesis.worker.WorkerServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "anamnesis",
        mixinStandardHelpOptions = true,
        version = "anamnesis 0.1.0",
        description = "Ingests LLM conversation exports into an RDF triplestore.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "ingest")
    Mode mode;

    @Option(names = "--file", description = "Conversation export to read")
    Path file;

    @Option(names = "--content", description = "Conversation export given inline")
    String content;

    @Option(names = "--format", description = "Export format: auto, claude, chatgpt, generic", defaultValue = "auto")
    String format;

    @Option(names = "--sparql", description = "SELECT query for query mode")
    String sparql;

    @Option(names = "--endpoint", description = "SPARQL endpoint overriding store.endpoint")
    String endpoint;

    @Option(names = "--worker-kind", description = "Worker kind served in worker mode: parser, reasoner, rdf")
    String workerKind;

    private WorkerChannelFactory channelFactory;
    private TriplestoreClient triplestoreClient;

    enum Mode {
        ingest,
        detect,
        validate,
        query,
        worker
    }

    public Main() {
    }

    Main(WorkerChannelFactory channelFactory, TriplestoreClient triplestoreClient) {
        this.channelFactory = channelFactory;
        this.triplestoreClient = triplestoreClient;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        if (endpoint != null && !endpoint.isBlank()) {
            config.getStore().setEndpoint(endpoint);
        }
        log.debug("Starting anamnesis in {} mode with config {}", mode, configPath);

        FormatTag requestedFormat;
        try {
            requestedFormat = FormatTag.fromLabel(format);
        } catch (IllegalArgumentException e) {
            log.error("Unknown --format {}", format);
            return 2;
        }

        return switch (mode) {
            case worker -> runWorker(config);
            case query -> runQuery(config);
            case ingest -> runIngest(config, requestedFormat);
            case detect -> runDetect();
            case validate -> runValidate(requestedFormat);
        };
    }

    private int runWorker(AppConfig config) throws IOException {
        if (workerKind == null) {
            log.error("--worker-kind is required in worker mode");
            return 2;
        }
        WorkerKind kind;
        try {
            kind = WorkerKind.valueOf(workerKind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.error("Unknown --worker-kind {}", workerKind);
            return 2;
        }
        LocalWorkerHandler handler;
        try {
            handler = new LocalWorkerHandler(kind, new FormatParser(),
                    ReasoningEngine.fromConfig(config.getReasoning().getTransitions()), new RdfGenerator());
        } catch (ReasoningException e) {
            log.error("worker.start.failed kind={} reason={}", kind.label(), e.getMessage());
            return 1;
        }
        new WorkerServer(handler, System.in, System.out, config.getWorkers().getMaxFrameBytes(),
                config.getWorkers().getConcurrency()).serve();
        return 0;
    }

    private int runIngest(AppConfig config, FormatTag requestedFormat) throws IOException {
        if (file == null && content == null) {
            log.error("--file or --content is required in ingest mode");
            return 2;
        }
        WorkerChannelFactory factory = channelFactory != null
                ? channelFactory
                : new ProcessWorkerChannelFactory(workerCommand(config), config.getWorkers().getMaxFrameBytes());
        try (IngestionRuntime runtime = IngestionRuntime.start(config, factory, triplestore(config))) {
            String conversationId = file != null
                    ? runtime.coordinator().ingestFile(file)
                    : runtime.coordinator().ingestContent(content, requestedFormat);
            log.info("Ingested conversation {}", conversationId);
            return 0;
        } catch (IngestionException e) {
            log.error("Ingestion failed at stage {}: {}", e.stage().stageName(), e.getCause().getMessage());
            return 1;
        }
    }

    private int runDetect() throws IOException {
        Optional<String> raw = readInput();
        if (raw.isEmpty()) {
            log.error("--file or --content is required in detect mode");
            return 2;
        }
        Optional<FormatTag> detected = new FormatParser().detect(raw.get());
        log.info("Detected format: {}", detected.map(FormatTag::label).orElse("unknown"));
        return detected.isPresent() ? 0 : 1;
    }

    private int runValidate(FormatTag requestedFormat) throws IOException {
        Optional<String> raw = readInput();
        if (raw.isEmpty()) {
            log.error("--file or --content is required in validate mode");
            return 2;
        }
        FormatParser parser = new FormatParser();
        Conversation conversation;
        try {
            conversation = parser.parse(raw.get(), requestedFormat);
        } catch (ParseException e) {
            log.error("Parse failed ({}): {}", e.kind(), e.getMessage());
            return 1;
        }
        List<ValidationError> errors = parser.validate(conversation);
        if (errors.isEmpty()) {
            log.info("Conversation {} is valid: messages={} artifacts={}",
                    conversation.id(), conversation.messages().size(), conversation.artifacts().size());
            return 0;
        }
        errors.forEach(error -> log.warn("Validation error {}", error));
        return 1;
    }

    private int runQuery(AppConfig config) {
        if (sparql == null || sparql.isBlank()) {
            log.error("--sparql is required in query mode");
            return 2;
        }
        try {
            List<Map<String, String>> rows = triplestore(config).query(config.getStore().getEndpoint(), sparql);
            for (int i = 0; i < rows.size(); i++) {
                log.info("Result #{} {}", i + 1, rows.get(i));
            }
            log.info("Query returned {} row(s)", rows.size());
            return 0;
        } catch (StoreException e) {
            log.error("Query failed: {}", e.getMessage());
            return 1;
        }
    }

    private Optional<String> readInput() throws IOException {
        if (file != null) {
            return Optional.of(Files.readString(file));
        }
        return Optional.ofNullable(content);
    }

    private TriplestoreClient triplestore(AppConfig config) {
        if (triplestoreClient != null) {
            return triplestoreClient;
        }
        return new SparqlHttpTriplestoreClient(Duration.ofMillis(config.getStore().getTimeoutMs()), config.getStore().getGraph());
    }

    private List<String> workerCommand(AppConfig config) {
        List<String> command = config.getWorkers().getCommand();
        if (command != null && !command.isEmpty()) {
            return command;
        }
        Path configFile = Path.of(configPath);
        return ProcessWorkerChannelFactory.selfCommand(Files.exists(configFile) ? configFile.toAbsolutePath() : null);
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
