package com.anamnesis.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.anamnesis.worker.FrameCodec;
import com.anamnesis.worker.WorkerKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private WorkersConfig workers = new WorkersConfig();
    private StoreConfig store = new StoreConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private ReasoningConfig reasoning = new ReasoningConfig();

    public WorkersConfig getWorkers() {
        return workers;
    }

    public void setWorkers(WorkersConfig workers) {
        this.workers = workers == null ? new WorkersConfig() : workers;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public ReasoningConfig getReasoning() {
        return reasoning;
    }

    public void setReasoning(ReasoningConfig reasoning) {
        this.reasoning = reasoning == null ? new ReasoningConfig() : reasoning;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkersConfig {
        private List<String> command = new ArrayList<>();
        private int maxFrameBytes = FrameCodec.DEFAULT_MAX_FRAME_BYTES;
        private long callTimeoutMs = 30000;
        private int concurrency = 4;
        private PoolConfig parser = new PoolConfig(4);
        private PoolConfig reasoner = new PoolConfig(1);
        private PoolConfig rdf = new PoolConfig(1);

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command == null ? new ArrayList<>() : command;
        }

        public int getMaxFrameBytes() {
            return maxFrameBytes;
        }

        public void setMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public PoolConfig getParser() {
            return parser;
        }

        public void setParser(PoolConfig parser) {
            this.parser = parser == null ? new PoolConfig(4) : parser;
        }

        public PoolConfig getReasoner() {
            return reasoner;
        }

        public void setReasoner(PoolConfig reasoner) {
            this.reasoner = reasoner == null ? new PoolConfig(1) : reasoner;
        }

        public PoolConfig getRdf() {
            return rdf;
        }

        public void setRdf(PoolConfig rdf) {
            this.rdf = rdf == null ? new PoolConfig(1) : rdf;
        }

        public PoolConfig pool(WorkerKind kind) {
            return switch (kind) {
                case PARSER -> parser;
                case REASONER -> reasoner;
                case RDF -> rdf;
            };
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PoolConfig {
        private int size;
        private int maxRestarts = 5;
        private long restartWindowMs = 60000;
        private long checkoutTimeoutMs = 30000;

        public PoolConfig() {
            this(1);
        }

        public PoolConfig(int size) {
            this.size = size;
        }

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getMaxRestarts() {
            return maxRestarts;
        }

        public void setMaxRestarts(int maxRestarts) {
            this.maxRestarts = maxRestarts;
        }

        public long getRestartWindowMs() {
            return restartWindowMs;
        }

        public void setRestartWindowMs(long restartWindowMs) {
            this.restartWindowMs = restartWindowMs;
        }

        public long getCheckoutTimeoutMs() {
            return checkoutTimeoutMs;
        }

        public void setCheckoutTimeoutMs(long checkoutTimeoutMs) {
            this.checkoutTimeoutMs = checkoutTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String endpoint = "http://localhost:8890/sparql";
        private String graph = "";
        private long timeoutMs = 30000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getGraph() {
            return graph;
        }

        public void setGraph(String graph) {
            this.graph = graph;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private long timeoutMs = 120000;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReasoningConfig {
        private Map<String, List<String>> transitions = new LinkedHashMap<>();

        public Map<String, List<String>> getTransitions() {
            return transitions;
        }

        public void setTransitions(Map<String, List<String>> transitions) {
            this.transitions = transitions == null ? new LinkedHashMap<>() : transitions;
        }
    }
}
