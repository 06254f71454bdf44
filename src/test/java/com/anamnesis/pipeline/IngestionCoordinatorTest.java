package com.anamnesis.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.LifecycleTransition;
import com.anamnesis.parser.FormatParser;
import com.anamnesis.parser.FormatTag;
import com.anamnesis.parser.ParseException;
import com.anamnesis.parser.ValidationError;
import com.anamnesis.parser.ValidationException;
import com.anamnesis.rdf.RdfGenerator;
import com.anamnesis.rdf.RdfVocabulary;
import com.anamnesis.reasoning.ReasoningEngine;
import com.anamnesis.reasoning.ReasoningException;
import com.anamnesis.store.StoreException;
import com.anamnesis.store.TriplestoreClient;
import com.anamnesis.worker.InMemoryWorkerFactory;
import com.anamnesis.worker.LocalWorkerHandler;
import com.anamnesis.worker.WorkerCallException;
import com.anamnesis.worker.WorkerError;
import com.anamnesis.worker.WorkerHandler;
import com.anamnesis.worker.WorkerKind;
import com.anamnesis.worker.WorkerPool;
import com.anamnesis.worker.WorkerRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionCoordinatorTest {

    private static final String ENDPOINT = "http://store.test/sparql";

    private static final String EXPORT = """
            {
              "id": "conv-7",
              "platform": "generic",
              "timestamp": 1700000000,
              "messages": [
                { "id": "m1", "role": "user", "content": "write a parser", "timestamp": 1700000001 },
                { "id": "m2", "role": "assistant", "model": "gpt-4o", "provider": "openai",
                  "content": "here it is", "timestamp": 1700000002 },
                { "id": "m3", "role": "user", "content": "rename the class", "timestamp": 1700000003 }
              ],
              "artifacts": [
                { "id": "parser", "type": "code", "language": "java", "created_in": "m2",
                  "modified_in": ["m3"], "state": "modified" }
              ],
              "memberships": [ { "category": "tooling", "type": "primary" } ]
            }
            """;

    private final RecordingStore store = new RecordingStore();
    private final AtomicInteger rdfCalls = new AtomicInteger();
    private final Map<WorkerKind, WorkerPool> pools = new EnumMap<>(WorkerKind.class);
    private ReasoningEngine reasoner = new ReasoningEngine();
    private volatile boolean validatorAnswersNothing;

    @AfterEach
    void closePools() {
        pools.values().forEach(WorkerPool::close);
    }

    @Test
    void shouldIngestConversationIntoStore() throws Exception {
        IngestionCoordinator coordinator = coordinator();

        String id = coordinator.ingestContent(EXPORT, null);

        assertEquals("conv-7", id);
        assertEquals(1, store.inserts.size());
        assertEquals(ENDPOINT, store.endpoints.get(0));
        String ntriples = store.inserts.get(0);
        assertTrue(ntriples.contains("<" + RdfVocabulary.conversation("conv-7") + ">"), ntriples);
        assertTrue(ntriples.contains("<" + RdfVocabulary.artifact("conv-7", "parser") + ">"), ntriples);
        assertAllLeasesReturned();
    }

    @Test
    void shouldIngestExportFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("export.json");
        Files.writeString(file, EXPORT);

        assertEquals("conv-7", coordinator().ingestFile(file));
        assertEquals(1, store.inserts.size());
    }

    @Test
    void shouldFailAtReadStageForMissingFile(@TempDir Path dir) throws Exception {
        IngestionException error = assertThrows(IngestionException.class,
                () -> coordinator().ingestFile(dir.resolve("absent.json")));

        assertEquals(IngestionStage.READ, error.stage());
        assertTrue(store.inserts.isEmpty());
    }

    @Test
    void shouldReportUndetectableContentAtParseStage() throws Exception {
        IngestionException error = assertThrows(IngestionException.class,
                () -> coordinator().ingestContent("{\"hello\": \"world\"}", null));

        assertEquals(IngestionStage.PARSE, error.stage());
        assertEquals(ParseException.Kind.DETECTION_FAILED, assertInstanceOf(ParseException.class, error.getCause()).kind());
        assertAllLeasesReturned();
    }

    @Test
    void shouldStopAtValidationWithEveryError() throws Exception {
        String broken = EXPORT.replace("\"created_in\": \"m2\"", "\"created_in\": \"m9\"")
                .replace("\"modified_in\": [\"m3\"]", "\"modified_in\": [\"m8\"]");

        IngestionException error = assertThrows(IngestionException.class,
                () -> coordinator().ingestContent(broken, FormatTag.GENERIC));

        assertEquals(IngestionStage.VALIDATE, error.stage());
        List<ValidationError> errors = assertInstanceOf(ValidationException.class, error.getCause()).errors();
        assertEquals(2, errors.size());
        assertTrue(errors.stream().allMatch(e -> e.code() == ValidationError.Code.UNRESOLVED_REFERENCE));
        assertEquals(0, rdfCalls.get());
        assertTrue(store.inserts.isEmpty());
    }

    @Test
    void shouldStopAtReasoningWithoutGeneratingOrStoring() throws Exception {
        reasoner = ReasoningEngine.fromConfig(Map.of(
                "created", List.of("removed"),
                "modified", List.of("removed"),
                "evaluated", List.of("removed"),
                "removed", List.of()));

        IngestionException error = assertThrows(IngestionException.class, () -> coordinator().ingestContent(EXPORT, null));

        assertEquals(IngestionStage.REASONING, error.stage());
        ReasoningException cause = assertInstanceOf(ReasoningException.class, error.getCause());
        assertEquals(ReasoningException.Kind.ILLEGAL_TRANSITION, cause.kind());
        assertEquals(new LifecycleTransition(LifecycleState.CREATED, LifecycleState.MODIFIED), cause.transition());
        assertEquals(0, rdfCalls.get());
        assertTrue(store.inserts.isEmpty());
        assertAllLeasesReturned();
    }

    @Test
    void shouldReportStoreRejectionAtStoreStage() throws Exception {
        store.reject = true;

        IngestionException error = assertThrows(IngestionException.class, () -> coordinator().ingestContent(EXPORT, null));

        assertEquals(IngestionStage.STORE, error.stage());
        assertEquals(503, assertInstanceOf(StoreException.class, error.getCause()).status());
        assertEquals(1, rdfCalls.get());
        assertAllLeasesReturned();
    }

    @Test
    void shouldTreatEmptyValidationReplyAsMalformed() throws Exception {
        validatorAnswersNothing = true;

        IngestionException error = assertThrows(IngestionException.class, () -> coordinator().ingestContent(EXPORT, null));

        assertEquals(IngestionStage.VALIDATE, error.stage());
        assertEquals(WorkerError.MALFORMED_RESPONSE, assertInstanceOf(WorkerCallException.class, error.getCause()).type());
        assertEquals(0, rdfCalls.get());
        assertTrue(store.inserts.isEmpty());
        assertAllLeasesReturned();
    }

    @Test
    void shouldRequireAPoolForEveryKind() {
        Map<WorkerKind, WorkerPool> partial = new EnumMap<>(WorkerKind.class);

        assertThrows(IllegalArgumentException.class,
                () -> new IngestionCoordinator(partial, store, ENDPOINT, limits()));
    }

    private IngestionCoordinator coordinator() throws Exception {
        InMemoryWorkerFactory factory = new InMemoryWorkerFactory(this::handlerFor);
        for (WorkerKind kind : WorkerKind.values()) {
            WorkerPool pool = new WorkerPool(kind, factory, 2, 3, Duration.ofMinutes(1));
            pool.start();
            pools.put(kind, pool);
        }
        return new IngestionCoordinator(pools, store, ENDPOINT, limits());
    }

    private WorkerHandler handlerFor(WorkerKind kind) {
        LocalWorkerHandler local = new LocalWorkerHandler(kind, new FormatParser(), reasoner, new RdfGenerator());
        if (kind == WorkerKind.PARSER) {
            return request -> validatorAnswersNothing && request instanceof WorkerRequest.Validate ? null : local.handle(request);
        }
        if (kind != WorkerKind.RDF) {
            return local;
        }
        return request -> {
            rdfCalls.incrementAndGet();
            return local.handle(request);
        };
    }

    private static IngestionLimits limits() {
        return new IngestionLimits(Duration.ofSeconds(20), Duration.ofSeconds(10), Map.of());
    }

    private void assertAllLeasesReturned() {
        pools.values().forEach(pool -> assertEquals(pool.size(), pool.idleCount(), pool.toString()));
    }

    private static final class RecordingStore implements TriplestoreClient {
        private final List<String> endpoints = new ArrayList<>();
        private final List<String> inserts = new ArrayList<>();
        private boolean reject;

        @Override
        public synchronized void insert(String endpoint, String ntriples) throws StoreException {
            if (reject) {
                throw new StoreException("store unavailable", 503);
            }
            endpoints.add(endpoint);
            inserts.add(ntriples);
        }

        @Override
        public List<Map<String, String>> query(String endpoint, String sparql) {
            return List.of();
        }
    }
}
