package com.anamnesis.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.anamnesis.model.Conversation;
import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.LifecycleTransition;
import com.anamnesis.parser.FormatTag;
import com.anamnesis.parser.ParseException;
import com.anamnesis.parser.ValidationError;
import com.anamnesis.parser.ValidationException;
import com.anamnesis.rdf.RdfGenerationException;
import com.anamnesis.reasoning.Inferences;
import com.anamnesis.reasoning.ReasoningException;
import com.anamnesis.store.StoreException;
import com.anamnesis.store.TriplestoreClient;
import com.anamnesis.worker.PoolExhaustedException;
import com.anamnesis.worker.RdfDocument;
import com.anamnesis.worker.WorkerCallException;
import com.anamnesis.worker.WorkerChannel;
import com.anamnesis.worker.WorkerChannelException;
import com.anamnesis.worker.WorkerError;
import com.anamnesis.worker.WorkerKind;
import com.anamnesis.worker.WorkerPool;
import com.anamnesis.worker.WorkerRequest;
import com.anamnesis.worker.WorkerTimeoutException;
import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Drives one conversation export through parse, validate, reasoning, RDF generation and store. The
 * coordinator keeps no state between ingestions, so concurrent ingestions are independent; each holds
 * at most one channel per worker kind for its whole run.
 */
public class IngestionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);
    private static final TypeReference<List<ValidationError>> VALIDATION_ERRORS = new TypeReference<>() {
    };

    private final Map<WorkerKind, WorkerPool> pools;
    private final TriplestoreClient store;
    private final String endpoint;
    private final IngestionLimits limits;

    public IngestionCoordinator(Map<WorkerKind, WorkerPool> pools, TriplestoreClient store, String endpoint, IngestionLimits limits) {
        for (WorkerKind kind : WorkerKind.values()) {
            if (!pools.containsKey(kind)) {
                throw new IllegalArgumentException("no " + kind.label() + " pool configured");
            }
        }
        this.pools = new EnumMap<>(pools);
        this.store = store;
        this.endpoint = endpoint;
        this.limits = limits;
    }

    public String ingestFile(Path path) throws IngestionException {
        long deadline = System.nanoTime() + limits.overall().toNanos();
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            log.error("ingest.failed stage={} source={} reason={}", IngestionStage.READ.stageName(), path, e.getMessage());
            throw new IngestionException(IngestionStage.READ, e);
        }
        return run(content, null, path.toString(), deadline);
    }

    /**
     * @param format the export format, or null to detect it
     */
    public String ingestContent(String content, FormatTag format) throws IngestionException {
        long deadline = System.nanoTime() + limits.overall().toNanos();
        return run(content, format, "inline", deadline);
    }

    private String run(String content, FormatTag format, String source, long deadline) throws IngestionException {
        Leases leases = new Leases(deadline);
        try {
            Conversation conversation = parse(leases, content, format);
            validate(leases, conversation);
            Inferences inferences = reason(leases, conversation);
            RdfDocument document = generate(leases, conversation, inferences);
            persist(document);
            log.info("ingest.completed conversation={} source={} messages={} artifacts={} triples={}",
                    conversation.id(), source, conversation.messages().size(), conversation.artifacts().size(),
                    document.tripleCount());
            return conversation.id();
        } catch (IngestionException e) {
            log.error("ingest.failed stage={} source={} reason={}", e.stage().stageName(), source,
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            throw e;
        } finally {
            leases.releaseAll();
        }
    }

    private Conversation parse(Leases leases, String content, FormatTag format) throws IngestionException {
        IngestionStage stage = IngestionStage.PARSE;
        try {
            return leases.call(WorkerKind.PARSER, stage, new WorkerRequest.Parse(content, format), Conversation.class);
        } catch (WorkerCallException e) {
            throw new IngestionException(stage, switch (e.type()) {
                case WorkerError.DETECTION_FAILED -> new ParseException(ParseException.Kind.DETECTION_FAILED, e.error().message(), e);
                case WorkerError.SCHEMA_VIOLATION -> new ParseException(ParseException.Kind.SCHEMA_VIOLATION, e.error().message(), e);
                default -> e;
            });
        }
    }

    private void validate(Leases leases, Conversation conversation) throws IngestionException {
        IngestionStage stage = IngestionStage.VALIDATE;
        List<ValidationError> errors;
        try {
            errors = leases.call(WorkerKind.PARSER, stage, new WorkerRequest.Validate(conversation), VALIDATION_ERRORS);
        } catch (WorkerCallException e) {
            throw new IngestionException(stage, e);
        }
        if (!errors.isEmpty()) {
            throw new IngestionException(stage, new ValidationException(errors));
        }
    }

    private Inferences reason(Leases leases, Conversation conversation) throws IngestionException {
        IngestionStage stage = IngestionStage.REASONING;
        try {
            return leases.call(WorkerKind.REASONER, stage, new WorkerRequest.Reason(conversation), Inferences.class);
        } catch (WorkerCallException e) {
            throw new IngestionException(stage, switch (e.type()) {
                case WorkerError.ILLEGAL_TRANSITION -> new ReasoningException(ReasoningException.Kind.ILLEGAL_TRANSITION,
                        e.error().message(), transitionOf(e.error()), e);
                case WorkerError.MALFORMED_RULE_SET -> new ReasoningException(ReasoningException.Kind.MALFORMED_RULE_SET,
                        e.error().message(), null, e);
                default -> e;
            });
        }
    }

    private RdfDocument generate(Leases leases, Conversation conversation, Inferences inferences) throws IngestionException {
        IngestionStage stage = IngestionStage.RDF_GENERATION;
        try {
            return leases.call(WorkerKind.RDF, stage, new WorkerRequest.GenerateRdf(conversation, inferences), RdfDocument.class);
        } catch (WorkerCallException e) {
            throw new IngestionException(stage, WorkerError.MISSING_REQUIRED_FIELD.equals(e.type())
                    ? new RdfGenerationException(e.error().message(), e)
                    : e);
        }
    }

    private void persist(RdfDocument document) throws IngestionException {
        try {
            store.insert(endpoint, document.ntriples());
        } catch (StoreException e) {
            throw new IngestionException(IngestionStage.STORE, e);
        }
    }

    private static LifecycleTransition transitionOf(WorkerError error) {
        if (error.details().size() != 2) {
            return null;
        }
        try {
            return new LifecycleTransition(LifecycleState.valueOf(error.details().get(0)), LifecycleState.valueOf(error.details().get(1)));
        } catch (IllegalArgumentException e) {
            log.debug("ingest.transition.unreadable details={}", error.details());
            return null;
        }
    }

    /**
     * The channels one ingestion has checked out, at most one per kind, and its deadline.
     */
    private final class Leases {
        private final long deadline;
        private final Map<WorkerKind, WorkerChannel> held = new EnumMap<>(WorkerKind.class);

        private Leases(long deadline) {
            this.deadline = deadline;
        }

        <T> T call(WorkerKind kind, IngestionStage stage, WorkerRequest request, Class<T> resultType)
                throws IngestionException, WorkerCallException {
            WorkerChannel channel = channel(kind, stage);
            try {
                return required(stage, channel.call(request, resultType, callTimeout(stage)));
            } catch (WorkerChannelException e) {
                throw new IngestionException(stage, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IngestionException(stage, e);
            }
        }

        <T> T call(WorkerKind kind, IngestionStage stage, WorkerRequest request, TypeReference<T> resultType)
                throws IngestionException, WorkerCallException {
            WorkerChannel channel = channel(kind, stage);
            try {
                return required(stage, channel.call(request, resultType, callTimeout(stage)));
            } catch (WorkerChannelException e) {
                throw new IngestionException(stage, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IngestionException(stage, e);
            }
        }

        private WorkerChannel channel(WorkerKind kind, IngestionStage stage) throws IngestionException {
            WorkerChannel channel = held.get(kind);
            if (channel != null) {
                return channel;
            }
            Duration wait = min(limits.checkoutFor(kind), remaining(stage));
            try {
                channel = pools.get(kind).checkout(wait);
            } catch (PoolExhaustedException e) {
                throw new IngestionException(stage, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IngestionException(stage, e);
            }
            held.put(kind, channel);
            return channel;
        }

        private Duration callTimeout(IngestionStage stage) throws IngestionException {
            return min(limits.call(), remaining(stage));
        }

        private Duration remaining(IngestionStage stage) throws IngestionException {
            long left = deadline - System.nanoTime();
            if (left <= 0) {
                throw new IngestionException(stage, new WorkerTimeoutException(
                        "ingestion deadline of " + limits.overall().toMillis() + "ms passed"));
            }
            return Duration.ofNanos(left);
        }

        private <T> T required(IngestionStage stage, T value) throws IngestionException {
            if (value == null) {
                throw new IngestionException(stage, new WorkerCallException(
                        new WorkerError(WorkerError.MALFORMED_RESPONSE, stage.stageName() + " call returned no result")));
            }
            return value;
        }

        void releaseAll() {
            held.forEach((kind, channel) -> pools.get(kind).checkin(channel));
            held.clear();
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
