package com.anamnesis.worker;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.anamnesis.parser.FormatParser;
import com.anamnesis.parser.ParseException;
import com.anamnesis.rdf.NTriples;
import com.anamnesis.rdf.RdfGenerationException;
import com.anamnesis.rdf.RdfGenerator;
import com.anamnesis.rdf.Triple;
import com.anamnesis.reasoning.ReasoningEngine;
import com.anamnesis.reasoning.ReasoningException;

/**
 * Serves the actions of one worker kind with the in-process parser, reasoning engine and RDF generator.
 */
public class LocalWorkerHandler implements WorkerHandler {
    private static final Logger log = LoggerFactory.getLogger(LocalWorkerHandler.class);

    private final WorkerKind kind;
    private final FormatParser parser;
    private final ReasoningEngine engine;
    private final RdfGenerator generator;

    public LocalWorkerHandler(WorkerKind kind, FormatParser parser, ReasoningEngine engine, RdfGenerator generator) {
        this.kind = kind;
        this.parser = parser;
        this.engine = engine;
        this.generator = generator;
    }

    @Override
    public Object handle(WorkerRequest request) throws WorkerCallException {
        WorkerAction action = request.action();
        if (action.servedBy() != null && action.servedBy() != kind) {
            throw new WorkerCallException(new WorkerError(WorkerError.UNSUPPORTED_ACTION,
                    kind.label() + " worker does not serve " + action.tag()));
        }
        log.debug("worker.handle kind={} action={}", kind.label(), action.tag());
        return switch (action) {
            case PING -> new Pong(((WorkerRequest.Ping) request).token(), kind);
            case DETECT_FORMAT -> new FormatDetection(parser.detect(((WorkerRequest.DetectFormat) request).content()).orElse(null));
            case PARSE -> parse((WorkerRequest.Parse) request);
            case VALIDATE -> parser.validate(((WorkerRequest.Validate) request).conversation());
            case REASON -> reason((WorkerRequest.Reason) request);
            case GENERATE_RDF -> generate((WorkerRequest.GenerateRdf) request);
        };
    }

    private Object parse(WorkerRequest.Parse request) throws WorkerCallException {
        try {
            return parser.parse(request.content(), request.format());
        } catch (ParseException e) {
            String type = e.kind() == ParseException.Kind.DETECTION_FAILED
                    ? WorkerError.DETECTION_FAILED
                    : WorkerError.SCHEMA_VIOLATION;
            throw new WorkerCallException(new WorkerError(type, e.getMessage()), e);
        }
    }

    private Object reason(WorkerRequest.Reason request) throws WorkerCallException {
        try {
            return engine.reason(request.conversation());
        } catch (ReasoningException e) {
            if (e.kind() == ReasoningException.Kind.ILLEGAL_TRANSITION && e.transition() != null) {
                throw new WorkerCallException(new WorkerError(WorkerError.ILLEGAL_TRANSITION, e.getMessage(),
                        List.of(e.transition().from().name(), e.transition().to().name())), e);
            }
            throw new WorkerCallException(new WorkerError(WorkerError.MALFORMED_RULE_SET, e.getMessage()), e);
        }
    }

    private Object generate(WorkerRequest.GenerateRdf request) throws WorkerCallException {
        try {
            List<Triple> triples = generator.generate(request.conversation(), request.inferences());
            return new RdfDocument(NTriples.serialize(triples), triples.size());
        } catch (RdfGenerationException e) {
            throw new WorkerCallException(new WorkerError(WorkerError.MISSING_REQUIRED_FIELD, e.getMessage()), e);
        }
    }
}
