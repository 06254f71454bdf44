package com.anamnesis.worker;

/**
 * The closed set of actions a worker understands, with the worker kind that serves each one.
 */
public enum WorkerAction {
    PING("ping", null),
    DETECT_FORMAT("detect_format", WorkerKind.PARSER),
    PARSE("parse", WorkerKind.PARSER),
    VALIDATE("validate", WorkerKind.PARSER),
    REASON("reason", WorkerKind.REASONER),
    GENERATE_RDF("generate_rdf", WorkerKind.RDF);

    private final String tag;
    private final WorkerKind servedBy;

    WorkerAction(String tag, WorkerKind servedBy) {
        this.tag = tag;
        this.servedBy = servedBy;
    }

    public String tag() {
        return tag;
    }

    /**
     * The kind of worker that serves this action; null when every kind does.
     */
    public WorkerKind servedBy() {
        return servedBy;
    }
}
