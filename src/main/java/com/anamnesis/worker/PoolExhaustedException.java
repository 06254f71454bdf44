package com.anamnesis.worker;

public class PoolExhaustedException extends Exception {
    private final WorkerKind kind;

    public PoolExhaustedException(WorkerKind kind, String message) {
        super(kind.label() + " pool: " + message);
        this.kind = kind;
    }

    public WorkerKind kind() {
        return kind;
    }
}
