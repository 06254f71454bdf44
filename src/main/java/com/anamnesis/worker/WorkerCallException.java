package com.anamnesis.worker;

/**
 * A worker answered the call with an error. The call itself reached the worker and came back.
 */
public class WorkerCallException extends Exception {
    private final WorkerError error;

    public WorkerCallException(WorkerError error) {
        this(error, null);
    }

    public WorkerCallException(WorkerError error, Throwable cause) {
        super(error.type() + ": " + error.message(), cause);
        this.error = error;
    }

    public WorkerError error() {
        return error;
    }

    public String type() {
        return error.type();
    }
}
