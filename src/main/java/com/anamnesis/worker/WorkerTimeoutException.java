package com.anamnesis.worker;

public class WorkerTimeoutException extends WorkerChannelException {
    public WorkerTimeoutException(String message) {
        super(message);
    }
}
