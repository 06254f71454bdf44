package com.anamnesis.worker;

import java.io.IOException;

public class WorkerChannelException extends IOException {
    public WorkerChannelException(String message) {
        super(message);
    }

    public WorkerChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
