package com.anamnesis.store;

public class StoreException extends Exception {
    private final int status;

    public StoreException(String message, int status) {
        super(message);
        this.status = status;
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * HTTP status of the failed exchange, or -1 when no response was received.
     */
    public int status() {
        return status;
    }
}
