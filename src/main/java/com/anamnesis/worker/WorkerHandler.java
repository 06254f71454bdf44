package com.anamnesis.worker;

/**
 * Worker-side request handling. Implementations must be safe for concurrent calls.
 */
public interface WorkerHandler {
    /**
     * @return the result value, serialized as the response's result
     * @throws WorkerCallException to answer the call with an error
     */
    Object handle(WorkerRequest request) throws WorkerCallException;
}
