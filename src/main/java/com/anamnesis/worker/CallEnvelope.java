package com.anamnesis.worker;

public record CallEnvelope(long id, WorkerRequest request) {
}
