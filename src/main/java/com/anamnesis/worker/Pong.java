package com.anamnesis.worker;

public record Pong(String token, WorkerKind kind) {
}
