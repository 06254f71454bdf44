package com.anamnesis.worker;

public record RdfDocument(String ntriples, int tripleCount) {
}
