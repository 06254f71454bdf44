package com.anamnesis.pipeline;

public enum IngestionStage {
    READ("read"),
    PARSE("parse"),
    VALIDATE("validate"),
    REASONING("reasoning"),
    RDF_GENERATION("rdf-generation"),
    STORE("store");

    private final String stageName;

    IngestionStage(String stageName) {
        this.stageName = stageName;
    }

    public String stageName() {
        return stageName;
    }
}
