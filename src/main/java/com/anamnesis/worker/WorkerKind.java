package com.anamnesis.worker;

import java.util.Locale;

public enum WorkerKind {
    PARSER,
    REASONER,
    RDF;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
