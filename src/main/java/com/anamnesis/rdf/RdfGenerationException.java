package com.anamnesis.rdf;

public class RdfGenerationException extends Exception {
    public RdfGenerationException(String message) {
        super(message);
    }

    public RdfGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
