package com.anamnesis.rdf;

/**
 * Subject and predicate are URIs; the object is a URI or an already quoted literal.
 */
public record Triple(String subject, String predicate, String object) {
    public Triple {
        if (subject == null || predicate == null || object == null) {
            throw new IllegalArgumentException("triple terms must not be null");
        }
    }
}
