package com.anamnesis.model;

import java.util.Locale;

public record ArtifactType(Kind kind, String qualifier) {

    public enum Kind {
        CODE,
        DOCUMENTATION,
        CONFIGURATION,
        OTHER
    }

    public ArtifactType {
        if (kind == null) {
            throw new IllegalArgumentException("artifact kind is required");
        }
        if (kind == Kind.CODE && (qualifier == null || qualifier.isBlank())) {
            qualifier = "unknown";
        }
    }

    public static ArtifactType code(String language) {
        return new ArtifactType(Kind.CODE, language);
    }

    public static ArtifactType documentation() {
        return new ArtifactType(Kind.DOCUMENTATION, null);
    }

    public static ArtifactType configuration() {
        return new ArtifactType(Kind.CONFIGURATION, null);
    }

    public static ArtifactType other(String tag) {
        return new ArtifactType(Kind.OTHER, tag);
    }

    /**
     * Maps the loose type labels found in exports ("code", "document", "config", ...) onto a type.
     */
    public static ArtifactType fromLabel(String label, String language) {
        if (label == null || label.isBlank()) {
            return language == null ? other("unknown") : code(language);
        }
        return switch (label.toLowerCase(Locale.ROOT)) {
            case "code", "application/vnd.ant.code" -> code(language);
            case "doc", "docs", "document", "documentation", "markdown", "text/markdown" -> documentation();
            case "config", "configuration" -> configuration();
            default -> other(label);
        };
    }
}
