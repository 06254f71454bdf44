package com.anamnesis.model;

import java.util.Locale;

/**
 * Address of a message or artifact, qualified by the conversation that owns it.
 */
public record FragmentRef(String conversationId, Kind kind, String id) {

    public enum Kind {
        MESSAGE,
        ARTIFACT
    }

    public FragmentRef {
        if (kind == null || id == null || id.isBlank()) {
            throw new IllegalArgumentException("fragment reference requires a kind and an id");
        }
    }

    public static FragmentRef message(String conversationId, String messageId) {
        return new FragmentRef(conversationId, Kind.MESSAGE, messageId);
    }

    public static FragmentRef artifact(String conversationId, String artifactId) {
        return new FragmentRef(conversationId, Kind.ARTIFACT, artifactId);
    }

    @Override
    public String toString() {
        return conversationId + "/" + kind.name().toLowerCase(Locale.ROOT) + "/" + id;
    }
}
