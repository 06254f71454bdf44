package com.anamnesis.model;

import java.util.List;

public record Message(String id, Speaker speaker, String content, double timestamp, List<FragmentRef> references) {
    public Message {
        if (speaker == null) {
            throw new IllegalArgumentException("message " + id + " requires a speaker");
        }
        content = content == null ? "" : content;
        references = references == null ? List.of() : List.copyOf(references);
    }

    public Message(String id, Speaker speaker, String content, double timestamp) {
        this(id, speaker, content, timestamp, List.of());
    }
}
