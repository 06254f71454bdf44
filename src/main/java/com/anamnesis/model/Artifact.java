package com.anamnesis.model;

import java.util.List;

public record Artifact(
        String id,
        String name,
        ArtifactType type,
        String content,
        String createdIn,
        List<String> modifiedIn,
        LifecycleState state,
        List<LifecycleEvent> history) {

    public Artifact {
        type = type == null ? ArtifactType.other("unknown") : type;
        content = content == null ? "" : content;
        modifiedIn = modifiedIn == null ? List.of() : List.copyOf(modifiedIn);
        state = state == null ? LifecycleState.CREATED : state;
        history = history == null ? List.of() : List.copyOf(history);
    }
}
