package com.anamnesis.reasoning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.anamnesis.model.LifecycleState;

public record Inferences(
        String conversationId,
        Map<String, LifecycleState> artifactStates,
        MembershipScores membership,
        double contaminationRisk,
        List<ReferenceEdge> crossConversationRefs) {

    public Inferences {
        artifactStates = artifactStates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(artifactStates));
        membership = membership == null ? MembershipScores.uncategorizedScores() : membership;
        crossConversationRefs = crossConversationRefs == null ? List.of() : List.copyOf(crossConversationRefs);
    }

    public static Inferences empty(String conversationId) {
        return new Inferences(conversationId, Map.of(), MembershipScores.uncategorizedScores(), 0.0, List.of());
    }
}
