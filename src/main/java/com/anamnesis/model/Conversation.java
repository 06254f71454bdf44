package com.anamnesis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record Conversation(
        String id,
        String platform,
        double timestamp,
        List<Message> messages,
        List<Artifact> artifacts,
        Map<String, String> metadata,
        List<ProjectMembership> memberships) {

    public Conversation {
        messages = messages == null ? List.of() : List.copyOf(messages);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        memberships = memberships == null ? List.of() : List.copyOf(memberships);
    }

    public Optional<Message> findMessage(String messageId) {
        return messages.stream().filter(message -> message.id().equals(messageId)).findFirst();
    }

    public Optional<Artifact> findArtifact(String artifactId) {
        return artifacts.stream().filter(artifact -> artifact.id().equals(artifactId)).findFirst();
    }

    public Optional<String> primaryCategory() {
        return memberships.stream()
                .filter(membership -> membership.type() == MembershipType.PRIMARY)
                .map(ProjectMembership::categoryId)
                .findFirst();
    }

    @Override
    public String toString() {
        return "Conversation{id=" + id
                + ", platform=" + (platform == null ? "unknown" : platform)
                + ", messages=" + messages.size()
                + ", artifacts=" + artifacts.size() + "}";
    }
}
