package com.anamnesis.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.ArtifactType;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.MembershipType;
import com.anamnesis.model.Message;
import com.anamnesis.model.ProjectMembership;
import com.anamnesis.model.Speaker;
import com.fasterxml.jackson.databind.JsonNode;

public class ClaudeExportFormat implements ConversationFormat {
    static final Speaker ASSISTANT = new Speaker.Llm("claude", "anthropic");

    @Override
    public FormatTag tag() {
        return FormatTag.CLAUDE;
    }

    @Override
    public boolean detect(JsonNode root) {
        return root.path("uuid").isTextual() && root.path("chat_messages").isArray();
    }

    @Override
    public Conversation parse(JsonNode root) throws ParseException {
        String id = JsonFields.requiredText(root, "uuid", "claude conversation");
        double timestamp = JsonFields.timestamp(root, "created_at", "claude conversation " + id);

        List<Message> messages = new ArrayList<>();
        List<Artifact> artifacts = new ArrayList<>();
        for (JsonNode node : JsonFields.requiredArray(root, "chat_messages", "claude conversation " + id)) {
            String messageId = JsonFields.requiredText(node, "uuid", "claude message");
            messages.add(new Message(
                    messageId,
                    speaker(node, messageId),
                    text(node),
                    JsonFields.timestamp(node, "created_at", "claude message " + messageId)));
            artifacts.addAll(attachments(node, messageId));
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        String name = JsonFields.optionalText(root, "name");
        if (name != null) {
            metadata.put("name", name);
        }
        String updatedAt = JsonFields.optionalText(root, "updated_at");
        if (updatedAt != null) {
            metadata.put("updated_at", updatedAt);
        }

        List<ProjectMembership> memberships = new ArrayList<>();
        String project = JsonFields.optionalText(root.path("project"), "uuid");
        if (project == null) {
            project = JsonFields.optionalText(root, "project_uuid");
        }
        if (project != null) {
            memberships.add(new ProjectMembership(project, MembershipType.PRIMARY));
        }

        return new Conversation(id, "claude", timestamp, messages, artifacts, metadata, memberships);
    }

    private static Speaker speaker(JsonNode node, String messageId) throws ParseException {
        String sender = JsonFields.requiredText(node, "sender", "claude message " + messageId);
        return switch (sender) {
            case "human" -> new Speaker.Human("user");
            case "assistant" -> ASSISTANT;
            default -> throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION,
                    "claude message " + messageId + ": unknown sender '" + sender + "'");
        };
    }

    private static String text(JsonNode node) {
        String text = node.path("text").asText("");
        if (!text.isBlank() || !node.path("content").isArray()) {
            return text;
        }
        StringBuilder builder = new StringBuilder();
        for (JsonNode part : node.path("content")) {
            if (part.path("text").isTextual()) {
                if (builder.length() > 0) {
                    builder.append('\n');
                }
                builder.append(part.path("text").asText());
            }
        }
        return builder.toString();
    }

    private static List<Artifact> attachments(JsonNode node, String messageId) {
        List<Artifact> artifacts = new ArrayList<>();
        int ordinal = 0;
        for (JsonNode attachment : node.path("attachments")) {
            ordinal++;
            String id = JsonFields.optionalText(attachment, "id");
            String name = JsonFields.optionalText(attachment, "title");
            String content = JsonFields.optionalText(attachment, "content");
            String type = JsonFields.optionalText(attachment, "type");
            artifacts.add(new Artifact(
                    id == null ? "attachment-" + messageId + "-" + ordinal : id,
                    name == null ? JsonFields.optionalText(attachment, "file_name") : name,
                    ArtifactType.fromLabel(type == null ? JsonFields.optionalText(attachment, "file_type") : type,
                            JsonFields.optionalText(attachment, "language")),
                    content == null ? JsonFields.optionalText(attachment, "extracted_content") : content,
                    messageId,
                    List.of(),
                    LifecycleState.CREATED,
                    List.of()));
        }
        return artifacts;
    }
}
