package com.anamnesis.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.ArtifactType;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.FragmentRef;
import com.anamnesis.model.LifecycleEvent;
import com.anamnesis.model.LifecycleHistory;
import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.MembershipType;
import com.anamnesis.model.Message;
import com.anamnesis.model.ProjectMembership;
import com.anamnesis.model.Speaker;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The canonical JSON form: the shape the other formats normalize into.
 */
public class GenericConversationFormat implements ConversationFormat {

    @Override
    public FormatTag tag() {
        return FormatTag.GENERIC;
    }

    @Override
    public boolean detect(JsonNode root) {
        return root.path("id").isTextual() && root.path("messages").isArray();
    }

    @Override
    public Conversation parse(JsonNode root) throws ParseException {
        String id = JsonFields.requiredText(root, "id", "conversation");
        String context = "conversation " + id;
        try {
            List<Message> messages = new ArrayList<>();
            for (JsonNode node : JsonFields.requiredArray(root, "messages", context)) {
                messages.add(message(node, id));
            }
            List<Artifact> artifacts = new ArrayList<>();
            for (JsonNode node : root.path("artifacts")) {
                artifacts.add(artifact(node));
            }
            List<ProjectMembership> memberships = new ArrayList<>();
            for (JsonNode node : root.path("memberships")) {
                memberships.add(new ProjectMembership(
                        JsonFields.requiredText(node, "category", context + " membership"),
                        MembershipType.fromLabel(node.path("type").asText(null))));
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.path("metadata").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                metadata.put(field.getKey(), field.getValue().isTextual() ? field.getValue().asText() : field.getValue().toString());
            }
            return new Conversation(
                    id,
                    JsonFields.optionalText(root, "platform"),
                    JsonFields.timestamp(root, "timestamp", context),
                    messages,
                    artifacts,
                    metadata,
                    memberships);
        } catch (IllegalArgumentException e) {
            throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION, context + ": " + e.getMessage(), e);
        }
    }

    private static Message message(JsonNode node, String conversationId) throws ParseException {
        String id = JsonFields.requiredText(node, "id", "message");
        List<FragmentRef> references = new ArrayList<>();
        for (JsonNode ref : node.path("references")) {
            references.add(reference(ref, conversationId));
        }
        return new Message(
                id,
                speaker(node, id),
                node.path("content").asText(""),
                JsonFields.timestamp(node, "timestamp", "message " + id),
                references);
    }

    private static Speaker speaker(JsonNode node, String messageId) throws ParseException {
        JsonNode speaker = node.path("speaker");
        if (speaker.has("human")) {
            return new Speaker.Human(speaker.path("human").asText(null));
        }
        if (speaker.has("llm")) {
            JsonNode llm = speaker.path("llm");
            return new Speaker.Llm(llm.path("model").asText(null), JsonFields.optionalText(llm, "provider"));
        }
        String role = node.path("role").asText("");
        return switch (role) {
            case "user", "human" -> new Speaker.Human(JsonFields.optionalText(node, "name"));
            case "assistant", "llm" -> new Speaker.Llm(
                    JsonFields.optionalText(node, "model") == null ? "unknown" : JsonFields.optionalText(node, "model"),
                    JsonFields.optionalText(node, "provider"));
            default -> throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION,
                    "message " + messageId + ": no speaker or role");
        };
    }

    private static FragmentRef reference(JsonNode ref, String conversationId) throws ParseException {
        if (ref.isTextual()) {
            return FragmentRef.message(conversationId, ref.asText());
        }
        String kind = ref.path("kind").asText("message");
        String target = JsonFields.requiredText(ref, "id", "reference");
        String owner = JsonFields.optionalText(ref, "conversation");
        return new FragmentRef(
                owner == null ? conversationId : owner,
                FragmentRef.Kind.valueOf(kind.toUpperCase(Locale.ROOT)),
                target);
    }

    private static Artifact artifact(JsonNode node) throws ParseException {
        String id = JsonFields.requiredText(node, "id", "artifact");
        List<String> modifiedIn = new ArrayList<>();
        for (JsonNode messageId : node.path("modified_in")) {
            modifiedIn.add(messageId.asText());
        }
        List<LifecycleEvent> history = new ArrayList<>();
        for (JsonNode event : node.path("history")) {
            history.add(new LifecycleEvent(
                    LifecycleState.fromLabel(event.path("state").asText(null)),
                    JsonFields.timestamp(event, "timestamp", "artifact " + id + " history")));
        }
        String declaredState = JsonFields.optionalText(node, "state");
        LifecycleState state = declaredState == null
                ? LifecycleHistory.impliedState(modifiedIn, history)
                : LifecycleState.fromLabel(declaredState);
        return new Artifact(
                id,
                JsonFields.optionalText(node, "name"),
                ArtifactType.fromLabel(JsonFields.optionalText(node, "type"), JsonFields.optionalText(node, "language")),
                node.path("content").asText(""),
                node.path("created_in").asText(null),
                modifiedIn,
                state,
                history);
    }
}
