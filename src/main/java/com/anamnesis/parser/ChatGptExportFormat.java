package com.anamnesis.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.anamnesis.model.Conversation;
import com.anamnesis.model.Message;
import com.anamnesis.model.Speaker;
import com.fasterxml.jackson.databind.JsonNode;

public class ChatGptExportFormat implements ConversationFormat {

    @Override
    public FormatTag tag() {
        return FormatTag.CHATGPT;
    }

    @Override
    public boolean detect(JsonNode root) {
        return root.path("title").isTextual() && root.path("mapping").isObject();
    }

    @Override
    public Conversation parse(JsonNode root) throws ParseException {
        String id = JsonFields.optionalText(root, "conversation_id");
        if (id == null) {
            id = JsonFields.requiredText(root, "id", "chatgpt conversation");
        }
        double timestamp = JsonFields.timestamp(root, "create_time", "chatgpt conversation " + id);

        List<OrderedMessage> ordered = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> nodes = root.path("mapping").fields();
        int position = 0;
        while (nodes.hasNext()) {
            Map.Entry<String, JsonNode> entry = nodes.next();
            JsonNode message = entry.getValue().path("message");
            if (!message.isObject()) {
                continue;
            }
            String role = message.path("author").path("role").asText("");
            if (!"user".equals(role) && !"assistant".equals(role)) {
                continue;
            }
            String messageId = JsonFields.optionalText(message, "id");
            if (messageId == null) {
                messageId = entry.getKey();
            }
            double created = message.path("create_time").isNumber()
                    ? message.path("create_time").asDouble()
                    : timestamp;
            Speaker speaker = "user".equals(role)
                    ? new Speaker.Human("user")
                    : new Speaker.Llm(modelSlug(message), "openai");
            ordered.add(new OrderedMessage(position++, new Message(messageId, speaker, parts(message), created)));
        }
        ordered.sort(Comparator.comparingDouble((OrderedMessage m) -> m.message().timestamp())
                .thenComparingInt(OrderedMessage::position));

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("title", root.path("title").asText());
        return new Conversation(
                id,
                "chatgpt",
                timestamp,
                ordered.stream().map(OrderedMessage::message).toList(),
                List.of(),
                metadata,
                List.of());
    }

    private static String modelSlug(JsonNode message) {
        String slug = JsonFields.optionalText(message.path("metadata"), "model_slug");
        return slug == null ? "gpt" : slug;
    }

    private static String parts(JsonNode message) {
        StringBuilder builder = new StringBuilder();
        for (JsonNode part : message.path("content").path("parts")) {
            if (!part.isTextual()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(part.asText());
        }
        return builder.toString();
    }

    private record OrderedMessage(int position, Message message) {
    }
}
