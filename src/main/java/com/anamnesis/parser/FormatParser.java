package com.anamnesis.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class FormatParser {
    private static final Logger log = LoggerFactory.getLogger(FormatParser.class);

    private final List<ConversationFormat> formats;
    private final FencedCodeDetector fencedCodeDetector;
    private final ConversationValidator validator;
    private final ObjectMapper mapper = new ObjectMapper();

    public FormatParser() {
        this(defaultFormats(), new FencedCodeDetector(), new ConversationValidator());
    }

    public FormatParser(List<ConversationFormat> formats, FencedCodeDetector fencedCodeDetector, ConversationValidator validator) {
        this.formats = List.copyOf(formats);
        this.fencedCodeDetector = fencedCodeDetector;
        this.validator = validator;
    }

    public Optional<FormatTag> detect(String raw) {
        JsonNode root = readTree(raw).orElse(null);
        if (root == null) {
            return Optional.empty();
        }
        return formats.stream()
                .filter(format -> format.detect(root))
                .map(ConversationFormat::tag)
                .findFirst();
    }

    /**
     * Decodes raw export text. A null format means auto-detect.
     */
    public Conversation parse(String raw, FormatTag format) throws ParseException {
        JsonNode root = readTree(raw).orElse(null);
        if (root == null) {
            throw new ParseException(
                    format == null ? ParseException.Kind.DETECTION_FAILED : ParseException.Kind.SCHEMA_VIOLATION,
                    "content is not a JSON object");
        }
        ConversationFormat selected = format == null ? detectFormat(root) : formatFor(format);
        if (format != null && !selected.detect(root)) {
            throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION,
                    "content does not match the " + format.label() + " export structure");
        }
        Conversation decoded = selected.parse(root);
        Conversation conversation = withInlineArtifacts(decoded);
        log.debug("parser.parsed format={} conversation={}", selected.tag().label(), conversation);
        return conversation;
    }

    public List<ValidationError> validate(Conversation conversation) {
        return validator.validate(conversation);
    }

    private ConversationFormat detectFormat(JsonNode root) throws ParseException {
        for (ConversationFormat format : formats) {
            if (format.detect(root)) {
                return format;
            }
        }
        throw new ParseException(ParseException.Kind.DETECTION_FAILED, "no known conversation format matches the content");
    }

    private ConversationFormat formatFor(FormatTag tag) throws ParseException {
        for (ConversationFormat format : formats) {
            if (format.tag() == tag) {
                return format;
            }
        }
        throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION, "format " + tag.label() + " is not registered");
    }

    /**
     * Adds fenced-code artifacts for every message that has no explicitly listed artifact.
     */
    private Conversation withInlineArtifacts(Conversation conversation) {
        Set<String> explicitOrigins = new HashSet<>();
        for (Artifact artifact : conversation.artifacts()) {
            explicitOrigins.add(artifact.createdIn());
        }
        List<Artifact> artifacts = new ArrayList<>(conversation.artifacts());
        for (Message message : conversation.messages()) {
            if (!explicitOrigins.contains(message.id())) {
                artifacts.addAll(fencedCodeDetector.detect(message));
            }
        }
        if (artifacts.size() == conversation.artifacts().size()) {
            return conversation;
        }
        return new Conversation(
                conversation.id(),
                conversation.platform(),
                conversation.timestamp(),
                conversation.messages(),
                artifacts,
                conversation.metadata(),
                conversation.memberships());
    }

    private Optional<JsonNode> readTree(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(raw);
            return root != null && root.isObject() ? Optional.of(root) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("parser.not-json reason={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static List<ConversationFormat> defaultFormats() {
        return List.of(new ClaudeExportFormat(), new ChatGptExportFormat(), new GenericConversationFormat());
    }
}
