package com.anamnesis.parser;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonFields {
    private JsonFields() {
    }

    static String requiredText(JsonNode node, String field, String context) throws ParseException {
        JsonNode value = node.path(field);
        if (!value.isTextual()) {
            throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION, context + ": missing string field '" + field + "'");
        }
        return value.asText();
    }

    static String optionalText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    static JsonNode requiredArray(JsonNode node, String field, String context) throws ParseException {
        JsonNode value = node.path(field);
        if (!value.isArray()) {
            throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION, context + ": missing array field '" + field + "'");
        }
        return value;
    }

    /**
     * Epoch seconds from either a number or an RFC 3339 string; absent values read as 0.
     */
    static double timestamp(JsonNode node, String field, String context) throws ParseException {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return 0.0;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                Instant instant = Instant.parse(value.asText());
                return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
            } catch (DateTimeParseException e) {
                throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION,
                        context + ": field '" + field + "' is not an RFC 3339 timestamp: " + value.asText(), e);
            }
        }
        throw new ParseException(ParseException.Kind.SCHEMA_VIOLATION, context + ": field '" + field + "' is not a timestamp");
    }
}
