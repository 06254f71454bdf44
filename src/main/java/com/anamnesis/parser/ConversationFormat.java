package com.anamnesis.parser;

import com.anamnesis.model.Conversation;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One export format. Implementations decode only the artifacts the export lists explicitly;
 * inline fenced code is detected afterwards by {@link FormatParser}.
 */
public interface ConversationFormat {
    FormatTag tag();

    boolean detect(JsonNode root);

    Conversation parse(JsonNode root) throws ParseException;
}
