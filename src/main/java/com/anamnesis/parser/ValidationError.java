package com.anamnesis.parser;

public record ValidationError(Code code, String subject, String message) {

    public enum Code {
        EMPTY_CONVERSATION_ID,
        DUPLICATE_MESSAGE_ID,
        NEGATIVE_TIMESTAMP,
        EMPTY_ARTIFACT_ID,
        UNRESOLVED_REFERENCE,
        ILLEGAL_TRANSITION
    }

    @Override
    public String toString() {
        return code + "[" + subject + "]: " + message;
    }
}
