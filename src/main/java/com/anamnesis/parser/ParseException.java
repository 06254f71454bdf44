package com.anamnesis.parser;

public class ParseException extends Exception {
    public enum Kind {
        DETECTION_FAILED,
        SCHEMA_VIOLATION
    }

    private final Kind kind;

    public ParseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ParseException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
