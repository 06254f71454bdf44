package com.anamnesis.worker;

import java.util.List;

public record WorkerError(String type, String message, List<String> details) {
    public static final String DETECTION_FAILED = "detection-failed";
    public static final String SCHEMA_VIOLATION = "schema-violation";
    public static final String ILLEGAL_TRANSITION = "illegal-transition";
    public static final String MALFORMED_RULE_SET = "malformed-rule-set";
    public static final String MISSING_REQUIRED_FIELD = "missing-required-field";
    public static final String UNSUPPORTED_ACTION = "unsupported-action";
    public static final String MALFORMED_REQUEST = "malformed-request";
    public static final String MALFORMED_RESPONSE = "malformed-response";
    public static final String INTERNAL = "internal";

    public WorkerError {
        type = type == null || type.isBlank() ? INTERNAL : type;
        details = details == null ? List.of() : List.copyOf(details);
    }

    public WorkerError(String type, String message) {
        this(type, message, List.of());
    }
}
