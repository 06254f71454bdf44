package com.anamnesis.reasoning;

import com.anamnesis.model.LifecycleTransition;

public class ReasoningException extends Exception {
    public enum Kind {
        ILLEGAL_TRANSITION,
        MALFORMED_RULE_SET
    }

    private final Kind kind;
    private final LifecycleTransition transition;

    public ReasoningException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ReasoningException(Kind kind, String message, LifecycleTransition transition, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.transition = transition;
    }

    public static ReasoningException illegalTransition(LifecycleTransition transition, String subject) {
        return new ReasoningException(Kind.ILLEGAL_TRANSITION,
                "illegal lifecycle transition " + transition + (subject == null ? "" : " in " + subject),
                transition,
                null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The offending pair for {@link Kind#ILLEGAL_TRANSITION}; null otherwise.
     */
    public LifecycleTransition transition() {
        return transition;
    }
}
