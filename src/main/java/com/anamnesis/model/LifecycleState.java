package com.anamnesis.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum LifecycleState {
    CREATED,
    MODIFIED,
    REMOVED,
    EVALUATED;

    public Set<LifecycleState> legalSuccessors() {
        return switch (this) {
            case CREATED -> EnumSet.of(MODIFIED, REMOVED);
            case MODIFIED -> EnumSet.of(MODIFIED, EVALUATED, REMOVED);
            case EVALUATED -> EnumSet.of(REMOVED);
            case REMOVED -> EnumSet.noneOf(LifecycleState.class);
        };
    }

    public static LifecycleState fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return CREATED;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
