package com.anamnesis.parser;

import java.util.Locale;

public enum FormatTag {
    CLAUDE,
    CHATGPT,
    GENERIC;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FormatTag fromLabel(String label) {
        if (label == null || label.isBlank() || "auto".equalsIgnoreCase(label)) {
            return null;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
