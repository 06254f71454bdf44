package com.anamnesis.model;

import java.util.Locale;

public enum MembershipType {
    PRIMARY(1.0),
    SECONDARY(0.6),
    TANGENTIAL(0.3);

    private final double weight;

    MembershipType(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }

    public static MembershipType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("membership type is required");
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
