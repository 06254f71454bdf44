package com.anamnesis.model;

public record ProjectMembership(String categoryId, MembershipType type) {
    public ProjectMembership {
        if (categoryId == null || categoryId.isBlank()) {
            throw new IllegalArgumentException("membership category is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("membership type is required");
        }
    }
}
