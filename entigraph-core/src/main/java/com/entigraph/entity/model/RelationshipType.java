package com.entigraph.entity.model;

import java.util.Locale;

public enum RelationshipType {
    CONTAINS,
    HOSTS,
    CONSUMES_FROM,
    PRODUCES_TO,
    CONNECTS_TO,
    MANAGES,
    SERVES,
    CALLS;

    public static RelationshipType fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Relationship type must be provided");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RelationshipType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported relationship type: " + value);
    }
}
