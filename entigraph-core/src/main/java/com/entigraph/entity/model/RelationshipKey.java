package com.entigraph.entity.model;

/** Identity of a directed relationship. */
public record RelationshipKey(RelationshipType type, String sourceGuid, String targetGuid) {}
