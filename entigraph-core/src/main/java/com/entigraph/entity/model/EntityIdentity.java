package com.entigraph.entity.model;

/** The four parts an entity GUID is derived from. */
public record EntityIdentity(long accountId, String domain, String type, String identifier) {}
