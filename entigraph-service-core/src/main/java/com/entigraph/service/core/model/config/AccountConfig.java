package com.entigraph.service.core.model.config;

/** Where the account id comes from: an event attribute, with an optional literal fallback. */
public record AccountConfig(String attribute, Long value) {}
