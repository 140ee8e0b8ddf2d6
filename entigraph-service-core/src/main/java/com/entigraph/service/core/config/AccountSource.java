package com.entigraph.service.core.config;

/** Account id taken from {@code attribute} when present, else the literal {@code fallback}. */
public record AccountSource(String attribute, Long fallback) {}
