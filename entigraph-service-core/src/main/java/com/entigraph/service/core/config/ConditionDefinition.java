package com.entigraph.service.core.config;

import java.util.Set;

/**
 * Materialized attribute predicate. Values are kept in their stringified form so {@code 1},
 * {@code 1.0} and {@code "1"} compare equal.
 */
public record ConditionDefinition(
        String attribute, Operator operator, String value, Set<String> values, boolean negate) {

    public enum Operator {
        EQUALS,
        ANY_OF,
        PRESENT,
        ABSENT,
        PREFIX
    }
}
