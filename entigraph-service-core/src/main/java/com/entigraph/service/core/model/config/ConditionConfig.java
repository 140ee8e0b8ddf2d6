package com.entigraph.service.core.model.config;

import java.util.List;

/**
 * Attribute predicate. Exactly one of {@code value}, {@code anyOf}, {@code present} or
 * {@code prefix} must be set; {@code negate} inverts the outcome.
 */
public record ConditionConfig(
        String attribute, Object value, List<Object> anyOf, Boolean present, String prefix, Boolean negate) {

    public static ConditionConfig equalTo(String attribute, Object value) {
        return new ConditionConfig(attribute, value, null, null, null, null);
    }

    public static ConditionConfig anyOf(String attribute, List<Object> values) {
        return new ConditionConfig(attribute, null, values, null, null, null);
    }

    public static ConditionConfig present(String attribute, boolean present) {
        return new ConditionConfig(attribute, null, null, present, null, null);
    }
}
