package com.entigraph.service.core.support;

import com.entigraph.telemetry.model.TelemetryEvent;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/** Canonical string form of scalar attribute values, shared by rule loading and evaluation. */
public final class AttributeValues {

    private AttributeValues() {}

    public static String stringify(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return Objects.toString(value);
    }

    /** Stringified attribute value; absent, null and blank values are all "not present". */
    public static Optional<String> stringValue(TelemetryEvent event, String attribute) {
        if (event == null || attribute == null) {
            return Optional.empty();
        }
        String value = stringify(event.attribute(attribute));
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }
}
