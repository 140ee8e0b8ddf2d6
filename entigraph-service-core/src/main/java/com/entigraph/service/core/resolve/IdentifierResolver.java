package com.entigraph.service.core.resolve;

import com.entigraph.service.core.config.AccountSource;
import com.entigraph.service.core.config.IdentifierExpression;
import com.entigraph.service.core.config.IdentifierExpression.Fragment;
import com.entigraph.service.core.support.AttributeValues;
import com.entigraph.telemetry.model.TelemetryEvent;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.springframework.stereotype.Component;

/**
 * Resolves identifier expressions against event attributes. Resolution is all-or-nothing: any
 * missing attribute, or a blank result, yields empty.
 */
@Component
public class IdentifierResolver {

    public Optional<String> resolve(TelemetryEvent event, IdentifierExpression expression) {
        if (event == null || expression == null) {
            return Optional.empty();
        }
        if (expression instanceof IdentifierExpression.Attribute attribute) {
            return AttributeValues.stringValue(event, attribute.name());
        }
        List<Fragment> parts;
        if (expression instanceof IdentifierExpression.Template template) {
            parts = template.parts();
        } else if (expression instanceof IdentifierExpression.Fragments fragments) {
            parts = fragments.parts();
        } else {
            throw new IllegalArgumentException("Unsupported identifier expression " + expression.getClass());
        }
        StringBuilder sb = new StringBuilder();
        for (Fragment part : parts) {
            if (part.isLiteral()) {
                sb.append(part.literal());
                continue;
            }
            Optional<String> value = AttributeValues.stringValue(event, part.attribute());
            if (value.isEmpty()) {
                return Optional.empty();
            }
            sb.append(value.get());
        }
        String result = sb.toString();
        return result.isBlank() ? Optional.empty() : Optional.of(result);
    }

    /** First present value along the fallback chain. */
    public Optional<String> resolveFirst(TelemetryEvent event, List<String> attributes) {
        if (event == null || attributes == null) {
            return Optional.empty();
        }
        for (String attribute : attributes) {
            Optional<String> value = AttributeValues.stringValue(event, attribute);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Account id from the configured attribute, falling back to the literal. Only positive integers
     * qualify.
     */
    public OptionalLong resolveAccount(TelemetryEvent event, AccountSource source) {
        if (source == null) {
            return OptionalLong.empty();
        }
        if (source.attribute() != null) {
            Optional<String> raw = AttributeValues.stringValue(event, source.attribute());
            if (raw.isPresent()) {
                OptionalLong parsed = parseAccount(raw.get());
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        if (source.fallback() != null && source.fallback() > 0) {
            return OptionalLong.of(source.fallback());
        }
        return OptionalLong.empty();
    }

    private static OptionalLong parseAccount(String raw) {
        try {
            long value = Long.parseLong(raw.trim());
            return value > 0 ? OptionalLong.of(value) : OptionalLong.empty();
        } catch (NumberFormatException ex) {
            return OptionalLong.empty();
        }
    }
}
