package com.entigraph.service.core.model.config;

import java.util.List;

/** Exactly one of {@code attribute}, {@code template} or {@code fragments} is expected. */
public record IdentifierConfig(String attribute, String template, List<FragmentConfig> fragments) {

    public static IdentifierConfig attribute(String attribute) {
        return new IdentifierConfig(attribute, null, null);
    }

    public static IdentifierConfig template(String template) {
        return new IdentifierConfig(null, template, null);
    }

    public static IdentifierConfig fragments(List<FragmentConfig> fragments) {
        return new IdentifierConfig(null, null, fragments);
    }
}
