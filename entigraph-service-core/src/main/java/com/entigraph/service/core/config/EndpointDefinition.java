package com.entigraph.service.core.config;

import java.util.List;

/** One side of a relationship rule, resolved with exactly one {@link Strategy}. */
public record EndpointDefinition(Strategy strategy, BuildSpec build, String extractAttribute, LookupSpec lookup) {

    public enum Strategy {
        BUILD,
        EXTRACT,
        LOOKUP
    }

    public static EndpointDefinition build(BuildSpec spec) {
        return new EndpointDefinition(Strategy.BUILD, spec, null, null);
    }

    public static EndpointDefinition extract(String attribute) {
        return new EndpointDefinition(Strategy.EXTRACT, null, attribute, null);
    }

    public static EndpointDefinition lookup(LookupSpec spec) {
        return new EndpointDefinition(Strategy.LOOKUP, null, null, spec);
    }

    public record BuildSpec(AccountSource account, String domain, String type, IdentifierExpression identifier) {}

    /** {@code domain}/{@code type} narrow the candidates when set. */
    public record LookupSpec(String domain, String type, List<LookupField> fields) {}

    /**
     * @param field entity field to compare: {@code guid}, {@code name}, or {@code tags.<tag>}
     * @param attribute event attribute supplying the expected value
     */
    public record LookupField(String field, String attribute) {}
}
