package com.entigraph.service.core.model.config;

import java.util.List;

/** Relationship endpoint; exactly one resolution strategy must be declared. */
public record EndpointConfig(BuildGuidConfig buildGuid, ExtractGuidConfig extractGuid, LookupGuidConfig lookupGuid) {

    public static EndpointConfig build(BuildGuidConfig buildGuid) {
        return new EndpointConfig(buildGuid, null, null);
    }

    public static EndpointConfig extract(String attribute) {
        return new EndpointConfig(null, new ExtractGuidConfig(attribute), null);
    }

    public static EndpointConfig lookup(LookupGuidConfig lookupGuid) {
        return new EndpointConfig(null, null, lookupGuid);
    }

    public record BuildGuidConfig(AccountConfig account, String domain, String type, IdentifierConfig identifier) {}

    public record ExtractGuidConfig(String attribute) {}

    /** Candidate category plus field/attribute pairs that must all match. */
    public record LookupGuidConfig(String domain, String type, List<LookupFieldConfig> fields) {}

    public record LookupFieldConfig(String field, String attribute) {}
}
