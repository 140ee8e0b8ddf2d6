package com.entigraph.service.core.relationship;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.entity.guid.InvalidGuidException;
import com.entigraph.service.core.config.EndpointDefinition;
import com.entigraph.service.core.config.EndpointDefinition.BuildSpec;
import com.entigraph.service.core.config.EndpointDefinition.LookupField;
import com.entigraph.service.core.config.EndpointDefinition.LookupSpec;
import com.entigraph.service.core.relationship.EndpointResolution.Failure;
import com.entigraph.service.core.resolve.IdentifierResolver;
import com.entigraph.service.core.store.EntityLookup;
import com.entigraph.service.core.store.EntityStore;
import com.entigraph.service.core.store.FieldPredicate;
import com.entigraph.service.core.store.LookupResult;
import com.entigraph.service.core.store.StoreUnavailableException;
import com.entigraph.service.core.support.AttributeValues;
import com.entigraph.telemetry.model.TelemetryEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Resolves one relationship endpoint by building, extracting or looking up its GUID. */
@Component
@RequiredArgsConstructor
public class EndpointResolver {

    private final IdentifierResolver resolver;
    private final EntityStore store;

    public EndpointResolution resolve(TelemetryEvent event, EndpointDefinition endpoint) {
        return switch (endpoint.strategy()) {
            case BUILD -> build(event, endpoint.build());
            case EXTRACT -> extract(event, endpoint.extractAttribute());
            case LOOKUP -> lookup(event, endpoint.lookup());
        };
    }

    private EndpointResolution build(TelemetryEvent event, BuildSpec spec) {
        Optional<String> identifier = resolver.resolve(event, spec.identifier());
        if (identifier.isEmpty()) {
            return EndpointResolution.failed(Failure.ATTRIBUTE_MISSING, "identifier " + spec.identifier().attributes());
        }
        OptionalLong account = resolver.resolveAccount(event, spec.account());
        if (account.isEmpty()) {
            return EndpointResolution.failed(Failure.ACCOUNT_UNRESOLVED, "account " + spec.account().attribute());
        }
        return EndpointResolution.resolved(
                GuidCodec.encode(account.getAsLong(), spec.domain(), spec.type(), identifier.get()));
    }

    private EndpointResolution extract(TelemetryEvent event, String attribute) {
        Optional<String> raw = AttributeValues.stringValue(event, attribute);
        if (raw.isEmpty()) {
            return EndpointResolution.failed(Failure.ATTRIBUTE_MISSING, attribute);
        }
        String guid;
        try {
            guid = GuidCodec.encode(GuidCodec.decode(raw.get()));
        } catch (InvalidGuidException ex) {
            return EndpointResolution.failed(Failure.INVALID_GUID, attribute + ": " + ex.getMessage());
        }
        return EndpointResolution.resolved(guid);
    }

    private EndpointResolution lookup(TelemetryEvent event, LookupSpec spec) {
        List<FieldPredicate> predicates = new ArrayList<>();
        for (LookupField field : spec.fields()) {
            Optional<String> value = AttributeValues.stringValue(event, field.attribute());
            if (value.isEmpty()) {
                return EndpointResolution.failed(Failure.ATTRIBUTE_MISSING, field.attribute());
            }
            predicates.add(new FieldPredicate(field.field(), value.get()));
        }
        LookupResult result;
        try {
            result = store.lookup(new EntityLookup(spec.domain(), spec.type(), predicates));
        } catch (StoreUnavailableException ex) {
            return EndpointResolution.failed(Failure.STORE_UNAVAILABLE, ex.getMessage());
        }
        return switch (result.outcome()) {
            case ONE -> EndpointResolution.resolved(result.guid());
            case NONE -> EndpointResolution.failed(Failure.LOOKUP_NONE, predicates.toString());
            case AMBIGUOUS -> EndpointResolution.failed(
                    Failure.LOOKUP_AMBIGUOUS, result.guids().size() + " candidates for " + predicates);
        };
    }
}
