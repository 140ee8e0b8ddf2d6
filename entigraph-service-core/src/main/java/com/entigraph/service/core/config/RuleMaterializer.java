package com.entigraph.service.core.config;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.entity.model.RelationshipType;
import com.entigraph.service.core.config.EndpointDefinition.BuildSpec;
import com.entigraph.service.core.config.EndpointDefinition.LookupField;
import com.entigraph.service.core.config.EndpointDefinition.LookupSpec;
import com.entigraph.service.core.config.IdentifierExpression.Fragment;
import com.entigraph.service.core.model.config.AccountConfig;
import com.entigraph.service.core.model.config.ConditionConfig;
import com.entigraph.service.core.model.config.EndpointConfig;
import com.entigraph.service.core.model.config.FragmentConfig;
import com.entigraph.service.core.model.config.IdentifierConfig;
import com.entigraph.service.core.model.config.RelationshipRuleConfig;
import com.entigraph.service.core.model.config.RuleSetConfig;
import com.entigraph.service.core.model.config.SynthesisRuleConfig;
import com.entigraph.service.core.model.config.TagMappingConfig;
import com.entigraph.service.core.support.AttributeValues;
import com.entigraph.service.core.support.DurationParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts declarative rule set models into runtime snapshots, validating everything up front so
 * per-event evaluation never meets a malformed rule.
 */
public class RuleMaterializer {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private final ObjectMapper canonicalJson;
    private final Duration defaultEntityExpiration;
    private final String defaultAccountAttribute;

    public RuleMaterializer(ObjectMapper mapper, Duration defaultEntityExpiration, String defaultAccountAttribute) {
        this.canonicalJson = mapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.defaultEntityExpiration = defaultEntityExpiration;
        this.defaultAccountAttribute = defaultAccountAttribute;
    }

    public RuleSnapshot materialize(List<RuleSetConfig> sources, long version, Instant loadedAt) {
        List<RuleSetConfig> safeSources = sources == null ? List.of() : sources;
        List<RuleSetDefinition> ruleSets = materializeAll(safeSources);
        return RuleSnapshot.of(ruleSets, safeSources, fingerprint(safeSources), version, loadedAt);
    }

    public List<RuleSetDefinition> materializeAll(List<RuleSetConfig> sources) {
        List<RuleSetDefinition> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (RuleSetConfig cfg : sources) {
            if (cfg == null) continue;
            RuleSetDefinition ruleSet = materializeRuleSet(cfg);
            if (!names.add(ruleSet.name())) {
                throw new InvalidRuleDefinitionException(ruleSet.name(), null, "duplicate rule set name");
            }
            out.add(ruleSet);
        }
        return List.copyOf(out);
    }

    public String fingerprint(List<RuleSetConfig> sources) {
        try {
            byte[] sha = MessageDigest.getInstance("SHA-256").digest(canonicalJson.writeValueAsBytes(sources));
            StringBuilder sb = new StringBuilder(sha.length * 2);
            for (byte b : sha) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to fingerprint rule sets", e);
        }
    }

    RuleSetDefinition materializeRuleSet(RuleSetConfig cfg) {
        String name = safeTrim(cfg.ruleSet());
        if (name == null) {
            throw new InvalidRuleDefinitionException(null, null, "ruleSet name must be provided");
        }
        String accountAttribute = safeTrim(cfg.accountAttribute());
        Context ctx = new Context(
                name,
                accountAttribute != null ? accountAttribute : defaultAccountAttribute,
                normalizeAll(cfg.eventTypes()),
                resolveAliases(name, cfg.aliases()));

        List<SynthesisRuleDefinition> synthesis = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        if (cfg.synthesis() != null) {
            for (int i = 0; i < cfg.synthesis().size(); i++) {
                SynthesisRuleConfig rule = cfg.synthesis().get(i);
                if (rule == null) continue;
                SynthesisRuleDefinition def = materializeSynthesis(ctx, rule, i);
                if (!ids.add(def.id())) {
                    throw new InvalidRuleDefinitionException(name, def.id(), "duplicate rule name");
                }
                synthesis.add(def);
            }
        }
        List<RelationshipRuleDefinition> relationships = new ArrayList<>();
        if (cfg.relationships() != null) {
            for (int i = 0; i < cfg.relationships().size(); i++) {
                RelationshipRuleConfig rule = cfg.relationships().get(i);
                if (rule == null) continue;
                RelationshipRuleDefinition def = materializeRelationship(ctx, rule, i);
                if (!ids.add(def.id())) {
                    throw new InvalidRuleDefinitionException(name, def.id(), "duplicate rule name");
                }
                relationships.add(def);
            }
        }
        return new RuleSetDefinition(name, safeTrim(cfg.provider()), List.copyOf(synthesis), List.copyOf(relationships));
    }

    private SynthesisRuleDefinition materializeSynthesis(Context ctx, SynthesisRuleConfig rule, int index) {
        String ruleName = safeTrim(rule.name()) != null ? rule.name().trim() : "synthesis-" + index;
        String id = ctx.ruleSet() + "/" + ruleName;

        Set<String> eventTypes = eventTypes(ctx, rule.eventTypes(), id);
        String domain = taxonomy(ctx, id, rule.domain(), "domain");
        String type = taxonomy(ctx, id, rule.type(), "type");
        if (rule.identifier() == null) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "identifier must be provided");
        }
        IdentifierExpression identifier = identifier(ctx, id, rule.identifier(), "identifier");
        IdentifierExpression entityName =
                rule.entityName() == null ? null : identifier(ctx, id, rule.entityName(), "entityName");
        Duration expiration = rule.entityExpirationTime() == null
                ? defaultEntityExpiration
                : duration(ctx, id, rule.entityExpirationTime(), "entityExpirationTime");

        return new SynthesisRuleDefinition(
                id,
                ctx.ruleSet(),
                eventTypes,
                domain,
                type,
                identifier,
                entityName,
                account(ctx, rule.account()),
                conditions(ctx, id, rule.conditions()),
                tags(ctx, id, rule.tags()),
                expiration);
    }

    private RelationshipRuleDefinition materializeRelationship(Context ctx, RelationshipRuleConfig rule, int index) {
        String ruleName = safeTrim(rule.name()) != null ? rule.name().trim() : "relationship-" + index;
        String id = ctx.ruleSet() + "/" + ruleName;

        RelationshipType type;
        try {
            type = RelationshipType.fromConfigValue(rule.relationshipType());
        } catch (IllegalArgumentException ex) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, ex.getMessage(), ex);
        }
        if (rule.expires() == null) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "expires must be provided");
        }
        if (rule.source() == null || rule.target() == null) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "source and target must be provided");
        }
        return new RelationshipRuleDefinition(
                id,
                ctx.ruleSet(),
                eventTypes(ctx, rule.eventTypes(), id),
                normalizeAll(rule.origins()),
                conditions(ctx, id, rule.conditions()),
                type,
                duration(ctx, id, rule.expires(), "expires"),
                endpoint(ctx, id, rule.source(), "source"),
                endpoint(ctx, id, rule.target(), "target"));
    }

    private EndpointDefinition endpoint(Context ctx, String id, EndpointConfig cfg, String side) {
        int strategies = (cfg.buildGuid() != null ? 1 : 0)
                + (cfg.extractGuid() != null ? 1 : 0)
                + (cfg.lookupGuid() != null ? 1 : 0);
        if (strategies != 1) {
            throw new InvalidRuleDefinitionException(
                    ctx.ruleSet(), id, side + " must declare exactly one of buildGuid, extractGuid, lookupGuid");
        }
        if (cfg.buildGuid() != null) {
            EndpointConfig.BuildGuidConfig build = cfg.buildGuid();
            if (build.identifier() == null) {
                throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, side + ".buildGuid.identifier is required");
            }
            return EndpointDefinition.build(new BuildSpec(
                    account(ctx, build.account()),
                    taxonomy(ctx, id, build.domain(), side + ".buildGuid.domain"),
                    taxonomy(ctx, id, build.type(), side + ".buildGuid.type"),
                    identifier(ctx, id, build.identifier(), side + ".buildGuid.identifier")));
        }
        if (cfg.extractGuid() != null) {
            String attribute = safeTrim(cfg.extractGuid().attribute());
            if (attribute == null) {
                throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, side + ".extractGuid.attribute is required");
            }
            return EndpointDefinition.extract(attribute);
        }
        EndpointConfig.LookupGuidConfig lookup = cfg.lookupGuid();
        if (lookup.fields() == null || lookup.fields().isEmpty()) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, side + ".lookupGuid.fields must not be empty");
        }
        List<LookupField> fields = new ArrayList<>();
        for (EndpointConfig.LookupFieldConfig field : lookup.fields()) {
            String entityField = field == null ? null : safeTrim(field.field());
            String attribute = field == null ? null : safeTrim(field.attribute());
            if (entityField == null || attribute == null) {
                throw new InvalidRuleDefinitionException(
                        ctx.ruleSet(), id, side + ".lookupGuid.fields entries need field and attribute");
            }
            if (!isLookupField(entityField)) {
                throw new InvalidRuleDefinitionException(
                        ctx.ruleSet(), id, "unsupported lookup field '" + entityField + "' (guid, name, tags.<tag>)");
            }
            fields.add(new LookupField(entityField, attribute));
        }
        String domain = lookup.domain() == null ? null : taxonomy(ctx, id, lookup.domain(), side + ".lookupGuid.domain");
        String type = lookup.type() == null ? null : taxonomy(ctx, id, lookup.type(), side + ".lookupGuid.type");
        return EndpointDefinition.lookup(new LookupSpec(domain, type, List.copyOf(fields)));
    }

    private static boolean isLookupField(String field) {
        return "guid".equals(field) || "name".equals(field) || (field.startsWith("tags.") && field.length() > 5);
    }

    private IdentifierExpression identifier(Context ctx, String id, IdentifierConfig cfg, String what) {
        String attribute = safeTrim(cfg.attribute());
        String template = cfg.template() == null || cfg.template().isBlank() ? null : cfg.template();
        boolean hasFragments = cfg.fragments() != null && !cfg.fragments().isEmpty();
        int kinds = (attribute != null ? 1 : 0) + (template != null ? 1 : 0) + (hasFragments ? 1 : 0);
        if (kinds != 1) {
            throw new InvalidRuleDefinitionException(
                    ctx.ruleSet(), id, what + " must declare exactly one of attribute, template, fragments");
        }
        if (attribute != null) {
            return new IdentifierExpression.Attribute(attribute);
        }
        if (template != null) {
            return new IdentifierExpression.Template(template, parseTemplate(ctx, id, template));
        }
        List<Fragment> parts = new ArrayList<>();
        for (FragmentConfig fragment : cfg.fragments()) {
            parts.addAll(fragment(ctx, id, fragment, ctx.aliases()));
        }
        return new IdentifierExpression.Fragments(parts);
    }

    List<Fragment> parseTemplate(Context ctx, String id, String template) {
        List<Fragment> parts = new ArrayList<>();
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf(OPEN, pos);
            if (open < 0) {
                parts.add(Fragment.literal(template.substring(pos)));
                break;
            }
            if (open > pos) {
                parts.add(Fragment.literal(template.substring(pos, open)));
            }
            int close = template.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                throw new InvalidRuleDefinitionException(
                        ctx.ruleSet(), id, "unterminated placeholder in template '" + template + "'");
            }
            String name = template.substring(open + OPEN.length(), close).trim();
            if (name.isEmpty() || name.contains(OPEN)) {
                throw new InvalidRuleDefinitionException(
                        ctx.ruleSet(), id, "malformed placeholder in template '" + template + "'");
            }
            parts.add(Fragment.attribute(name));
            pos = close + CLOSE.length();
        }
        return List.copyOf(parts);
    }

    private List<Fragment> fragment(
            Context ctx, String id, FragmentConfig cfg, Map<String, List<Fragment>> aliases) {
        if (cfg == null) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "null identifier fragment");
        }
        int kinds = (cfg.value() != null ? 1 : 0) + (safeTrim(cfg.attribute()) != null ? 1 : 0)
                + (safeTrim(cfg.alias()) != null ? 1 : 0);
        if (kinds != 1) {
            throw new InvalidRuleDefinitionException(
                    ctx.ruleSet(), id, "fragment must declare exactly one of value, attribute, alias");
        }
        if (cfg.value() != null) {
            return List.of(Fragment.literal(cfg.value()));
        }
        if (cfg.attribute() != null && !cfg.attribute().isBlank()) {
            return List.of(Fragment.attribute(cfg.attribute().trim()));
        }
        List<Fragment> expanded = aliases.get(cfg.alias().trim());
        if (expanded == null) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "unknown alias '" + cfg.alias().trim() + "'");
        }
        return expanded;
    }

    /** Expands every alias once, rejecting cycles such as {@code a -> b -> a}. */
    private Map<String, List<Fragment>> resolveAliases(String ruleSet, Map<String, List<FragmentConfig>> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, List<Fragment>> resolved = new HashMap<>();
        for (String alias : raw.keySet()) {
            expandAlias(ruleSet, alias, raw, resolved, new ArrayDeque<>());
        }
        return Map.copyOf(resolved);
    }

    private List<Fragment> expandAlias(
            String ruleSet,
            String alias,
            Map<String, List<FragmentConfig>> raw,
            Map<String, List<Fragment>> resolved,
            Deque<String> visiting) {
        List<Fragment> done = resolved.get(alias);
        if (done != null) {
            return done;
        }
        if (visiting.contains(alias)) {
            List<String> path = new ArrayList<>(visiting);
            java.util.Collections.reverse(path);
            path.add(alias);
            throw new InvalidRuleDefinitionException(
                    ruleSet, null, "cyclic alias reference " + String.join(" -> ", path));
        }
        List<FragmentConfig> fragments = raw.get(alias);
        if (fragments == null) {
            throw new InvalidRuleDefinitionException(ruleSet, null, "unknown alias '" + alias + "'");
        }
        if (fragments.isEmpty()) {
            throw new InvalidRuleDefinitionException(ruleSet, null, "alias '" + alias + "' has no fragments");
        }
        visiting.push(alias);
        List<Fragment> out = new ArrayList<>();
        for (FragmentConfig fragment : fragments) {
            String nested = fragment == null ? null : safeTrim(fragment.alias());
            if (nested != null && fragment.value() == null && safeTrim(fragment.attribute()) == null) {
                out.addAll(expandAlias(ruleSet, nested, raw, resolved, visiting));
            } else {
                out.addAll(fragment(new Context(ruleSet, null, Set.of(), Map.of()), "alias:" + alias, fragment, Map.of()));
            }
        }
        visiting.pop();
        List<Fragment> frozen = List.copyOf(out);
        resolved.put(alias, frozen);
        return frozen;
    }

    private List<ConditionDefinition> conditions(Context ctx, String id, List<ConditionConfig> configs) {
        if (configs == null || configs.isEmpty()) {
            return List.of();
        }
        List<ConditionDefinition> out = new ArrayList<>();
        for (ConditionConfig cfg : configs) {
            if (cfg == null) continue;
            String attribute = safeTrim(cfg.attribute());
            if (attribute == null) {
                throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "condition attribute must be provided");
            }
            int operators = (cfg.value() != null ? 1 : 0)
                    + (cfg.anyOf() != null ? 1 : 0)
                    + (cfg.present() != null ? 1 : 0)
                    + (cfg.prefix() != null ? 1 : 0);
            if (operators != 1) {
                throw new InvalidRuleDefinitionException(
                        ctx.ruleSet(),
                        id,
                        "condition on '" + attribute + "' must declare exactly one of value, anyOf, present, prefix");
            }
            boolean negate = Boolean.TRUE.equals(cfg.negate());
            if (cfg.value() != null) {
                out.add(new ConditionDefinition(
                        attribute, ConditionDefinition.Operator.EQUALS, AttributeValues.stringify(cfg.value()), Set.of(), negate));
            } else if (cfg.anyOf() != null) {
                Set<String> values = new LinkedHashSet<>();
                for (Object v : cfg.anyOf()) {
                    if (v != null) values.add(AttributeValues.stringify(v));
                }
                if (values.isEmpty()) {
                    throw new InvalidRuleDefinitionException(
                            ctx.ruleSet(), id, "condition on '" + attribute + "' has an empty anyOf");
                }
                out.add(new ConditionDefinition(
                        attribute, ConditionDefinition.Operator.ANY_OF, null, Set.copyOf(values), negate));
            } else if (cfg.present() != null) {
                ConditionDefinition.Operator op = cfg.present()
                        ? ConditionDefinition.Operator.PRESENT
                        : ConditionDefinition.Operator.ABSENT;
                out.add(new ConditionDefinition(attribute, op, null, Set.of(), negate));
            } else {
                out.add(new ConditionDefinition(
                        attribute, ConditionDefinition.Operator.PREFIX, cfg.prefix(), Set.of(), negate));
            }
        }
        return List.copyOf(out);
    }

    private List<TagMappingDefinition> tags(Context ctx, String id, Map<String, TagMappingConfig> configs) {
        if (configs == null || configs.isEmpty()) {
            return List.of();
        }
        List<TagMappingDefinition> out = new ArrayList<>();
        Set<String> targets = new HashSet<>();
        for (Map.Entry<String, TagMappingConfig> entry : configs.entrySet()) {
            String source = safeTrim(entry.getKey());
            if (source == null) {
                throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "tag source attribute must not be blank");
            }
            TagMappingConfig cfg = entry.getValue();
            String target = cfg == null || safeTrim(cfg.targetTag()) == null ? source : cfg.targetTag().trim();
            if (!targets.add(target)) {
                throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "tag '" + target + "' is mapped twice");
            }
            List<String> chain = new ArrayList<>();
            chain.add(source);
            if (cfg != null && cfg.fallbackAttributes() != null) {
                for (String fallback : cfg.fallbackAttributes()) {
                    String trimmed = safeTrim(fallback);
                    if (trimmed != null && !chain.contains(trimmed)) {
                        chain.add(trimmed);
                    }
                }
            }
            Duration ttl = cfg == null || cfg.ttl() == null ? null : duration(ctx, id, cfg.ttl(), "tag '" + target + "' ttl");
            out.add(new TagMappingDefinition(target, List.copyOf(chain), ttl));
        }
        return List.copyOf(out);
    }

    private AccountSource account(Context ctx, AccountConfig cfg) {
        if (cfg == null) {
            return new AccountSource(ctx.accountAttribute(), null);
        }
        if (cfg.value() != null && cfg.value() <= 0) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), null, "account value must be positive");
        }
        String attribute = safeTrim(cfg.attribute());
        if (attribute == null && cfg.value() == null) {
            attribute = ctx.accountAttribute();
        }
        return new AccountSource(attribute, cfg.value());
    }

    private Set<String> eventTypes(Context ctx, List<String> declared, String id) {
        Set<String> types = normalizeAll(declared);
        if (types.isEmpty()) {
            types = ctx.defaultEventTypes();
        }
        if (types.isEmpty()) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, "no eventTypes declared on rule or rule set");
        }
        return types;
    }

    private static String taxonomy(Context ctx, String id, String value, String what) {
        String trimmed = safeTrim(value);
        if (!GuidCodec.isTaxonomyValue(trimmed)) {
            throw new InvalidRuleDefinitionException(
                    ctx.ruleSet(), id, what + " '" + value + "' is not a valid taxonomy value ([A-Z][A-Z0-9_]*)");
        }
        return trimmed;
    }

    private static Duration duration(Context ctx, String id, String value, String what) {
        try {
            return DurationParser.parse(value);
        } catch (IllegalArgumentException ex) {
            throw new InvalidRuleDefinitionException(ctx.ruleSet(), id, what + ": " + ex.getMessage(), ex);
        }
    }

    private static Set<String> normalizeAll(List<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String value : values) {
            String trimmed = safeTrim(value);
            if (trimmed != null) {
                out.add(trimmed.toLowerCase(Locale.ROOT));
            }
        }
        return java.util.Collections.unmodifiableSet(out);
    }

    private static String safeTrim(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    record Context(
            String ruleSet,
            String accountAttribute,
            Set<String> defaultEventTypes,
            Map<String, List<Fragment>> aliases) {

        Context {
            aliases = aliases == null ? Map.of() : new LinkedHashMap<>(aliases);
        }
    }
}
