package com.entigraph.service.core.telemetry;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/** In-process counters backing {@code GET /api/engine/stats}. */
@Component
@Primary
public class EngineTelemetryRegistry implements EngineTelemetry {

    private final LongAdder eventsReceived = new LongAdder();
    private final LongAdder entitiesSynthesized = new LongAdder();
    private final LongAdder relationshipsDiscovered = new LongAdder();
    private final LongAdder storeRetries = new LongAdder();
    private final LongAdder expiredEntities = new LongAdder();
    private final LongAdder expiredRelationships = new LongAdder();
    private final LongAdder expiredTags = new LongAdder();
    private final ConcurrentMap<String, LongAdder> noMatchByReason = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> synthesizedByRule = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> discoveredByRule = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> lookupFailures = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> endpointFailures = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> deadLetters = new ConcurrentHashMap<>();

    @Override
    public void eventReceived() {
        eventsReceived.increment();
    }

    @Override
    public void entitySynthesized(String ruleId) {
        entitiesSynthesized.increment();
        increment(synthesizedByRule, ruleId);
    }

    @Override
    public void noMatch(String reason) {
        increment(noMatchByReason, reason);
    }

    @Override
    public void relationshipDiscovered(String ruleId) {
        relationshipsDiscovered.increment();
        increment(discoveredByRule, ruleId);
    }

    @Override
    public void lookupFailed(String ruleId, String outcome) {
        increment(lookupFailures, outcome);
    }

    @Override
    public void endpointUnresolved(String ruleId, String failure) {
        increment(endpointFailures, failure);
    }

    @Override
    public void storeRetry() {
        storeRetries.increment();
    }

    @Override
    public void deadLettered(String reason) {
        increment(deadLetters, reason);
    }

    @Override
    public void expired(int entities, int relationships, int tags) {
        expiredEntities.add(entities);
        expiredRelationships.add(relationships);
        expiredTags.add(tags);
    }

    public Snapshot snapshot() {
        return new Snapshot(
                eventsReceived.sum(),
                entitiesSynthesized.sum(),
                relationshipsDiscovered.sum(),
                storeRetries.sum(),
                expiredEntities.sum(),
                expiredRelationships.sum(),
                expiredTags.sum(),
                freeze(noMatchByReason),
                freeze(synthesizedByRule),
                freeze(discoveredByRule),
                freeze(lookupFailures),
                freeze(endpointFailures),
                freeze(deadLetters));
    }

    private static void increment(ConcurrentMap<String, LongAdder> counters, String key) {
        counters.computeIfAbsent(key == null ? "unknown" : key, k -> new LongAdder()).increment();
    }

    private static Map<String, Long> freeze(ConcurrentMap<String, LongAdder> counters) {
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((k, v) -> out.put(k, v.sum()));
        return out;
    }

    public record Snapshot(
            long eventsReceived,
            long entitiesSynthesized,
            long relationshipsDiscovered,
            long storeRetries,
            long expiredEntities,
            long expiredRelationships,
            long expiredTags,
            Map<String, Long> noMatchByReason,
            Map<String, Long> synthesizedByRule,
            Map<String, Long> discoveredByRule,
            Map<String, Long> lookupFailures,
            Map<String, Long> endpointFailures,
            Map<String, Long> deadLetters) {}
}
