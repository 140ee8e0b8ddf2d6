package com.entigraph.service.core.telemetry;

/** Engine counters. Implementations must be thread-safe and cheap. */
public interface EngineTelemetry {

    void eventReceived();

    void entitySynthesized(String ruleId);

    void noMatch(String reason);

    void relationshipDiscovered(String ruleId);

    void lookupFailed(String ruleId, String outcome);

    void endpointUnresolved(String ruleId, String failure);

    void storeRetry();

    void deadLettered(String reason);

    void expired(int entities, int relationships, int tags);
}
