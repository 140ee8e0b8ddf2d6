package com.entigraph.service.core.telemetry;

public final class NoopEngineTelemetry implements EngineTelemetry {

    public static final NoopEngineTelemetry INSTANCE = new NoopEngineTelemetry();

    private NoopEngineTelemetry() {}

    @Override
    public void eventReceived() {}

    @Override
    public void entitySynthesized(String ruleId) {}

    @Override
    public void noMatch(String reason) {}

    @Override
    public void relationshipDiscovered(String ruleId) {}

    @Override
    public void lookupFailed(String ruleId, String outcome) {}

    @Override
    public void endpointUnresolved(String ruleId, String failure) {}

    @Override
    public void storeRetry() {}

    @Override
    public void deadLettered(String reason) {}

    @Override
    public void expired(int entities, int relationships, int tags) {}
}
