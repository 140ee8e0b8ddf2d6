package com.entigraph.service.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.entity.model.EntityDelta;
import com.entigraph.entity.model.RelationshipDelta;
import com.entigraph.service.core.config.EngineProperties;
import com.entigraph.service.core.config.RuleFixtures;
import com.entigraph.service.core.config.RuleLookup;
import com.entigraph.service.core.deadletter.DeadLetterSink;
import com.entigraph.service.core.model.config.EndpointConfig;
import com.entigraph.service.core.model.config.IdentifierConfig;
import com.entigraph.service.core.model.config.RelationshipRuleConfig;
import com.entigraph.service.core.model.config.RuleSetConfig;
import com.entigraph.service.core.relationship.EndpointResolver;
import com.entigraph.service.core.relationship.RelationshipEngine;
import com.entigraph.service.core.resolve.ConditionEvaluator;
import com.entigraph.service.core.resolve.IdentifierResolver;
import com.entigraph.service.core.store.EntityStore;
import com.entigraph.service.core.store.StoreUnavailableException;
import com.entigraph.service.core.synthesis.NoMatchReason;
import com.entigraph.service.core.synthesis.SynthesisEngine;
import com.entigraph.service.core.telemetry.EngineTelemetryRegistry;
import com.entigraph.telemetry.model.TelemetryEvent;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class TelemetryPipelineTest {

    private static final String CLUSTER = GuidCodec.encode(42, "INFRA", "MESSAGE_QUEUE_CLUSTER", "prod-kafka");

    private final EntityStore store = mock(EntityStore.class);
    private final DeadLetterSink deadLetters = mock(DeadLetterSink.class);
    private final EngineTelemetryRegistry telemetry = new EngineTelemetryRegistry();
    private final EngineProperties properties = new EngineProperties();

    TelemetryPipelineTest() {
        properties.getPipeline().getStoreRetry().setMaxAttempts(3);
        properties.getPipeline().getStoreRetry().setInitialBackoff(Duration.ofMillis(1));
    }

    @Test
    void upsertsEntityThenRelationships() {
        when(store.upsertEntity(any())).thenReturn(CLUSTER);
        TelemetryPipeline pipeline = pipeline();

        ProcessingOutcome outcome = pipeline.process(clusterEvent());

        assertThat(outcome.entityGuid()).isEqualTo(CLUSTER);
        assertThat(outcome.noMatch()).isNull();
        assertThat(outcome.relationships()).isEqualTo(1);
        assertThat(outcome.deadLettered()).isFalse();
        verify(store).upsertEntity(any(EntityDelta.class));
        verify(store).upsertRelationship(any(RelationshipDelta.class));
        assertThat(telemetry.snapshot().eventsReceived()).isEqualTo(1);
    }

    @Test
    void retriesStoreWritesWithBackoff() {
        when(store.upsertEntity(any()))
                .thenThrow(new StoreUnavailableException("down"))
                .thenReturn(CLUSTER);

        ProcessingOutcome outcome = pipeline().process(clusterEvent());

        assertThat(outcome.entityGuid()).isEqualTo(CLUSTER);
        verify(store, times(2)).upsertEntity(any());
        assertThat(telemetry.snapshot().storeRetries()).isEqualTo(1);
        verify(deadLetters, never()).deadLetter(any(), any(), any());
    }

    @Test
    void deadLettersAfterExhaustingRetries() {
        when(store.upsertEntity(any())).thenThrow(new StoreUnavailableException("down"));
        TelemetryEvent event = clusterEvent();

        ProcessingOutcome outcome = pipeline().process(event);

        assertThat(outcome.deadLettered()).isTrue();
        verify(store, times(3)).upsertEntity(any());
        verify(store, never()).upsertRelationship(any());
        verify(deadLetters).deadLetter(eq(event), eq("entity-upsert-failed"), any(StoreUnavailableException.class));
    }

    @Test
    void noMatchStillRunsRelationshipDiscovery() {
        TelemetryEvent withoutCluster = TelemetryEvent.of("KafkaClusterSample", RuleFixtures.T0, Map.of("accountId", 42));

        ProcessingOutcome outcome = pipeline().process(withoutCluster);

        assertThat(outcome.noMatch()).isEqualTo(NoMatchReason.IDENTIFIER_UNRESOLVED);
        assertThat(outcome.relationships()).isZero();
        verify(store, never()).upsertEntity(any());
    }

    @Test
    void workersDrainSubmittedEvents() {
        when(store.upsertEntity(any())).thenReturn(CLUSTER);
        TelemetryPipeline pipeline = pipeline();
        pipeline.init(100, 2);
        try {
            for (int i = 0; i < 20; i++) {
                assertThat(pipeline.submit(clusterEvent())).isTrue();
            }
            pipeline.waitForDrain();
        } finally {
            pipeline.stop();
        }

        verify(store, times(20)).upsertEntity(any());
        assertThat(pipeline.queueDepth()).isZero();
    }

    @Test
    void submitAfterStopIsRejected() {
        TelemetryPipeline pipeline = pipeline();
        pipeline.init(10, 1);
        pipeline.stop();

        assertThat(pipeline.submit(clusterEvent())).isFalse();
        assertThat(pipeline.queueDepth()).isZero();
        verify(store, never()).upsertEntity(any());
    }

    @Test
    void stopDeadLettersEventsStillQueued() throws InterruptedException {
        properties.getPipeline().setShutdownTimeout(Duration.ofMillis(50));
        properties.getPipeline().setSubmitTimeout(Duration.ofMillis(20));
        CountDownLatch workerBusy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(store.upsertEntity(any())).thenAnswer(invocation -> {
            workerBusy.countDown();
            try {
                release.await();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            return CLUSTER;
        });
        TelemetryPipeline pipeline = pipeline();
        pipeline.init(1, 1);

        assertThat(pipeline.submit(clusterEvent())).isTrue();
        assertThat(workerBusy.await(5, TimeUnit.SECONDS)).isTrue();
        TelemetryEvent queued = clusterEvent();
        assertThat(pipeline.submit(queued)).isTrue();
        // the single slot is taken and the worker is blocked
        assertThat(pipeline.submit(clusterEvent())).isFalse();

        pipeline.stop();

        verify(deadLetters).deadLetter(eq(queued), eq("shutdown-dropped"), isNull());
        assertThat(pipeline.queueDepth()).isZero();
        verify(store, times(1)).upsertEntity(any());
    }

    private TelemetryPipeline pipeline() {
        RelationshipRuleConfig accountManagesCluster = new RelationshipRuleConfig(
                "account-manages-cluster",
                List.of("KafkaClusterSample"),
                null,
                null,
                "MANAGES",
                "1d",
                EndpointConfig.build(new EndpointConfig.BuildGuidConfig(
                        null, "ACCOUNT", "CLOUD_ACCOUNT", IdentifierConfig.attribute("accountId"))),
                EndpointConfig.build(new EndpointConfig.BuildGuidConfig(
                        null, "INFRA", "MESSAGE_QUEUE_CLUSTER", IdentifierConfig.attribute("clusterName"))));
        RuleLookup rules = RuleFixtures.lookup(RuleSetConfig.of(
                "kafka", List.of(RuleFixtures.kafkaClusterRule()), List.of(accountManagesCluster)));
        IdentifierResolver resolver = new IdentifierResolver();
        ConditionEvaluator conditions = new ConditionEvaluator();
        SynthesisEngine synthesis = new SynthesisEngine(rules, resolver, conditions, telemetry);
        RelationshipEngine relationships = new RelationshipEngine(
                rules, conditions, new EndpointResolver(resolver, store), telemetry, properties);
        return new TelemetryPipeline(synthesis, relationships, store, deadLetters, telemetry, properties);
    }

    private static TelemetryEvent clusterEvent() {
        return TelemetryEvent.of(
                "KafkaClusterSample", RuleFixtures.T0, Map.of("clusterName", "prod-kafka", "accountId", 42));
    }
}
