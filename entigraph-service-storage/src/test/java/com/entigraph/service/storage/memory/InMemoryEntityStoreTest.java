package com.entigraph.service.storage.memory;

import static org.assertj.core.api.Assertions.assertThat;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.entity.model.EntityDelta;
import com.entigraph.entity.model.EntityRecord;
import com.entigraph.entity.model.RelationshipDelta;
import com.entigraph.entity.model.RelationshipRecord;
import com.entigraph.entity.model.RelationshipType;
import com.entigraph.entity.model.TagValue;
import com.entigraph.service.core.store.EntityLookup;
import com.entigraph.service.core.store.ExpiryReport;
import com.entigraph.service.core.store.FieldPredicate;
import com.entigraph.service.core.store.LookupResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryEntityStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String CLUSTER = GuidCodec.encode(42, "INFRA", "MESSAGE_QUEUE_CLUSTER", "prod-kafka");
    private static final String BROKER = GuidCodec.encode(42, "INFRA", "KAFKA_BROKER", "prod-kafka:1");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryEntityStore store = new InMemoryEntityStore(clock);

    @Test
    void upsertIsIdempotent() {
        EntityDelta delta = cluster(T0, Map.of("kafka.cluster.name", TagValue.of("prod-kafka", T0, null)));

        store.upsertEntity(delta);
        EntityRecord first = store.findEntity(CLUSTER).orElseThrow();
        store.upsertEntity(delta);

        assertThat(store.findEntity(CLUSTER)).contains(first);
        assertThat(store.entityCount()).isEqualTo(1);
    }

    @Test
    void laterObservationMergesTagsAndBumpsExpiry() {
        store.upsertEntity(cluster(T0, Map.of("a", TagValue.of("1", T0, null))));
        Instant t1 = T0.plus(Duration.ofMinutes(5));
        store.upsertEntity(cluster(t1, Map.of("b", TagValue.of("2", t1, null))));

        EntityRecord record = store.findEntity(CLUSTER).orElseThrow();
        assertThat(record.tags()).containsOnlyKeys("a", "b");
        assertThat(record.createdAt()).isEqualTo(T0);
        assertThat(record.lastSeenAt()).isEqualTo(t1);
        assertThat(record.expiresAt()).isEqualTo(t1.plus(Duration.ofHours(8)));
    }

    @Test
    void relationshipReobservationRefreshesSingleRecord() {
        Duration ttl = Duration.ofMinutes(10);
        Instant t2 = T0.plus(Duration.ofMinutes(7));
        store.upsertRelationship(new RelationshipDelta(RelationshipType.CONTAINS, CLUSTER, BROKER, T0, ttl));
        store.upsertRelationship(new RelationshipDelta(RelationshipType.CONTAINS, CLUSTER, BROKER, t2, ttl));

        assertThat(store.relationshipCount()).isEqualTo(1);
        List<RelationshipRecord> records = store.relationshipsOf(BROKER);
        assertThat(records).hasSize(1);
        assertThat(records.get(0).expiresAt()).isEqualTo(t2.plus(ttl));
        assertThat(records.get(0).firstSeenAt()).isEqualTo(T0);
    }

    @Test
    void lookupReportsNoneOneOrAmbiguous() {
        store.upsertEntity(broker("prod-kafka:1", "b-1.internal"));
        store.upsertEntity(broker("prod-kafka:2", "b-2.internal"));
        store.upsertEntity(cluster(T0, Map.of()));

        LookupResult one = store.lookup(new EntityLookup(
                "INFRA", "KAFKA_BROKER", List.of(new FieldPredicate("tags.broker.host", "b-2.internal"))));
        LookupResult none = store.lookup(new EntityLookup(
                "INFRA", "KAFKA_BROKER", List.of(new FieldPredicate("tags.broker.host", "b-9.internal"))));
        LookupResult ambiguous = store.lookup(new EntityLookup("INFRA", "KAFKA_BROKER", List.of()));
        LookupResult byName = store.lookup(new EntityLookup(null, null, List.of(new FieldPredicate("name", "prod-kafka"))));

        assertThat(one.outcome()).isEqualTo(LookupResult.Outcome.ONE);
        assertThat(one.guid()).isEqualTo(GuidCodec.encode(42, "INFRA", "KAFKA_BROKER", "prod-kafka:2"));
        assertThat(none.outcome()).isEqualTo(LookupResult.Outcome.NONE);
        assertThat(ambiguous.outcome()).isEqualTo(LookupResult.Outcome.AMBIGUOUS);
        assertThat(byName.guid()).isEqualTo(CLUSTER);
    }

    @Test
    void sweepRemovesOnlyExpiredRecordsAndTags() {
        store.upsertEntity(cluster(T0, Map.of(
                "short", TagValue.of("x", T0, Duration.ofMinutes(1)),
                "long", TagValue.of("y", T0, null))));
        store.upsertEntity(new EntityDelta(BROKER, "INFRA", "KAFKA_BROKER", "b", Map.of(), T0, Duration.ofMinutes(30)));
        store.upsertRelationship(
                new RelationshipDelta(RelationshipType.CONTAINS, CLUSTER, BROKER, T0, Duration.ofMinutes(5)));

        ExpiryReport early = store.expireOlderThan(T0.plus(Duration.ofMinutes(2)));
        assertThat(early).isEqualTo(new ExpiryReport(0, 0, 1));
        assertThat(store.findEntity(CLUSTER).orElseThrow().tags()).containsOnlyKeys("long");

        ExpiryReport later = store.expireOlderThan(T0.plus(Duration.ofHours(1)));
        assertThat(later).isEqualTo(new ExpiryReport(1, 1, 0));
        assertThat(store.findEntity(BROKER)).isEmpty();
        assertThat(store.findEntity(CLUSTER)).isPresent();
        assertThat(store.relationshipCount()).isZero();
    }

    @Test
    void expiredEntitiesAreInvisibleBeforeTheSweep() {
        store.upsertEntity(new EntityDelta(BROKER, "INFRA", "KAFKA_BROKER", "b", Map.of(), T0, Duration.ofMinutes(30)));
        clock.set(T0.plus(Duration.ofHours(1)));

        assertThat(store.findEntity(BROKER)).isEmpty();
        assertThat(store.lookup(new EntityLookup(null, "KAFKA_BROKER", List.of())).outcome())
                .isEqualTo(LookupResult.Outcome.NONE);
        assertThat(store.entityCount()).isEqualTo(1);
    }

    @Test
    void concurrentUpsertsToOneGuidAreSerialized() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 200; i++) {
            Instant observed = T0.plusSeconds(i);
            String key = "t" + (i % 20);
            pool.submit(() -> store.upsertEntity(cluster(observed, Map.of(key, TagValue.of("v", observed, null)))));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        EntityRecord record = store.findEntity(CLUSTER).orElseThrow();
        assertThat(record.tags()).hasSize(20);
        assertThat(record.lastSeenAt()).isEqualTo(T0.plusSeconds(199));
        assertThat(record.createdAt()).isEqualTo(T0);
    }

    private static EntityDelta cluster(Instant observedAt, Map<String, TagValue> tags) {
        return new EntityDelta(
                CLUSTER, "INFRA", "MESSAGE_QUEUE_CLUSTER", "prod-kafka", tags, observedAt, Duration.ofHours(8));
    }

    private static EntityDelta broker(String identifier, String host) {
        return new EntityDelta(
                GuidCodec.encode(42, "INFRA", "KAFKA_BROKER", identifier),
                "INFRA",
                "KAFKA_BROKER",
                identifier,
                Map.of("broker.host", TagValue.of(host, T0, null)),
                T0,
                Duration.ofHours(8));
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
