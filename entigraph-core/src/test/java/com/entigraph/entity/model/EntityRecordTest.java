package com.entigraph.entity.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EntityRecordTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final Duration EXPIRATION = Duration.ofHours(8);

    @Test
    void applyingSameDeltaTwiceIsIdempotent() {
        EntityDelta delta = delta(T0, "prod-kafka", Map.of("kafka.cluster.name", TagValue.of("prod-kafka", T0, null)));

        EntityRecord once = EntityRecord.create(delta);
        EntityRecord twice = once.apply(delta);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void applyMergesTagsAndBumpsLifecycle() {
        EntityRecord record = EntityRecord.create(delta(T0, "prod", Map.of("a", TagValue.of("1", T0, null))));
        Instant t1 = T0.plusSeconds(60);

        EntityRecord merged = record.apply(delta(t1, "prod-renamed", Map.of("b", TagValue.of("2", t1, null))));

        assertThat(merged.tag("a")).isEqualTo("1");
        assertThat(merged.tag("b")).isEqualTo("2");
        assertThat(merged.name()).isEqualTo("prod-renamed");
        assertThat(merged.createdAt()).isEqualTo(T0);
        assertThat(merged.lastSeenAt()).isEqualTo(t1);
        assertThat(merged.expiresAt()).isEqualTo(t1.plus(EXPIRATION));
    }

    @Test
    void olderDeltaNeverOverwritesNewerTag() {
        Instant t1 = T0.plusSeconds(30);
        EntityRecord record = EntityRecord.create(delta(t1, "prod", Map.of("state", TagValue.of("NEW", t1, null))));

        EntityRecord merged = record.apply(delta(T0, "old-name", Map.of("state", TagValue.of("OLD", T0, null))));

        assertThat(merged.tag("state")).isEqualTo("NEW");
        assertThat(merged.name()).isEqualTo("prod");
        assertThat(merged.lastSeenAt()).isEqualTo(t1);
        assertThat(merged.expiresAt()).isEqualTo(t1.plus(EXPIRATION));
        assertThat(merged.createdAt()).isEqualTo(T0);
    }

    @Test
    void untouchedTagIsDroppedOnceItsTtlElapsed() {
        EntityRecord record = EntityRecord.create(
                delta(T0, "prod", Map.of("leader", TagValue.of("broker-1", T0, Duration.ofMinutes(5)))));

        EntityRecord stillLive = record.apply(delta(T0.plusSeconds(60), "prod", Map.of()));
        EntityRecord expired = record.apply(delta(T0.plus(Duration.ofMinutes(10)), "prod", Map.of()));

        assertThat(stillLive.tag("leader")).isEqualTo("broker-1");
        assertThat(expired.tag("leader")).isNull();
    }

    @Test
    void withoutExpiredTagsKeepsTheEntity() {
        EntityRecord record = EntityRecord.create(delta(
                T0,
                "prod",
                Map.of(
                        "leader", TagValue.of("broker-1", T0, Duration.ofMinutes(5)),
                        "name", TagValue.of("prod", T0, null))));
        Instant later = T0.plus(Duration.ofMinutes(6));

        EntityRecord pruned = record.withoutExpiredTags(later);

        assertThat(record.hasExpiredTags(later)).isTrue();
        assertThat(pruned.tags()).containsOnlyKeys("name");
        assertThat(pruned.isExpired(later)).isFalse();
        assertThat(record.withoutExpiredTags(T0)).isSameAs(record);
    }

    @Test
    void relationshipRefreshExtendsButNeverShortens() {
        RelationshipDelta first =
                new RelationshipDelta(RelationshipType.CONTAINS, "src", "dst", T0.plusSeconds(100), Duration.ofMinutes(75));
        RelationshipDelta late = new RelationshipDelta(RelationshipType.CONTAINS, "src", "dst", T0, Duration.ofMinutes(75));

        RelationshipRecord record = RelationshipRecord.create(first).refresh(late);

        assertThat(record.expiresAt()).isEqualTo(T0.plusSeconds(100).plus(Duration.ofMinutes(75)));
        assertThat(record.firstSeenAt()).isEqualTo(T0);
        assertThat(record.lastSeenAt()).isEqualTo(T0.plusSeconds(100));
    }

    private static EntityDelta delta(Instant at, String name, Map<String, TagValue> tags) {
        return new EntityDelta("guid-1", "INFRA", "MESSAGE_QUEUE_CLUSTER", name, tags, at, EXPIRATION);
    }
}
