package com.entigraph.service.storage.memory;

import com.entigraph.entity.model.EntityDelta;
import com.entigraph.entity.model.EntityRecord;
import com.entigraph.entity.model.RelationshipDelta;
import com.entigraph.entity.model.RelationshipKey;
import com.entigraph.entity.model.RelationshipRecord;
import com.entigraph.service.core.store.EntityLookup;
import com.entigraph.service.core.store.EntityStore;
import com.entigraph.service.core.store.ExpiryReport;
import com.entigraph.service.core.store.LookupResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-local store. Writes to one GUID (or one relationship key) are serialized by the map's
 * per-key {@code compute}; reads never block writers. Records past their expiry stay invisible to
 * reads until the sweep removes them.
 */
@Slf4j
@Component
public class InMemoryEntityStore implements EntityStore {

    private final ConcurrentMap<String, EntityRecord> entities = new ConcurrentHashMap<>();
    private final ConcurrentMap<RelationshipKey, RelationshipRecord> relationships = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEntityStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String upsertEntity(EntityDelta delta) {
        entities.compute(delta.guid(), (guid, existing) -> {
            if (existing == null) {
                log.debug("Entity created guid={} {}/{} name={}", guid, delta.domain(), delta.type(), delta.name());
                return EntityRecord.create(delta);
            }
            return existing.apply(delta);
        });
        return delta.guid();
    }

    @Override
    public void upsertRelationship(RelationshipDelta delta) {
        relationships.compute(delta.key(), (key, existing) -> {
            if (existing == null) {
                log.debug("Relationship created {} {} -> {}", key.type(), key.sourceGuid(), key.targetGuid());
                return RelationshipRecord.create(delta);
            }
            return existing.refresh(delta);
        });
    }

    @Override
    public LookupResult lookup(EntityLookup query) {
        Instant now = clock.instant();
        List<String> matches = new ArrayList<>();
        for (EntityRecord entity : entities.values()) {
            if (!entity.isExpired(now) && query.matches(entity, now)) {
                matches.add(entity.guid());
                if (matches.size() > 1) {
                    break;
                }
            }
        }
        return LookupResult.of(matches);
    }

    @Override
    public ExpiryReport expireOlderThan(Instant now) {
        AtomicInteger removedEntities = new AtomicInteger();
        AtomicInteger removedTags = new AtomicInteger();
        for (String guid : entities.keySet()) {
            // expiry is rechecked inside computeIfPresent so a concurrent upsert wins
            entities.computeIfPresent(guid, (k, record) -> {
                if (record.isExpired(now)) {
                    removedEntities.incrementAndGet();
                    removedTags.addAndGet(record.tags().size());
                    return null;
                }
                EntityRecord live = record.withoutExpiredTags(now);
                removedTags.addAndGet(record.tags().size() - live.tags().size());
                return live;
            });
        }
        AtomicInteger removedRelationships = new AtomicInteger();
        for (RelationshipKey key : relationships.keySet()) {
            relationships.computeIfPresent(key, (k, record) -> {
                if (record.isExpired(now)) {
                    removedRelationships.incrementAndGet();
                    return null;
                }
                return record;
            });
        }
        return new ExpiryReport(removedEntities.get(), removedRelationships.get(), removedTags.get());
    }

    @Override
    public Optional<EntityRecord> findEntity(String guid) {
        if (guid == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        EntityRecord record = entities.get(guid);
        if (record == null || record.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(record.withoutExpiredTags(now));
    }

    @Override
    public List<RelationshipRecord> relationshipsOf(String guid) {
        Instant now = clock.instant();
        return relationships.values().stream()
                .filter(r -> !r.isExpired(now))
                .filter(r -> r.sourceGuid().equals(guid) || r.targetGuid().equals(guid))
                .sorted(Comparator.comparing(RelationshipRecord::type)
                        .thenComparing(RelationshipRecord::sourceGuid)
                        .thenComparing(RelationshipRecord::targetGuid))
                .toList();
    }

    @Override
    public long entityCount() {
        return entities.size();
    }

    @Override
    public long relationshipCount() {
        return relationships.size();
    }
}
