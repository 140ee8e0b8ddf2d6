package com.entigraph.service.core.store;

import com.entigraph.entity.model.EntityDelta;
import com.entigraph.entity.model.EntityRecord;
import com.entigraph.entity.model.RelationshipDelta;
import com.entigraph.entity.model.RelationshipRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entity and relationship storage. Implementations serialize writes per GUID (entities) and per
 * relationship key; failures surface as {@link StoreUnavailableException}.
 */
public interface EntityStore {

    /** Creates or merges the entity; returns its GUID. */
    String upsertEntity(EntityDelta delta);

    /** Creates the relationship or refreshes its expiry. */
    void upsertRelationship(RelationshipDelta delta);

    LookupResult lookup(EntityLookup query);

    /**
     * Removes entities, relationships and tag values whose expiry is before {@code now}. Expiry is
     * rechecked at the moment of deletion so a concurrent refresh is never lost.
     */
    ExpiryReport expireOlderThan(Instant now);

    Optional<EntityRecord> findEntity(String guid);

    /** Relationships where the entity is source or target. */
    List<RelationshipRecord> relationshipsOf(String guid);

    long entityCount();

    long relationshipCount();
}
