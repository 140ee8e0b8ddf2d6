package com.entigraph.service.core.store;

import com.entigraph.entity.model.EntityRecord;
import java.time.Instant;
import java.util.List;

/**
 * Lookup query: optional domain/type narrowing plus field predicates that must all hold.
 */
public record EntityLookup(String domain, String type, List<FieldPredicate> predicates) {

    public EntityLookup {
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
    }

    public boolean matches(EntityRecord entity, Instant now) {
        if (domain != null && !domain.equals(entity.domain())) return false;
        if (type != null && !type.equals(entity.type())) return false;
        for (FieldPredicate predicate : predicates) {
            if (!predicate.test(entity, now)) return false;
        }
        return true;
    }
}
