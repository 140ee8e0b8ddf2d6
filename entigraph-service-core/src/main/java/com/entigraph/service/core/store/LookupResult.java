package com.entigraph.service.core.store;

import java.util.List;

/** Outcome of an entity lookup. Only {@link Outcome#ONE} carries a usable GUID. */
public record LookupResult(Outcome outcome, List<String> guids) {

    public enum Outcome {
        NONE,
        ONE,
        AMBIGUOUS
    }

    public static LookupResult none() {
        return new LookupResult(Outcome.NONE, List.of());
    }

    public static LookupResult of(List<String> guids) {
        if (guids == null || guids.isEmpty()) {
            return none();
        }
        return new LookupResult(guids.size() == 1 ? Outcome.ONE : Outcome.AMBIGUOUS, List.copyOf(guids));
    }

    public boolean isUnique() {
        return outcome == Outcome.ONE;
    }

    public String guid() {
        if (outcome != Outcome.ONE) {
            throw new IllegalStateException("Lookup result is " + outcome);
        }
        return guids.get(0);
    }
}
