package com.entigraph.service.core.store;

/** Counts of what a sweep removed. */
public record ExpiryReport(int entitiesRemoved, int relationshipsRemoved, int tagsRemoved) {

    public static ExpiryReport empty() {
        return new ExpiryReport(0, 0, 0);
    }

    public boolean isEmpty() {
        return entitiesRemoved == 0 && relationshipsRemoved == 0 && tagsRemoved == 0;
    }
}
