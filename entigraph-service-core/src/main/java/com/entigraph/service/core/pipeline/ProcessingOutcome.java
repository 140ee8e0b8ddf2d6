package com.entigraph.service.core.pipeline;

import com.entigraph.service.core.synthesis.NoMatchReason;

/**
 * @param entityGuid GUID of the upserted entity, {@code null} on no-match
 * @param noMatch why no entity was produced, {@code null} on match
 * @param relationships relationship deltas applied to the store
 * @param deadLettered whether any store write was given up on
 */
public record ProcessingOutcome(String entityGuid, NoMatchReason noMatch, int relationships, boolean deadLettered) {}
