package com.entigraph.service.core.synthesis;

import com.entigraph.entity.model.EntityDelta;
import java.util.Optional;

/**
 * Either an entity delta produced by {@code ruleId}, or a no-match with its reason. No-match is a
 * normal outcome, not an error.
 */
public record SynthesisResult(EntityDelta delta, String ruleId, NoMatchReason reason, String detail) {

    public static SynthesisResult matched(EntityDelta delta, String ruleId) {
        return new SynthesisResult(delta, ruleId, null, null);
    }

    public static SynthesisResult noMatch(NoMatchReason reason, String ruleId, String detail) {
        return new SynthesisResult(null, ruleId, reason, detail);
    }

    public boolean isMatch() {
        return delta != null;
    }

    public Optional<EntityDelta> entityDelta() {
        return Optional.ofNullable(delta);
    }
}
