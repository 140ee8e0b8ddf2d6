package com.entigraph.service.core.resolve;

import com.entigraph.service.core.config.ConditionDefinition;
import com.entigraph.service.core.support.AttributeValues;
import com.entigraph.telemetry.model.TelemetryEvent;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Evaluates rule conditions; all conditions of a rule must hold. */
@Component
public class ConditionEvaluator {

    public boolean matchesAll(TelemetryEvent event, List<ConditionDefinition> conditions) {
        if (conditions == null) {
            return true;
        }
        for (ConditionDefinition condition : conditions) {
            if (!matches(event, condition)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(TelemetryEvent event, ConditionDefinition condition) {
        Optional<String> value = AttributeValues.stringValue(event, condition.attribute());
        boolean result =
                switch (condition.operator()) {
                    case EQUALS -> value.map(v -> v.equals(condition.value())).orElse(false);
                    case ANY_OF -> value.map(v -> condition.values().contains(v)).orElse(false);
                    case PRESENT -> value.isPresent();
                    case ABSENT -> value.isEmpty();
                    case PREFIX -> value.map(v -> v.startsWith(condition.value())).orElse(false);
                };
        return condition.negate() != result;
    }
}
