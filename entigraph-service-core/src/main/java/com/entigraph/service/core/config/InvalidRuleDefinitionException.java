package com.entigraph.service.core.config;

/** A rule set failed validation while being materialized; the whole load is rejected. */
public class InvalidRuleDefinitionException extends IllegalArgumentException {

    private final String ruleSet;
    private final String rule;

    public InvalidRuleDefinitionException(String ruleSet, String rule, String message) {
        super(describe(ruleSet, rule, message));
        this.ruleSet = ruleSet;
        this.rule = rule;
    }

    public InvalidRuleDefinitionException(String ruleSet, String rule, String message, Throwable cause) {
        super(describe(ruleSet, rule, message), cause);
        this.ruleSet = ruleSet;
        this.rule = rule;
    }

    public String ruleSet() {
        return ruleSet;
    }

    public String rule() {
        return rule;
    }

    private static String describe(String ruleSet, String rule, String message) {
        StringBuilder sb = new StringBuilder("Invalid rule definition");
        if (ruleSet != null) sb.append(" ruleSet=").append(ruleSet);
        if (rule != null) sb.append(" rule=").append(rule);
        return sb.append(": ").append(message).toString();
    }
}
