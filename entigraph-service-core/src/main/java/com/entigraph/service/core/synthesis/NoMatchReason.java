package com.entigraph.service.core.synthesis;

public enum NoMatchReason {
    MISSING_EVENT_TYPE,
    NO_RULES,
    CONDITIONS_NOT_MET,
    IDENTIFIER_UNRESOLVED,
    ACCOUNT_UNRESOLVED,
    EVALUATION_ERROR
}
