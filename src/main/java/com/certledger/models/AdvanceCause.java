package com.certledger.models;

/**
 * The only legal reasons for an epoch to close. There is deliberately no
 * time-based cause.
 */
public enum AdvanceCause {
    BUDGET_EXHAUSTED,
    OPERATOR_REQUEST
}
