package com.crisisrelay.record;

/** Outcome of the oracle's "score > threshold" evaluation for one record. */
public enum RiskState {
    EVALUATING,
    LOW_RISK,
    HIGH_RISK
}
