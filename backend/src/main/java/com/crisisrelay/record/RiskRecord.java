package com.crisisrelay.record;

import java.time.Instant;

import com.crisisrelay.sealed.SealedValue;

/**
 * One submitted message: its sealed content, sealed risk score and derived alert.
 * Identifiers start at 1; records are never deleted.
 */
public record RiskRecord(
        long id,
        SealedValue sealedContent,
        SealedValue sealedScore,
        Instant createdAt,
        RiskState riskState,
        Alert alert,
        CaseState caseState
) {

    public RiskRecord {
        if (id <= 0) {
            throw new IllegalArgumentException("Record id must be positive: " + id);
        }
        caseState = caseState == null ? CaseState.OPEN : caseState;
    }

    /** A freshly submitted record, waiting on its risk evaluation. */
    public static RiskRecord submitted(long id, SealedValue sealedContent, SealedValue sealedScore, Instant createdAt) {
        return new RiskRecord(id, sealedContent, sealedScore, createdAt, RiskState.EVALUATING, Alert.empty(), CaseState.OPEN);
    }

    public boolean highRisk() {
        return riskState == RiskState.HIGH_RISK;
    }

    public boolean resolved() {
        return caseState == CaseState.RESOLVED;
    }

    public RiskRecord withRiskState(RiskState state) {
        return new RiskRecord(id, sealedContent, sealedScore, createdAt, state, alert, caseState);
    }

    public RiskRecord withAlert(Alert updated) {
        return new RiskRecord(id, sealedContent, sealedScore, createdAt, riskState, updated, caseState);
    }

    public RiskRecord withCaseState(CaseState state) {
        return new RiskRecord(id, sealedContent, sealedScore, createdAt, riskState, alert, state);
    }
}
