package com.crisisrelay.record;

/**
 * Aggregate counts over all records, per risk, reveal and case state.
 * Counts only; no handle or content ever leaves the store through this view.
 */
public record RiskStatistics(
        long total,
        long evaluating,
        long lowRisk,
        long highRisk,
        long revealRequested,
        long revealed,
        long resolved
) {

    public static final RiskStatistics EMPTY = new RiskStatistics(0, 0, 0, 0, 0, 0, 0);

    public RiskStatistics plus(RiskRecord record) {
        RiskState risk = record.riskState();
        RevealState reveal = record.alert().state();
        return new RiskStatistics(
                total + 1,
                evaluating + (risk == RiskState.EVALUATING ? 1 : 0),
                lowRisk + (risk == RiskState.LOW_RISK ? 1 : 0),
                highRisk + (risk == RiskState.HIGH_RISK ? 1 : 0),
                revealRequested + (reveal == RevealState.REVEAL_REQUESTED ? 1 : 0),
                revealed + (reveal == RevealState.REVEALED ? 1 : 0),
                resolved + (record.resolved() ? 1 : 0));
    }

    public RiskStatistics combine(RiskStatistics other) {
        return new RiskStatistics(
                total + other.total,
                evaluating + other.evaluating,
                lowRisk + other.lowRisk,
                highRisk + other.highRisk,
                revealRequested + other.revealRequested,
                revealed + other.revealed,
                resolved + other.resolved);
    }
}
