package com.crisisrelay.record;

import java.time.Instant;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import com.crisisrelay.sealed.SealedValue;

/**
 * Cassandra row for one record and its alert.
 * Record and alert share a row so a single lightweight transaction covers both.
 */
@Table("records")
public class RecordEntity {

    @PrimaryKey
    private Long id;

    /** Opaque handle from the sealing provider. Never decoded server-side. */
    @Column("sealed_content")
    private String sealedContent;

    @Column("sealed_score")
    private String sealedScore;

    @Column("created_at")
    private Instant createdAt;

    @Column("risk_state")
    private String riskState;

    /** Empty until the oracle answers a content-reveal request. */
    @Column("alert_content")
    private String alertContent;

    @Column("reveal_state")
    private String revealState;

    @Column("case_state")
    private String caseState;

    public RecordEntity() {}

    static RecordEntity from(RiskRecord record) {
        RecordEntity entity = new RecordEntity();
        entity.setId(record.id());
        entity.setSealedContent(record.sealedContent().handle());
        entity.setSealedScore(record.sealedScore().handle());
        entity.setCreatedAt(record.createdAt());
        entity.setRiskState(record.riskState().name());
        entity.setAlertContent(record.alert().content());
        entity.setRevealState(record.alert().state().name());
        entity.setCaseState(record.caseState().name());
        return entity;
    }

    RiskRecord toRecord() {
        return new RiskRecord(
                id,
                new SealedValue(sealedContent),
                new SealedValue(sealedScore),
                createdAt,
                RiskState.valueOf(riskState),
                new Alert(alertContent, RevealState.valueOf(revealState)),
                caseState == null ? CaseState.OPEN : CaseState.valueOf(caseState));
    }

    // Getters & Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSealedContent() { return sealedContent; }
    public void setSealedContent(String sealedContent) { this.sealedContent = sealedContent; }
    public String getSealedScore() { return sealedScore; }
    public void setSealedScore(String sealedScore) { this.sealedScore = sealedScore; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public String getRiskState() { return riskState; }
    public void setRiskState(String riskState) { this.riskState = riskState; }
    public String getAlertContent() { return alertContent; }
    public void setAlertContent(String alertContent) { this.alertContent = alertContent; }
    public String getRevealState() { return revealState; }
    public void setRevealState(String revealState) { this.revealState = revealState; }
    public String getCaseState() { return caseState; }
    public void setCaseState(String caseState) { this.caseState = caseState; }
}
