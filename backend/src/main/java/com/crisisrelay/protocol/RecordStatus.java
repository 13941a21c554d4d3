package com.crisisrelay.protocol;

import java.time.Instant;

import com.crisisrelay.record.CaseState;
import com.crisisrelay.record.RevealState;
import com.crisisrelay.record.RiskRecord;
import com.crisisrelay.record.RiskState;

/**
 * Counselor's lifecycle view of a record, one row of the record listing.
 * Never carries the sealed handles or alert content.
 */
public record RecordStatus(
        long id,
        Instant createdAt,
        RiskState riskState,
        RevealState revealState,
        CaseState caseState
) {

    static RecordStatus of(RiskRecord record) {
        return new RecordStatus(record.id(), record.createdAt(), record.riskState(),
                record.alert().state(), record.caseState());
    }
}
