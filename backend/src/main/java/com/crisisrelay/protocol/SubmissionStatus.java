package com.crisisrelay.protocol;

import java.time.Instant;

import com.crisisrelay.record.RiskRecord;
import com.crisisrelay.record.RiskState;

/**
 * Public view of a submitted record.
 * evaluated: the oracle has answered. The verdict itself is not part of this view.
 */
public record SubmissionStatus(long id, Instant createdAt, boolean evaluated) {

    static SubmissionStatus of(RiskRecord record) {
        return new SubmissionStatus(record.id(), record.createdAt(), record.riskState() != RiskState.EVALUATING);
    }
}
