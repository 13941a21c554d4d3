package com.crisisrelay.record;

import java.time.Instant;

import com.crisisrelay.protocol.ProtocolException;
import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Holds every submitted record and its alert, keyed by a monotonically increasing id.
 *
 * <p>All mutations are atomic per record. Implementations must make
 * {@link #markRevealRequested} a compare-and-set so two concurrent reveal requests
 * for one record cannot both succeed.
 */
public interface RecordStore {

    /**
     * Allocates the next id (the first is 1) and stores an evaluating record with an empty alert.
     * An allocated id is never handed out again.
     */
    Mono<Long> create(SealedValue sealedContent, SealedValue sealedScore, Instant now);

    /** Completes empty when the id was never allocated. */
    Mono<RiskRecord> find(long recordId);

    /** Like {@link #find}, but fails with {@code NOT_FOUND} instead of completing empty. */
    default Mono<RiskRecord> get(long recordId) {
        return find(recordId).switchIfEmpty(Mono.error(() -> ProtocolException.notFound(recordId)));
    }

    default Mono<Alert> getAlert(long recordId) {
        return get(recordId).map(RiskRecord::alert);
    }

    /** Sets the risk verdict. Idempotent. */
    Mono<Void> markHighRisk(long recordId, boolean highRisk);

    /** {@code NOT_REVEALED -> REVEAL_REQUESTED}, failing {@code ALREADY_REVEALED} from any other state. */
    Mono<Void> markRevealRequested(long recordId);

    /** Undoes {@link #markRevealRequested} when the reveal request could not be registered. */
    Mono<Void> clearRevealRequest(long recordId);

    /** Stores the revealed content; fails {@code ALREADY_REVEALED} if the alert was revealed before. */
    Mono<Void> setAlertContent(long recordId, String content);

    /**
     * {@code OPEN -> RESOLVED} for a high-risk record. Fails {@code NOT_HIGH_RISK} for any other
     * risk state and {@code ALREADY_RESOLVED} when it was resolved before.
     */
    Mono<Void> markResolved(long recordId);

    /** Up to {@code limit} records with an id below {@code beforeId}, newest first. */
    Flux<RiskRecord> listBefore(long beforeId, int limit);

    /** Answered from maintained counts, never by reading every record. */
    Mono<RiskStatistics> statistics();
}
