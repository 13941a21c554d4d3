package com.crisisrelay.record;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

import com.crisisrelay.protocol.ProtocolException;
import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Process-local record store. Every state change goes through
 * {@link ConcurrentHashMap#computeIfPresent}, which runs atomically per key.
 */
public class InMemoryRecordStore implements RecordStore {

    private final ConcurrentHashMap<Long, RiskRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Mono<Long> create(SealedValue sealedContent, SealedValue sealedScore, Instant now) {
        return Mono.fromCallable(() -> {
            long id = sequence.incrementAndGet();
            records.put(id, RiskRecord.submitted(id, sealedContent, sealedScore, now));
            return id;
        });
    }

    @Override
    public Mono<RiskRecord> find(long recordId) {
        return Mono.fromSupplier(() -> records.get(recordId));
    }

    @Override
    public Mono<Void> markHighRisk(long recordId, boolean highRisk) {
        RiskState state = highRisk ? RiskState.HIGH_RISK : RiskState.LOW_RISK;
        return update(recordId, record -> record.withRiskState(state));
    }

    @Override
    public Mono<Void> markRevealRequested(long recordId) {
        return update(recordId, record -> {
            if (record.alert().state() != RevealState.NOT_REVEALED) {
                throw ProtocolException.alreadyRevealed(recordId);
            }
            return record.withAlert(record.alert().requested());
        });
    }

    @Override
    public Mono<Void> clearRevealRequest(long recordId) {
        return update(recordId, record -> record.alert().state() == RevealState.REVEAL_REQUESTED
                ? record.withAlert(Alert.empty())
                : record);
    }

    @Override
    public Mono<Void> setAlertContent(long recordId, String content) {
        return update(recordId, record -> {
            if (record.alert().revealed()) {
                throw ProtocolException.alreadyRevealed(recordId);
            }
            return record.withAlert(record.alert().reveal(content));
        });
    }

    @Override
    public Mono<Void> markResolved(long recordId) {
        return update(recordId, record -> {
            if (!record.highRisk()) {
                throw ProtocolException.notHighRisk(recordId);
            }
            if (record.resolved()) {
                throw ProtocolException.alreadyResolved(recordId);
            }
            return record.withCaseState(CaseState.RESOLVED);
        });
    }

    @Override
    public Flux<RiskRecord> listBefore(long beforeId, int limit) {
        return Flux.defer(() -> Flux.fromStream(records.values().stream()
                .filter(record -> record.id() < beforeId)
                .sorted((left, right) -> Long.compare(right.id(), left.id()))
                .limit(limit)));
    }

    // Linear in the number of records
    @Override
    public Mono<RiskStatistics> statistics() {
        return Mono.fromSupplier(() -> records.values().stream()
                .reduce(RiskStatistics.EMPTY, RiskStatistics::plus, RiskStatistics::combine));
    }

    // An exception thrown by the change leaves the stored record untouched
    private Mono<Void> update(long recordId, UnaryOperator<RiskRecord> change) {
        return Mono.fromRunnable(() -> {
            RiskRecord updated = records.computeIfPresent(recordId, (id, current) -> change.apply(current));
            if (updated == null) {
                throw ProtocolException.notFound(recordId);
            }
        });
    }
}
