package com.crisisrelay.record;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.LongStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;

import com.crisisrelay.protocol.ProtocolException;
import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Record store backed by Cassandra / ScyllaDB.
 *
 * <p>Ids come from a single sequence row advanced with a lightweight transaction
 * ({@code IF next_id = ?}), so concurrent relays never hand out the same id. State changes are
 * conditional updates on the record row, which gives the compare-and-set semantics
 * {@link RecordStore} asks for without holding any lock across calls.
 *
 * <p>Statistics live in the {@code record_counters} counter table and are adjusted only after a
 * conditional update applied. Counter writes are not part of the transaction: a crash between the
 * two leaves a count off by one.
 */
public class CassandraRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(CassandraRecordStore.class);

    private static final String SEQUENCE = "records";
    private static final int MAX_SEQUENCE_ATTEMPTS = 16;

    private static final String SEED_SEQUENCE =
            "INSERT INTO record_sequence (name, next_id) VALUES (?, ?) IF NOT EXISTS";
    private static final String READ_SEQUENCE =
            "SELECT next_id FROM record_sequence WHERE name = ?";
    private static final String ADVANCE_SEQUENCE =
            "UPDATE record_sequence SET next_id = ? WHERE name = ? IF next_id = ?";

    private static final String SET_RISK_STATE =
            "UPDATE records SET risk_state = ? WHERE id = ? IF risk_state = ?";
    private static final String TRANSITION_REVEAL_STATE =
            "UPDATE records SET reveal_state = ? WHERE id = ? IF reveal_state = ?";
    private static final String REVEAL_ALERT =
            "UPDATE records SET alert_content = ?, reveal_state = ? WHERE id = ? IF reveal_state = ?";
    private static final String RESOLVE_CASE =
            "UPDATE records SET case_state = ? WHERE id = ? IF risk_state = ? AND case_state = ?";

    private static final String ADJUST_COUNTER =
            "UPDATE record_counters SET amount = amount + ? WHERE name = ?";
    private static final String READ_COUNTERS =
            "SELECT name, amount FROM record_counters";

    static final String TOTAL = "total";
    static final String EVALUATING = "evaluating";
    static final String LOW_RISK = "low_risk";
    static final String HIGH_RISK = "high_risk";
    static final String REVEAL_REQUESTED = "reveal_requested";
    static final String REVEALED = "revealed";
    static final String RESOLVED = "resolved";

    private final RecordRepository repository;
    private final ReactiveCqlOperations cql;
    private final AtomicBoolean sequenceSeeded = new AtomicBoolean();

    public CassandraRecordStore(RecordRepository repository, ReactiveCqlOperations cql) {
        this.repository = repository;
        this.cql = cql;
    }

    @Override
    public Mono<Long> create(SealedValue sealedContent, SealedValue sealedScore, Instant now) {
        return nextId()
                .flatMap(id -> repository.insert(RecordEntity.from(RiskRecord.submitted(id, sealedContent, sealedScore, now)))
                        .then(adjust(TOTAL, 1))
                        .then(adjust(EVALUATING, 1))
                        .thenReturn(id));
    }

    @Override
    public Mono<RiskRecord> find(long recordId) {
        return repository.findById(recordId).map(RecordEntity::toRecord);
    }

    /** Only the first verdict applies; a repeated one completes without touching the row. */
    @Override
    public Mono<Void> markHighRisk(long recordId, boolean highRisk) {
        RiskState state = highRisk ? RiskState.HIGH_RISK : RiskState.LOW_RISK;
        return cql.execute(SET_RISK_STATE, state.name(), recordId, RiskState.EVALUATING.name())
                .flatMap(applied -> applied
                        ? adjust(EVALUATING, -1).then(adjust(highRisk ? HIGH_RISK : LOW_RISK, 1))
                        : find(recordId)
                                .switchIfEmpty(Mono.error(() -> ProtocolException.notFound(recordId)))
                                .then());
    }

    @Override
    public Mono<Void> markRevealRequested(long recordId) {
        return cql.execute(TRANSITION_REVEAL_STATE,
                        RevealState.REVEAL_REQUESTED.name(), recordId, RevealState.NOT_REVEALED.name())
                .flatMap(applied -> applied ? adjust(REVEAL_REQUESTED, 1)
                        : rejected(recordId, () -> ProtocolException.alreadyRevealed(recordId)));
    }

    @Override
    public Mono<Void> clearRevealRequest(long recordId) {
        return cql.execute(TRANSITION_REVEAL_STATE,
                        RevealState.NOT_REVEALED.name(), recordId, RevealState.REVEAL_REQUESTED.name())
                .flatMap(applied -> {
                    if (!applied) {
                        log.warn("Reveal request for record {} was no longer pending, nothing to clear", recordId);
                        return Mono.<Void>empty();
                    }
                    return adjust(REVEAL_REQUESTED, -1);
                });
    }

    // Tried from REVEAL_REQUESTED first, the usual path, so the counters know which state was left
    @Override
    public Mono<Void> setAlertContent(long recordId, String content) {
        return cql.execute(REVEAL_ALERT, content, RevealState.REVEALED.name(), recordId, RevealState.REVEAL_REQUESTED.name())
                .flatMap(fromRequested -> fromRequested
                        ? adjust(REVEAL_REQUESTED, -1).then(adjust(REVEALED, 1))
                        : cql.execute(REVEAL_ALERT, content, RevealState.REVEALED.name(), recordId, RevealState.NOT_REVEALED.name())
                                .flatMap(fromNotRevealed -> fromNotRevealed ? adjust(REVEALED, 1)
                                        : rejected(recordId, () -> ProtocolException.alreadyRevealed(recordId))));
    }

    @Override
    public Mono<Void> markResolved(long recordId) {
        return cql.execute(RESOLVE_CASE, CaseState.RESOLVED.name(), recordId,
                        RiskState.HIGH_RISK.name(), CaseState.OPEN.name())
                .flatMap(applied -> applied ? adjust(RESOLVED, 1)
                        : find(recordId)
                                .switchIfEmpty(Mono.error(() -> ProtocolException.notFound(recordId)))
                                .flatMap(record -> Mono.<Void>error(record.highRisk()
                                        ? ProtocolException.alreadyResolved(recordId)
                                        : ProtocolException.notHighRisk(recordId))));
    }

    /**
     * Reads the window of ids just below {@code beforeId} by primary key. An id whose insert never
     * happened leaves a gap, so a page can come back shorter than {@code limit}.
     */
    @Override
    public Flux<RiskRecord> listBefore(long beforeId, int limit) {
        return cql.queryForObject(READ_SEQUENCE, Long.class, SEQUENCE)
                .flatMapMany(nextId -> {
                    long newest = Math.min(beforeId, nextId) - 1;
                    if (newest < 1) {
                        return Flux.<RecordEntity>empty();
                    }
                    List<Long> ids = LongStream.rangeClosed(Math.max(1, newest - limit + 1), newest)
                            .boxed()
                            .toList();
                    return repository.findAllById(ids);
                })
                .map(RecordEntity::toRecord)
                .sort((left, right) -> Long.compare(right.id(), left.id()));
    }

    @Override
    public Mono<RiskStatistics> statistics() {
        return cql.queryForRows(READ_COUNTERS)
                .collectMap(row -> row.getString("name"), row -> row.getLong("amount"))
                .map(CassandraRecordStore::toStatistics);
    }

    static RiskStatistics toStatistics(Map<String, Long> counts) {
        return new RiskStatistics(
                counts.getOrDefault(TOTAL, 0L),
                counts.getOrDefault(EVALUATING, 0L),
                counts.getOrDefault(LOW_RISK, 0L),
                counts.getOrDefault(HIGH_RISK, 0L),
                counts.getOrDefault(REVEAL_REQUESTED, 0L),
                counts.getOrDefault(REVEALED, 0L),
                counts.getOrDefault(RESOLVED, 0L));
    }

    private Mono<Void> adjust(String counter, long delta) {
        return cql.execute(ADJUST_COUNTER, delta, counter).then();
    }

    /** A conditional update that did not apply: either the row is missing or its state forbids the change. */
    private Mono<Void> rejected(long recordId, Supplier<ProtocolException> stateConflict) {
        return find(recordId)
                .switchIfEmpty(Mono.error(() -> ProtocolException.notFound(recordId)))
                .then(Mono.error(stateConflict));
    }

    private Mono<Long> nextId() {
        return seedSequence()
                .then(Mono.defer(() -> cql.queryForObject(READ_SEQUENCE, Long.class, SEQUENCE)
                        .filterWhen(current -> cql.execute(ADVANCE_SEQUENCE, current + 1, SEQUENCE, current))))
                // Lost the compare-and-set to another writer: read again
                .repeatWhenEmpty(MAX_SEQUENCE_ATTEMPTS, attempts -> attempts);
    }

    private Mono<Void> seedSequence() {
        if (sequenceSeeded.get()) {
            return Mono.empty();
        }
        return cql.execute(SEED_SEQUENCE, SEQUENCE, 1L)
                .doOnSuccess(created -> sequenceSeeded.set(true))
                .then();
    }
}
