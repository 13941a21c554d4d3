package com.crisisrelay.protocol;

import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.crisisrelay.ledger.PendingRequest;
import com.crisisrelay.ledger.RequestId;
import com.crisisrelay.ledger.RequestKind;
import com.crisisrelay.ledger.RequestLedger;
import com.crisisrelay.oracle.CallbackVerifier;
import com.crisisrelay.oracle.OracleClient;
import com.crisisrelay.record.RecordStore;
import com.crisisrelay.record.RevealState;
import com.crisisrelay.record.RiskStatistics;
import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Mono;

/**
 * Orchestrates submission, oracle risk evaluation and counselor reveal.
 *
 * <p>Per record:
 * <pre>
 *   EVALUATING --verdict=false--> LOW_RISK   (terminal)
 *   EVALUATING --verdict=true---> HIGH_RISK
 *       alert: NOT_REVEALED --requestReveal--> REVEAL_REQUESTED --resolveReveal--> REVEALED
 *       case:  OPEN --resolve--> RESOLVED
 * </pre>
 *
 * <p><strong>Callback contract:</strong> a callback is looked up, then verified, then decoded,
 * and only then is its ledger entry consumed. A forged or malformed callback therefore changes
 * nothing and leaves the request open for the genuine answer, while the atomic consume still
 * guarantees that at most one callback per request id is ever applied.
 *
 * <p>Requests that the oracle never answers leave their record in {@code EVALUATING} or
 * {@code REVEAL_REQUESTED} indefinitely. There is no timeout or retry at this level.
 */
@Service
public class RiskAssessmentProtocol {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentProtocol.class);

    static final int MAX_PAGE_SIZE = 100;

    private final ProtocolSettings settings;
    private final RecordStore recordStore;
    private final RequestLedger ledger;
    private final OracleClient oracleClient;
    private final CallbackVerifier verifier;

    public RiskAssessmentProtocol(ProtocolSettings settings,
                                  RecordStore recordStore,
                                  RequestLedger ledger,
                                  OracleClient oracleClient,
                                  CallbackVerifier verifier) {
        this.settings = settings;
        this.recordStore = recordStore;
        this.ledger = ledger;
        this.oracleClient = oracleClient;
        this.verifier = verifier;
    }

    /** Counselor-only, once. Evaluations cannot start before this. */
    public Mono<Void> setThreshold(Actor actor, SealedValue threshold) {
        return Mono.fromRunnable(() -> {
            if (!settings.isCounselor(actor)) {
                throw ProtocolException.unauthorized("setting the threshold");
            }
            if (!settings.assignThreshold(threshold)) {
                throw ProtocolException.thresholdAlreadySet();
            }
            log.info("Risk threshold configured by counselor");
        });
    }

    /**
     * Stores a new record and asks the oracle whether its score exceeds the threshold.
     * Fails before creating anything when no threshold is configured.
     *
     * @return the new record id
     */
    public Mono<Long> submit(SealedValue sealedContent, SealedValue sealedScore, Instant now) {
        return Mono.defer(() -> {
            SealedValue threshold = settings.threshold().orElse(null);
            if (threshold == null) {
                return Mono.<Long>error(ProtocolException.thresholdNotSet());
            }
            // The evaluation only needs the score, so issue first: a transport failure leaves no record behind
            return oracleClient.request(RequestKind.RISK_EVALUATION, List.of(sealedScore, threshold))
                    .flatMap(requestId -> unregistered(requestId)
                            .then(Mono.defer(() -> recordStore.create(sealedContent, sealedScore, now)))
                            .flatMap(recordId -> ledger.register(requestId, recordId, RequestKind.RISK_EVALUATION)
                                    .doOnError(ex -> log.warn("Record {} stays unevaluated: {}", recordId, ex.getMessage()))
                                    .thenReturn(recordId)))
                    .doOnNext(recordId -> log.info("Record {} submitted, risk evaluation pending", recordId));
        });
    }

    /** Oracle callback carrying the boolean "score exceeds threshold" verdict. */
    public Mono<Void> resolveRiskEvaluation(RequestId requestId, byte[] cleartext, byte[] proof) {
        return pending(requestId, RequestKind.RISK_EVALUATION)
                .flatMap(request -> {
                    boolean highRisk = verifier.verifyVerdict(requestId, cleartext, proof);
                    return ledger.resolve(requestId)
                            .then(recordStore.markHighRisk(request.recordId(), highRisk))
                            .doOnSuccess(done -> log.info("Record {} evaluated: {}",
                                    request.recordId(), highRisk ? "HIGH_RISK" : "LOW_RISK"));
                })
                .doOnError(ProtocolException.class, ex -> rejected(requestId, ex));
    }

    /**
     * Counselor asks the oracle to reveal the content of a high-risk record.
     * Checked in order: record exists, record is high risk, caller is the counselor, alert not yet requested.
     *
     * @return the oracle request id the reveal will be answered under
     */
    public Mono<RequestId> requestReveal(Actor actor, long recordId) {
        return recordStore.get(recordId)
                .flatMap(record -> {
                    if (!record.highRisk()) {
                        return Mono.<RequestId>error(ProtocolException.notHighRisk(recordId));
                    }
                    if (!settings.isCounselor(actor)) {
                        return Mono.<RequestId>error(ProtocolException.unauthorized("requesting a reveal"));
                    }
                    if (record.alert().state() != RevealState.NOT_REVEALED) {
                        return Mono.<RequestId>error(ProtocolException.alreadyRevealed(recordId));
                    }
                    return oracleClient.request(RequestKind.CONTENT_REVEAL, List.of(record.sealedContent()))
                            .flatMap(requestId -> unregistered(requestId)
                                    .then(Mono.defer(() -> recordStore.markRevealRequested(recordId)))
                                    .then(ledger.register(requestId, recordId, RequestKind.CONTENT_REVEAL)
                                            .onErrorResume(ex -> recordStore.clearRevealRequest(recordId)
                                                    .then(Mono.<Void>error(ex))))
                                    .thenReturn(requestId));
                })
                .doOnNext(requestId -> log.info("Reveal of record {} requested as {}", recordId, requestId));
    }

    /** Oracle callback carrying the revealed content. */
    public Mono<Void> resolveReveal(RequestId requestId, byte[] cleartext, byte[] proof) {
        return pending(requestId, RequestKind.CONTENT_REVEAL)
                .flatMap(request -> {
                    String content = verifier.verifyContent(requestId, cleartext, proof);
                    return recordStore.get(request.recordId())
                            .flatMap(record -> record.highRisk()
                                    ? ledger.resolve(requestId).then(recordStore.setAlertContent(record.id(), content))
                                    : Mono.<Void>error(ProtocolException.notHighRisk(record.id())))
                            .doOnSuccess(done -> log.info("Record {} revealed", request.recordId()));
                })
                .doOnError(ProtocolException.class, ex -> rejected(requestId, ex));
    }

    /** Counselor-only. Content stays empty until the alert is revealed, whatever the risk state. */
    public Mono<AlertView> readAlert(Actor actor, long recordId) {
        if (!settings.isCounselor(actor)) {
            return Mono.error(ProtocolException.unauthorized("reading alerts"));
        }
        return recordStore.getAlert(recordId)
                .map(alert -> alert.revealed()
                        ? new AlertView(alert.content(), true)
                        : new AlertView("", false));
    }

    /**
     * Counselor follow-up: closes the case of a high-risk record.
     * Checked in order: caller is the counselor, record exists, record is high risk, case still open.
     */
    public Mono<Void> resolve(Actor actor, long recordId) {
        if (!settings.isCounselor(actor)) {
            return Mono.error(ProtocolException.unauthorized("resolving records"));
        }
        return recordStore.markResolved(recordId)
                .doOnSuccess(done -> log.info("Record {} resolved by counselor", recordId));
    }

    /** Counselor-only page of records, newest first, starting below {@code beforeId}. */
    public Mono<RecordPage> listRecords(Actor actor, long beforeId, int limit) {
        if (!settings.isCounselor(actor)) {
            return Mono.error(ProtocolException.unauthorized("listing records"));
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            return Mono.error(new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE + ": " + limit));
        }
        if (beforeId < 1) {
            return Mono.error(new IllegalArgumentException("Cursor must be positive: " + beforeId));
        }
        return recordStore.listBefore(beforeId, limit)
                .map(RecordStatus::of)
                .collectList()
                .map(RecordPage::of);
    }

    /** Full lifecycle view, including the verdict. Counselor only. */
    public Mono<RecordStatus> status(Actor actor, long recordId) {
        if (!settings.isCounselor(actor)) {
            return Mono.error(ProtocolException.unauthorized("reading record status"));
        }
        return recordStore.get(recordId).map(RecordStatus::of);
    }

    /** What anyone holding the id may see: whether the evaluation has finished, never its outcome. */
    public Mono<SubmissionStatus> submissionStatus(long recordId) {
        return recordStore.get(recordId).map(SubmissionStatus::of);
    }

    public Mono<RiskStatistics> statistics(Actor actor) {
        if (!settings.isCounselor(actor)) {
            return Mono.error(ProtocolException.unauthorized("reading statistics"));
        }
        return recordStore.statistics();
    }

    public Mono<Boolean> oracleAvailable() {
        return oracleClient.isAvailable();
    }

    // A recycled id would strand whatever is written for it, so refuse it before the first write
    private Mono<Void> unregistered(RequestId requestId) {
        return ledger.isRegistered(requestId)
                .flatMap(registered -> registered
                        ? Mono.<Void>error(ProtocolException.duplicateRequest(requestId))
                        : Mono.<Void>empty());
    }

    // A request id of the other kind is unknown to this entry point
    private Mono<PendingRequest> pending(RequestId requestId, RequestKind kind) {
        return ledger.lookup(requestId)
                .filter(request -> request.kind() == kind)
                .switchIfEmpty(Mono.error(() -> ProtocolException.unknownRequest(requestId)));
    }

    private void rejected(RequestId requestId, ProtocolException ex) {
        log.warn("Callback for request {} rejected ({}): {}", requestId, ex.getError(), ex.getMessage());
    }
}
