package com.crisisrelay.ledger;

import org.springframework.data.cassandra.core.EntityWriteResult;
import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;

import com.crisisrelay.protocol.ProtocolException;

import reactor.core.publisher.Mono;

/**
 * Request ledger backed by Cassandra lightweight transactions.
 *
 * <ul>
 *   <li>register: {@code INSERT ... IF NOT EXISTS}, so a recycled id is refused even after resolution</li>
 *   <li>resolve: {@code UPDATE ... IF resolved = false}, the Paxos round makes the consume atomic
 *       across every relay instance sharing the keyspace</li>
 * </ul>
 */
public class CassandraRequestLedger implements RequestLedger {

    private static final InsertOptions IF_NOT_EXISTS = InsertOptions.builder().withIfNotExists().build();

    private static final String CONSUME =
            "UPDATE pending_requests SET resolved = true WHERE request_id = ? IF resolved = false";

    private final ReactiveCassandraOperations operations;

    public CassandraRequestLedger(ReactiveCassandraOperations operations) {
        this.operations = operations;
    }

    @Override
    public Mono<Void> register(RequestId requestId, long recordId, RequestKind kind) {
        return operations.insert(PendingRequestEntity.pending(requestId, recordId, kind), IF_NOT_EXISTS)
                .map(EntityWriteResult::wasApplied)
                .flatMap(applied -> applied ? Mono.<Void>empty() : Mono.<Void>error(ProtocolException.duplicateRequest(requestId)));
    }

    @Override
    public Mono<Boolean> isRegistered(RequestId requestId) {
        return operations.selectOneById(requestId.value(), PendingRequestEntity.class).hasElement();
    }

    @Override
    public Mono<PendingRequest> lookup(RequestId requestId) {
        return operations.selectOneById(requestId.value(), PendingRequestEntity.class)
                .filter(entity -> !entity.isResolved())
                .map(PendingRequestEntity::toPendingRequest);
    }

    @Override
    public Mono<PendingRequest> resolve(RequestId requestId) {
        return lookup(requestId)
                .switchIfEmpty(Mono.error(() -> ProtocolException.unknownRequest(requestId)))
                .flatMap(request -> operations.getReactiveCqlOperations().execute(CONSUME, requestId.value())
                        .flatMap(applied -> applied ? Mono.just(request)
                                : Mono.<PendingRequest>error(ProtocolException.unknownRequest(requestId))));
    }
}
