package com.crisisrelay.ledger;

import reactor.core.publisher.Mono;

/**
 * Maps oracle request ids to the record they belong to.
 *
 * <p>An id is registered once and resolved at most once. Resolved ids are kept as
 * tombstones: they can neither be resolved again nor registered again, which is what
 * rejects a replayed callback or an oracle that recycles ids.
 *
 * <p>There is deliberately no way to list pending requests.
 */
public interface RequestLedger {

    /** Fails with {@code DUPLICATE_REQUEST} if the id was ever registered before. */
    Mono<Void> register(RequestId requestId, long recordId, RequestKind kind);

    /** True if the id was ever registered, whether still pending or already resolved. */
    Mono<Boolean> isRegistered(RequestId requestId);

    /** The still-pending entry for this id; completes empty if unknown or already resolved. */
    Mono<PendingRequest> lookup(RequestId requestId);

    /**
     * Atomically consumes the entry. Of any number of concurrent calls for one id, exactly
     * one succeeds; the others, and every later call, fail with {@code UNKNOWN_REQUEST}.
     */
    Mono<PendingRequest> resolve(RequestId requestId);
}
