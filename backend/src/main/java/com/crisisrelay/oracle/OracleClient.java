package com.crisisrelay.oracle;

import java.util.List;

import com.crisisrelay.ledger.RequestId;
import com.crisisrelay.ledger.RequestKind;
import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Mono;

/**
 * Outbound side of the decryption oracle.
 *
 * <p>{@link #request} only obtains a correlation token. The actual evaluation happens out of
 * process and arrives later, possibly never, through the callback endpoints.
 */
public interface OracleClient {

    /** Issues a request over the given sealed values. Ids are unique for the lifetime of the oracle. */
    Mono<RequestId> request(RequestKind kind, List<SealedValue> sealedValues);

    /** Whether the oracle currently answers its health check. Never errors. */
    Mono<Boolean> isAvailable();
}
