package com.crisisrelay.oracle;

import java.util.List;

import com.crisisrelay.ledger.RequestKind;

/**
 * Body of {@code POST /requests} on the oracle.
 * handles: the sealed values to operate on, in the order the computation expects them
 * (score first, then threshold, for a risk evaluation).
 */
public record OracleRequest(
        RequestKind kind,
        List<String> handles,
        String callbackUrl   // where the oracle pushes (requestId, cleartext, proof)
) {}
