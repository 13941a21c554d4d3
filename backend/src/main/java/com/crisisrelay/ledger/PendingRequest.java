package com.crisisrelay.ledger;

/** Correlation entry: which record an outstanding oracle request belongs to, and what it asks for. */
public record PendingRequest(RequestId requestId, long recordId, RequestKind kind) {}
