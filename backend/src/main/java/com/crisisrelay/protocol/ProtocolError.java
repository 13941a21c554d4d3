package com.crisisrelay.protocol;

/**
 * Every caller-visible failure of the relay protocol.
 * None of these is retried internally; a failed call leaves all state unchanged.
 */
public enum ProtocolError {
    THRESHOLD_NOT_SET,
    THRESHOLD_ALREADY_SET,
    UNAUTHORIZED,
    NOT_FOUND,
    NOT_HIGH_RISK,
    ALREADY_REVEALED,
    ALREADY_RESOLVED,
    UNKNOWN_REQUEST,
    DUPLICATE_REQUEST,
    INVALID_PROOF,
    MALFORMED_PAYLOAD
}
