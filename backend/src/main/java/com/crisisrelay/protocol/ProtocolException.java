package com.crisisrelay.protocol;

import com.crisisrelay.ledger.RequestId;

/**
 * Unchecked failure of a protocol operation, tagged with its {@link ProtocolError}.
 * Emitted as a {@code Mono.error} signal by the reactive stores and the protocol.
 */
public class ProtocolException extends RuntimeException {

    private final ProtocolError error;

    public ProtocolException(ProtocolError error, String message) {
        super(message);
        this.error = error;
    }

    public ProtocolError getError() {
        return error;
    }

    public static ProtocolException thresholdNotSet() {
        return new ProtocolException(ProtocolError.THRESHOLD_NOT_SET, "Risk threshold has not been configured");
    }

    public static ProtocolException thresholdAlreadySet() {
        return new ProtocolException(ProtocolError.THRESHOLD_ALREADY_SET, "Risk threshold is already configured");
    }

    public static ProtocolException unauthorized(String operation) {
        return new ProtocolException(ProtocolError.UNAUTHORIZED, "Unauthorized: " + operation + " is reserved to the counselor");
    }

    public static ProtocolException notFound(long recordId) {
        return new ProtocolException(ProtocolError.NOT_FOUND, "Record not found: " + recordId);
    }

    public static ProtocolException notHighRisk(long recordId) {
        return new ProtocolException(ProtocolError.NOT_HIGH_RISK, "Record is not high risk: " + recordId);
    }

    public static ProtocolException alreadyRevealed(long recordId) {
        return new ProtocolException(ProtocolError.ALREADY_REVEALED, "Alert already revealed or reveal pending: " + recordId);
    }

    public static ProtocolException alreadyResolved(long recordId) {
        return new ProtocolException(ProtocolError.ALREADY_RESOLVED, "Record already resolved: " + recordId);
    }

    public static ProtocolException unknownRequest(RequestId requestId) {
        return new ProtocolException(ProtocolError.UNKNOWN_REQUEST, "Unknown or already resolved request: " + requestId);
    }

    public static ProtocolException duplicateRequest(RequestId requestId) {
        return new ProtocolException(ProtocolError.DUPLICATE_REQUEST, "Request id already registered: " + requestId);
    }

    public static ProtocolException invalidProof(RequestId requestId) {
        return new ProtocolException(ProtocolError.INVALID_PROOF, "Callback proof does not authenticate request " + requestId);
    }

    public static ProtocolException malformedPayload(RequestId requestId, String expected) {
        return new ProtocolException(ProtocolError.MALFORMED_PAYLOAD,
                "Callback payload for request " + requestId + " is not a valid " + expected);
    }
}
