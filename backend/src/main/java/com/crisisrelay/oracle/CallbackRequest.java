package com.crisisrelay.oracle;

/**
 * What the oracle pushes back for a request.
 * cleartext and proof travel as base64 in JSON and arrive here as raw bytes.
 */
public record CallbackRequest(
        String requestId,
        byte[] cleartext,   // 0x00 / 0x01 verdict, or UTF-8 content
        byte[] proof        // Ed25519 signature, see CallbackVerifier
) {}
