package com.crisisrelay.sealed;

/**
 * Opaque handle to a confidentially-held value (message content, risk score, threshold).
 *
 * The handle is produced by the external sealing provider in the submitter's browser.
 * The relay stores and forwards it to the oracle but never decodes it; only the oracle's
 * off-chain computation can operate on what it points to.
 */
public record SealedValue(String handle) {

    public SealedValue {
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("Sealed value handle must not be blank");
        }
    }

    @Override
    public String toString() {
        // Handles can be large ciphertext blobs, keep log lines short
        return handle.length() <= 16 ? "SealedValue[" + handle + "]"
                : "SealedValue[" + handle.substring(0, 16) + "...]";
    }
}
