package com.crisisrelay.oracle;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import com.crisisrelay.ledger.RequestId;
import com.crisisrelay.protocol.ProtocolException;

/**
 * Authenticates oracle callbacks before anything is allowed to change.
 *
 * <p>A proof is an Ed25519 signature by the oracle's signing key over
 * <pre>
 *   "crisisrelay.callback.v1" || uint32(len(requestId)) || utf8(requestId) || cleartext
 * </pre>
 * Binding the request id into the signed bytes stops a valid answer for one request from
 * being replayed against another. The length prefix keeps the id/cleartext split unambiguous.
 *
 * <p>Payload shapes:
 * <ul>
 *   <li>risk evaluation: one byte, {@code 0x00} or {@code 0x01}</li>
 *   <li>content reveal: strict UTF-8 text</li>
 * </ul>
 */
public class CallbackVerifier {

    static final byte[] DOMAIN = "crisisrelay.callback.v1".getBytes(StandardCharsets.US_ASCII);

    private static final int PUBLIC_KEY_SIZE = Ed25519PublicKeyParameters.KEY_SIZE;

    private final Ed25519PublicKeyParameters oracleKey;

    public CallbackVerifier(Ed25519PublicKeyParameters oracleKey) {
        this.oracleKey = oracleKey;
    }

    /** Builds a verifier from the base64 encoding of the oracle's raw 32-byte Ed25519 public key. */
    public static CallbackVerifier fromBase64(String verifyingKey) {
        if (verifyingKey == null || verifyingKey.isBlank()) {
            throw new IllegalArgumentException("Oracle verifying key is not configured");
        }
        byte[] raw = Base64.getDecoder().decode(verifyingKey.trim());
        if (raw.length != PUBLIC_KEY_SIZE) {
            throw new IllegalArgumentException(
                    "Oracle verifying key must be " + PUBLIC_KEY_SIZE + " bytes, got " + raw.length);
        }
        return new CallbackVerifier(new Ed25519PublicKeyParameters(raw, 0));
    }

    /** The exact bytes the oracle signs for a callback. */
    public static byte[] signingInput(RequestId requestId, byte[] cleartext) {
        byte[] id = requestId.value().getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(DOMAIN.length + Integer.BYTES + id.length + cleartext.length)
                .put(DOMAIN)
                .putInt(id.length)
                .put(id)
                .put(cleartext)
                .array();
    }

    /** Verifies the proof, then decodes a risk verdict. */
    public boolean verifyVerdict(RequestId requestId, byte[] cleartext, byte[] proof) {
        authenticate(requestId, cleartext, proof);
        if (cleartext.length != 1 || (cleartext[0] != 0 && cleartext[0] != 1)) {
            throw ProtocolException.malformedPayload(requestId, "boolean verdict");
        }
        return cleartext[0] == 1;
    }

    /** Verifies the proof, then decodes revealed content. */
    public String verifyContent(RequestId requestId, byte[] cleartext, byte[] proof) {
        authenticate(requestId, cleartext, proof);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(cleartext))
                    .toString();
        } catch (CharacterCodingException e) {
            throw ProtocolException.malformedPayload(requestId, "UTF-8 text");
        }
    }

    private void authenticate(RequestId requestId, byte[] cleartext, byte[] proof) {
        if (cleartext == null) {
            throw ProtocolException.malformedPayload(requestId, "payload");
        }
        if (proof == null || proof.length == 0) {
            throw ProtocolException.invalidProof(requestId);
        }
        // Fresh signer per call: Ed25519Signer buffers input and is not thread-safe
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(false, oracleKey);
        byte[] input = signingInput(requestId, cleartext);
        signer.update(input, 0, input.length);
        if (!signer.verifySignature(proof)) {
            throw ProtocolException.invalidProof(requestId);
        }
    }
}
