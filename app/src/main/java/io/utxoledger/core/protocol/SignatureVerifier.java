package io.utxoledger.core.protocol;

import java.security.PublicKey;

/** Opaque signature check consumed by the verifier. */
@FunctionalInterface
public interface SignatureVerifier {

    boolean verify(PublicKey key, byte[] message, byte[] signature);

    /** JCA {@code SHA256withECDSA}, see {@link SignatureUtil}. */
    static SignatureVerifier ecdsa() {
        return (key, message, signature) -> SignatureUtil.verify(message, signature, key);
    }
}
