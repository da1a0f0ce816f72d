package io.utxoledger.core.protocol;

import java.security.*;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;

public final class SignatureUtil {
    private SignatureUtil() {}

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance("SHA256withECDSA");
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    /** False for any malformed key or signature; never throws. */
    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        try {
            Signature sig = Signature.getInstance("SHA256withECDSA");
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (Exception e) {
            return false;
        }
    }

    public static String deriveAddress(PublicKey pub) {
        byte[] hash = Hashes.sha256(pub.getEncoded());
        // hex string, first 40 chars
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            sb.append(String.format("%02x", hash[i]));
        }
        return sb.toString();
    }

    /** Decodes an X.509 encoded EC public key, as produced by {@link PublicKey#getEncoded()}. */
    public static PublicKey decodePublicKey(byte[] encoded) {
        try {
            return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalArgumentException("Malformed public key", e);
        }
    }
}
