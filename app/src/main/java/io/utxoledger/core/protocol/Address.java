package io.utxoledger.core.protocol;

import java.security.PublicKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * Pay-to-key address: holds the verification key that must sign any spend of
 * an output sent to it.
 */
public final class Address {
    private final PublicKey key;
    private final StakeholderId stakeholderId;

    public Address(PublicKey key) {
        this.key = Objects.requireNonNull(key, "key");
        this.stakeholderId = new StakeholderId(SignatureUtil.deriveAddress(key));
    }

    public PublicKey key() { return key; }

    /** Owner of the stake carried by outputs to this address when no explicit distribution is given. */
    public StakeholderId stakeholderId() { return stakeholderId; }

    public byte[] encoded() { return key.getEncoded(); }

    @Override public boolean equals(Object o) {
        return o instanceof Address && Arrays.equals(encoded(), ((Address) o).encoded());
    }
    @Override public int hashCode() { return Arrays.hashCode(encoded()); }
    @Override public String toString() { return "Address(" + stakeholderId.hex() + ")"; }
}
