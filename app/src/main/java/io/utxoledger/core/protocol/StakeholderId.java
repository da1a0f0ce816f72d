package io.utxoledger.core.protocol;

import java.util.Objects;

/** Hex id of a stake holder, derived from its public key (see {@link SignatureUtil#deriveAddress}). */
public final class StakeholderId implements Comparable<StakeholderId> {
    private final String hex;

    public StakeholderId(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Missing stakeholder id");
        }
        this.hex = hex;
    }

    public String hex() { return hex; }

    @Override public int compareTo(StakeholderId o) { return hex.compareTo(o.hex); }
    @Override public boolean equals(Object o) { return o instanceof StakeholderId && ((StakeholderId) o).hex.equals(hex); }
    @Override public int hashCode() { return Objects.hash(hex); }
    @Override public String toString() { return "Stakeholder(" + hex + ")"; }
}
