package io.utxoledger.core.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An output together with its stake distribution. An empty distribution
 * assigns the whole value to the stakeholder behind the output address.
 */
public final class TxOutAux {
    private final TxOut out;
    private final Map<StakeholderId, Coin> distribution;

    public TxOutAux(TxOut out, Map<StakeholderId, Coin> distribution) {
        this.out = Objects.requireNonNull(out, "out");
        this.distribution = distribution == null || distribution.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(distribution));
    }

    public TxOutAux(TxOut out) {
        this(out, null);
    }

    public TxOut out() { return out; }
    public Map<StakeholderId, Coin> distribution() { return distribution; }

    /** Stake carried by this output, per holder. */
    public Map<StakeholderId, Coin> stakes() {
        if (distribution.isEmpty()) {
            return Collections.singletonMap(out.address().stakeholderId(), out.value());
        }
        return distribution;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxOutAux)) return false;
        TxOutAux other = (TxOutAux) o;
        return out.equals(other.out) && distribution.equals(other.distribution);
    }
    @Override public int hashCode() { return Objects.hash(out, distribution); }
    @Override public String toString() { return "TxOutAux(" + out + ", dist=" + distribution + ")"; }
}
