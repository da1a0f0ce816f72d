package io.utxoledger.core.protocol;

import java.util.Objects;

/**
 * Reference to one output of a transaction: {@code (txId, index)}.
 * This is the key of the unspent-output set.
 */
public final class OutPoint {
    private final Hash txId;
    private final int index;

    public OutPoint(Hash txId, int index) {
        this.txId = Objects.requireNonNull(txId, "txId");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        this.index = index;
    }

    public Hash txId() { return txId; }
    public int index() { return index; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutPoint)) return false;
        OutPoint other = (OutPoint) o;
        return index == other.index && txId.equals(other.txId);
    }
    @Override public int hashCode() { return Objects.hash(txId, index); }
    @Override public String toString() { return txId.hex().substring(0, 8) + ":" + index; }
}
