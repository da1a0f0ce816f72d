package io.utxoledger.core.protocol;

import java.util.Arrays;
import java.util.Objects;

/**
 * Spend of a previous output, with the owner's signature over
 * {@code (txId, index, outputs of the spending tx)}.
 */
public final class TxIn {
    private final OutPoint outPoint;
    private final byte[] signature;

    public TxIn(Hash txId, int index, byte[] signature) {
        this.outPoint = new OutPoint(txId, index);
        this.signature = signature != null ? signature.clone() : new byte[0];
    }

    public Hash txId() { return outPoint.txId(); }
    public int index() { return outPoint.index(); }
    public OutPoint outPoint() { return outPoint; }
    public byte[] signature() { return signature.clone(); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxIn)) return false;
        TxIn other = (TxIn) o;
        return outPoint.equals(other.outPoint) && Arrays.equals(signature, other.signature);
    }
    @Override public int hashCode() { return Objects.hash(outPoint, Arrays.hashCode(signature)); }
    @Override public String toString() { return "TxIn(" + outPoint + ")"; }
}
