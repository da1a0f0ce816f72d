package io.utxoledger.core.protocol;

import java.util.Objects;

/** Transaction plus the auxiliary data needed to add its outputs to the ledger. */
public final class TxAux {
    private final Tx tx;
    private final TxDistribution distribution;

    public TxAux(Tx tx, TxDistribution distribution) {
        this.tx = Objects.requireNonNull(tx, "tx");
        this.distribution = distribution != null ? distribution : TxDistribution.empty(tx.outputs().size());
        if (this.distribution.size() != tx.outputs().size()) {
            throw new IllegalArgumentException("Distribution size " + this.distribution.size()
                    + " != output count " + tx.outputs().size());
        }
    }

    public TxAux(Tx tx) {
        this(tx, null);
    }

    public Tx tx() { return tx; }
    public Hash id() { return tx.id(); }
    public TxDistribution distribution() { return distribution; }

    public TxOutAux outputAux(int index) {
        return new TxOutAux(tx.outputs().get(index), distribution.forOutput(index));
    }

    @Override public boolean equals(Object o) { return o instanceof TxAux && tx.equals(((TxAux) o).tx); }
    @Override public int hashCode() { return tx.hashCode(); }
    @Override public String toString() { return "TxAux(" + tx + ")"; }
}
