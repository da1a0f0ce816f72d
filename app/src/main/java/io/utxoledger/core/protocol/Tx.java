package io.utxoledger.core.protocol;

import java.util.List;

/**
 * Immutable transaction: ordered inputs and outputs. Identity is the SHA-256
 * of the canonical encoding.
 *
 * Empty input or output lists are representable; rejecting them is the job of
 * the structural verifier.
 */
public final class Tx {
    private final List<TxIn> inputs;
    private final List<TxOut> outputs;
    private final Hash id;

    public Tx(List<TxIn> inputs, List<TxOut> outputs) {
        this.inputs = inputs != null ? List.copyOf(inputs) : List.of();
        this.outputs = outputs != null ? List.copyOf(outputs) : List.of();
        this.id = Hashes.hash(TxCodec.encode(this));
    }

    public List<TxIn> inputs() { return inputs; }
    public List<TxOut> outputs() { return outputs; }
    public Hash id() { return id; }

    @Override public boolean equals(Object o){ return o instanceof Tx && id.equals(((Tx) o).id); }
    @Override public int hashCode(){ return id.hashCode(); }
    @Override public String toString() {
        return "Tx{" + id.hex().substring(0, 8) + ", in=" + inputs.size() + ", out=" + outputs.size() + "}";
    }
}
