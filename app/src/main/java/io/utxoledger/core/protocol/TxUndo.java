package io.utxoledger.core.protocol;

import java.util.Iterator;
import java.util.List;

/** Outputs consumed by one transaction, in input order. */
public final class TxUndo implements Iterable<TxOutAux> {
    private final List<TxOutAux> spent;

    public TxUndo(List<TxOutAux> spent) {
        this.spent = List.copyOf(spent);
    }

    public List<TxOutAux> spent() { return spent; }
    public int size() { return spent.size(); }
    public TxOutAux get(int inputIndex) { return spent.get(inputIndex); }

    @Override public Iterator<TxOutAux> iterator() { return spent.iterator(); }
    @Override public boolean equals(Object o) { return o instanceof TxUndo && spent.equals(((TxUndo) o).spent); }
    @Override public int hashCode() { return spent.hashCode(); }
    @Override public String toString() { return "TxUndo" + spent; }
}
