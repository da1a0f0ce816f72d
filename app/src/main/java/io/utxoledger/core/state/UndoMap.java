package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TxUndo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Undo record of every transaction applied in a batch, by tx id. */
public final class UndoMap {
    private final Map<Hash, TxUndo> undos;

    private UndoMap(Map<Hash, TxUndo> undos) {
        this.undos = undos;
    }

    public static UndoMap empty() {
        return new UndoMap(new LinkedHashMap<>());
    }

    public void put(Hash txId, TxUndo undo) { undos.put(txId, undo); }
    public Optional<TxUndo> get(Hash txId) { return Optional.ofNullable(undos.get(txId)); }
    public void remove(Hash txId) { undos.remove(txId); }
    public int size() { return undos.size(); }
    public Map<Hash, TxUndo> asMap() { return Collections.unmodifiableMap(undos); }

    public UndoMap copy() {
        return new UndoMap(new LinkedHashMap<>(undos));
    }
}
