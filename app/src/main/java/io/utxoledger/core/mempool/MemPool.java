package io.utxoledger.core.mempool;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TxAux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending transactions by id, in acceptance order.
 * The size is cached because callers poll it on every submission.
 */
public final class MemPool {

    private final Map<Hash, TxAux> localTxs;
    private int localTxsSize;

    private MemPool(Map<Hash, TxAux> localTxs, int localTxsSize) {
        this.localTxs = localTxs;
        this.localTxsSize = localTxsSize;
    }

    public static MemPool empty() {
        return new MemPool(new LinkedHashMap<>(), 0);
    }

    /** Adds a tx. Returns false (and changes nothing) if its id is already present. */
    public boolean insert(TxAux tx) {
        if (localTxs.putIfAbsent(tx.id(), tx) != null) {
            return false;
        }
        localTxsSize++;
        return true;
    }

    public boolean remove(Hash txId) {
        if (localTxs.remove(txId) == null) {
            return false;
        }
        localTxsSize--;
        return true;
    }

    public boolean contains(Hash txId) { return localTxs.containsKey(txId); }

    public Optional<TxAux> get(Hash txId) { return Optional.ofNullable(localTxs.get(txId)); }

    public int size() { return localTxsSize; }

    /** Snapshot in acceptance order. */
    public List<TxAux> transactions() { return new ArrayList<>(localTxs.values()); }

    public MemPool copy() {
        return new MemPool(new LinkedHashMap<>(localTxs), localTxsSize);
    }
}
