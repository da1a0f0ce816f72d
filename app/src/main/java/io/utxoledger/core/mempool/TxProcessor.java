package io.utxoledger.core.mempool;

import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.TxAux;
import io.utxoledger.core.protocol.TxUndo;
import io.utxoledger.core.state.LedgerModifier;
import io.utxoledger.core.state.LedgerModifierBuilder;
import io.utxoledger.core.storage.UtxoStore;
import io.utxoledger.core.validation.VerificationResult;
import io.utxoledger.core.validation.Violation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Accepts pending transactions into the local ledger diff (mempool plus the
 * outputs and stakes they imply). One writer at a time; readers get copies.
 */
public final class TxProcessor {
    private static final Logger LOG = Logger.getLogger(TxProcessor.class.getName());

    private final UtxoStore store;
    private final LedgerModifierBuilder builder;
    private final int maxMempoolSize;
    private LedgerModifier local;

    public TxProcessor(UtxoStore store, LedgerModifierBuilder builder, int maxMempoolSize) {
        this.store = store;
        this.builder = builder;
        this.maxMempoolSize = maxMempoolSize;
        this.local = LedgerModifier.empty(store);
    }

    /** Verify against store ⊕ local diff and, if valid, add to the mempool. */
    public synchronized VerificationResult<TxUndo> processTx(TxAux tx) {
        MemPool pool = local.memPool();
        if (pool.contains(tx.id())) {
            return VerificationResult.failure(Violation.of(Violation.Kind.KNOWN_TRANSACTION,
                    tx.tx() + " is already in the mempool"));
        }
        if (pool.size() >= maxMempoolSize) {
            return VerificationResult.failure(Violation.of(Violation.Kind.MEMPOOL_FULL,
                    "Mempool holds " + pool.size() + " transactions (max " + maxMempoolSize + ")"));
        }
        VerificationResult<TxUndo> result = builder.applyTo(local, tx);
        if (result.ok) {
            LOG.fine("Accepted " + tx.tx() + " into mempool (size=" + pool.size() + ")");
        } else {
            LOG.fine("Rejected " + tx.tx() + ": " + result.violations);
        }
        return result;
    }

    /**
     * Rebuilds the local diff against the current store, e.g. after a batch
     * was rolled back. Returns the transactions that no longer verify.
     */
    public synchronized List<TxAux> normalize() {
        return normalize(Collections.emptySet());
    }

    /**
     * Rebuilds the local diff after a batch was committed. Transactions in
     * {@code confirmed} left the mempool by confirmation and are not re-verified;
     * the rest are, and the ones that no longer verify are returned.
     */
    public synchronized List<TxAux> normalize(Collection<Hash> confirmed) {
        List<TxAux> pending = new ArrayList<>();
        for (TxAux tx : local.memPool().transactions()) {
            if (!confirmed.contains(tx.id())) pending.add(tx);
        }
        LedgerModifier rebuilt = LedgerModifier.empty(store);
        List<TxAux> dropped = new ArrayList<>();
        for (TxAux tx : pending) {
            if (!builder.applyTo(rebuilt, tx).ok) {
                dropped.add(tx);
            }
        }
        local = rebuilt;
        if (!dropped.isEmpty()) {
            LOG.warning("Dropped " + dropped.size() + " of " + pending.size() + " pending transactions on normalize");
        }
        return dropped;
    }

    /** Copy of the local diff, safe to read while writers continue. */
    public synchronized LedgerModifier snapshot() {
        return local.copy();
    }

    public synchronized int size() {
        return local.memPool().size();
    }
}
