package io.utxoledger.core.node;

import io.utxoledger.core.config.LedgerConfig;
import io.utxoledger.core.mempool.TxProcessor;
import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.SignatureVerifier;
import io.utxoledger.core.protocol.TxAux;
import io.utxoledger.core.protocol.TxUndo;
import io.utxoledger.core.state.LedgerModifier;
import io.utxoledger.core.state.LedgerModifierBuilder;
import io.utxoledger.core.state.UndoMap;
import io.utxoledger.core.storage.InMemoryUtxoStore;
import io.utxoledger.core.storage.RocksDBUtxoStore;
import io.utxoledger.core.storage.UtxoStore;
import io.utxoledger.core.validation.TxVerifier;
import io.utxoledger.core.validation.VerificationResult;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires store, verifier, batch builder and mempool processor.
 * Block application goes through {@link #applyBatch}; pending transactions
 * through {@link #submit}.
 */
public final class LedgerNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(LedgerNode.class.getName());

    private final UtxoStore store;
    private final ExecutorService verifierPool;
    private final LedgerModifierBuilder builder;
    private final TxProcessor processor;

    public LedgerNode(UtxoStore store, LedgerConfig config) {
        this.store = store;
        this.verifierPool = config.newVerifierExecutor();
        TxVerifier verifier = new TxVerifier(SignatureVerifier.ecdsa(), verifierPool);
        this.builder = new LedgerModifierBuilder(store, verifier);
        this.processor = new TxProcessor(store, builder, config.maxMempoolSize);
    }

    /** Convenience factory for an in-memory ledger. */
    public static LedgerNode inMemory(LedgerConfig config) {
        return new LedgerNode(new InMemoryUtxoStore(), config);
    }

    /** Convenience factory for a RocksDB-backed ledger under {@code config.dataDir}. */
    public static LedgerNode rocks(LedgerConfig config) {
        if (config.dataDir == null || config.dataDir.isBlank()) {
            throw new IllegalArgumentException("dataDir required for a RocksDB ledger");
        }
        return new LedgerNode(RocksDBUtxoStore.open(config.dataDir), config);
    }

    public synchronized VerificationResult<TxUndo> submit(TxAux tx) {
        return processor.processTx(tx);
    }

    /**
     * Verifies and commits a batch (a block's transactions). On success the
     * mempool is re-checked against the new state and the batch undo records
     * are returned for a later {@link #rollbackBatch}.
     */
    public synchronized VerificationResult<UndoMap> applyBatch(List<TxAux> batch) {
        VerificationResult<LedgerModifier> built = builder.build(batch);
        if (!built.ok) {
            LOG.info("Batch of " + batch.size() + " rejected: " + built.violations);
            return built.castFailure();
        }
        store.apply(built.value);
        Set<Hash> confirmed = new HashSet<>();
        for (TxAux tx : batch) confirmed.add(tx.id());
        processor.normalize(confirmed);
        return VerificationResult.ok(built.value.undos());
    }

    /** Reverts a committed batch, given in the order it was applied. */
    public synchronized void rollbackBatch(List<TxAux> applied, UndoMap undos) {
        store.apply(builder.rollback(applied, undos));
        processor.normalize();
        LOG.info("Rolled back " + applied.size() + " transactions");
    }

    public UtxoStore store() { return store; }
    public TxProcessor processor() { return processor; }
    public LedgerModifierBuilder builder() { return builder; }

    /** Close underlying resources if any (verifier threads, RocksDB). */
    @Override
    public void close() {
        if (verifierPool != null) {
            verifierPool.shutdownNow();
        }
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close store", e);
            }
        }
    }
}
