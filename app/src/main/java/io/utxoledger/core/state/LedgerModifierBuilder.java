package io.utxoledger.core.state;

import io.utxoledger.core.metrics.LedgerMetrics;
import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.Hash;
import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.Tx;
import io.utxoledger.core.protocol.TxAux;
import io.utxoledger.core.protocol.StakeholderId;
import io.utxoledger.core.protocol.TxIn;
import io.utxoledger.core.protocol.TxOut;
import io.utxoledger.core.protocol.TxUndo;
import io.utxoledger.core.storage.UtxoStore;
import io.utxoledger.core.validation.TopologicalSorter;
import io.utxoledger.core.validation.TxVerifier;
import io.utxoledger.core.validation.VerificationResult;
import io.utxoledger.core.validation.Violation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a batch of transactions into a {@link LedgerModifier} over a store:
 * sort, verify each against store ⊕ running diff, fold it in.
 * A failed batch yields no modifier at all.
 */
public final class LedgerModifierBuilder {
    private static final Logger LOG = Logger.getLogger(LedgerModifierBuilder.class.getName());

    private final UtxoStore store;
    private final TxVerifier verifier;

    public LedgerModifierBuilder(UtxoStore store, TxVerifier verifier) {
        this.store = store;
        this.verifier = verifier;
    }

    public VerificationResult<LedgerModifier> build(List<TxAux> batch) {
        LedgerMetrics.batchSize(batch.size());
        VerificationResult<LedgerModifier> result = LedgerMetrics.recordBatchBuild(() -> buildSorted(batch));
        if (!result.ok) {
            LedgerMetrics.batchRejected();
        }
        return result;
    }

    private VerificationResult<LedgerModifier> buildSorted(List<TxAux> batch) {
        Map<Hash, TxAux> byId = new HashMap<>();
        List<Tx> txs = new ArrayList<>(batch.size());
        for (TxAux aux : batch) {
            byId.put(aux.id(), aux);
            txs.add(aux.tx());
        }

        Optional<List<Tx>> sorted = TopologicalSorter.topsortTxs(txs);
        if (sorted.isEmpty()) {
            LOG.fine("Rejecting batch of " + batch.size() + ": cyclic dependencies");
            return VerificationResult.failure(Violation.of(Violation.Kind.CYCLIC_DEPENDENCY,
                    "Batch of " + batch.size() + " transactions has cyclic dependencies"));
        }

        LedgerModifier working = LedgerModifier.empty(store);
        for (Tx tx : sorted.get()) {
            VerificationResult<TxUndo> applied = applyTo(working, byId.get(tx.id()));
            if (!applied.ok) {
                LOG.fine("Rejecting batch at " + tx + ": " + applied.violations);
                return applied.castFailure();
            }
        }
        return VerificationResult.ok(working);
    }

    /**
     * Verifies one transaction against store ⊕ {@code target} and, if valid,
     * folds it into {@code target}. On failure {@code target} is unchanged.
     */
    public VerificationResult<TxUndo> applyTo(LedgerModifier target, TxAux txAux) {
        Tx tx = txAux.tx();
        Set<OutPoint> seen = new HashSet<>();
        for (int i = 0; i < tx.inputs().size(); i++) {
            if (!seen.add(tx.inputs().get(i).outPoint())) {
                LedgerMetrics.txRejected();
                return VerificationResult.failure(Violation.at(Violation.Kind.DUPLICATE_INPUT, i,
                        "Input " + tx.inputs().get(i).outPoint() + " spent twice"));
            }
        }

        Set<Violation> badDistributions = checkDistributions(txAux);
        if (!badDistributions.isEmpty()) {
            LedgerMetrics.txRejected();
            return VerificationResult.failure(badDistributions);
        }

        UtxoModifier utxo = target.utxoModifier();
        VerificationResult<TxUndo> verified = verifier.verifyTx(utxo.resolver(store), tx);
        if (!verified.ok) {
            LedgerMetrics.txRejected();
            return verified;
        }

        List<OutPoint> created = new ArrayList<>(tx.outputs().size());
        for (int i = 0; i < tx.outputs().size(); i++) {
            OutPoint point = new OutPoint(tx.id(), i);
            if (utxo.resolve(store, point).isPresent()) {
                throw new DoubleSpendException(point);
            }
            created.add(point);
        }

        target.balances().applyTx(txAux, verified.value);
        for (TxIn in : tx.inputs()) {
            utxo.spend(in);
        }
        for (int i = 0; i < created.size(); i++) {
            utxo.add(store, created.get(i), txAux.outputAux(i));
        }
        target.undos().put(tx.id(), verified.value);
        target.memPool().insert(txAux);
        LedgerMetrics.txAccepted();
        return verified;
    }

    /** A non-empty distribution must split exactly the value of its output. */
    private static Set<Violation> checkDistributions(TxAux txAux) {
        Set<Violation> violations = new LinkedHashSet<>();
        List<TxOut> outputs = txAux.tx().outputs();
        for (int i = 0; i < outputs.size(); i++) {
            Map<StakeholderId, Coin> dist = txAux.distribution().forOutput(i);
            if (dist.isEmpty()) continue;
            BigInteger sum = BigInteger.ZERO;
            for (Coin stake : dist.values()) sum = sum.add(stake.toBigInteger());
            if (!sum.equals(outputs.get(i).value().toBigInteger())) {
                violations.add(Violation.at(Violation.Kind.BAD_DISTRIBUTION, i,
                        "Distribution sums to " + sum + ", output holds " + outputs.get(i).value()));
            }
        }
        return violations;
    }

    /**
     * Diff that undoes {@code applied} (in the order they were applied) on a
     * store that has committed them, using their undo records.
     *
     * @throws IllegalArgumentException if an undo record is missing or does not match its tx
     */
    public LedgerModifier rollback(List<TxAux> applied, UndoMap undos) {
        LedgerModifier inverse = LedgerModifier.empty(store);
        UtxoModifier utxo = inverse.utxoModifier();
        for (int t = applied.size() - 1; t >= 0; t--) {
            TxAux txAux = applied.get(t);
            Tx tx = txAux.tx();
            TxUndo undo = undos.get(tx.id())
                    .orElseThrow(() -> new IllegalArgumentException("No undo for " + tx));
            if (undo.size() != tx.inputs().size()) {
                throw new IllegalArgumentException("Undo of " + tx + " has " + undo.size()
                        + " entries for " + tx.inputs().size() + " inputs");
            }
            inverse.balances().revertTx(txAux, undo);
            for (int i = 0; i < tx.outputs().size(); i++) {
                utxo.spend(new OutPoint(tx.id(), i));
            }
            for (int i = 0; i < tx.inputs().size(); i++) {
                utxo.add(store, tx.inputs().get(i).outPoint(), undo.get(i));
            }
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Built rollback of " + applied.size() + " transactions: " + inverse);
        }
        return inverse;
    }
}
