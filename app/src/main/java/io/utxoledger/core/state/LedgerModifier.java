package io.utxoledger.core.state;

import io.utxoledger.core.mempool.MemPool;

import java.util.Objects;

/**
 * Net effect of a set of transactions on the ledger: the unspent-output diff,
 * the stake diff, the accepted transactions and their undo records.
 * Committed to a store as one unit, or dropped.
 */
public final class LedgerModifier {
    private final UtxoModifier utxoModifier;
    private final BalancesView balances;
    private final MemPool memPool;
    private final UndoMap undos;

    public LedgerModifier(UtxoModifier utxoModifier, BalancesView balances, MemPool memPool, UndoMap undos) {
        this.utxoModifier = Objects.requireNonNull(utxoModifier, "utxoModifier");
        this.balances = Objects.requireNonNull(balances, "balances");
        this.memPool = Objects.requireNonNull(memPool, "memPool");
        this.undos = Objects.requireNonNull(undos, "undos");
    }

    /** Empty diff whose balances read through to {@code stakes}. */
    public static LedgerModifier empty(StakesSource stakes) {
        return new LedgerModifier(UtxoModifier.empty(), new BalancesView(stakes), MemPool.empty(), UndoMap.empty());
    }

    public UtxoModifier utxoModifier() { return utxoModifier; }
    public BalancesView balances() { return balances; }
    public MemPool memPool() { return memPool; }
    public UndoMap undos() { return undos; }

    public LedgerModifier copy() {
        return new LedgerModifier(utxoModifier.copy(), balances.copy(), memPool.copy(), undos.copy());
    }

    @Override public String toString() {
        return "LedgerModifier{" + utxoModifier + ", " + balances + ", txs=" + memPool.size() + "}";
    }
}
