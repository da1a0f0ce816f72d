package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.StakeholderId;
import io.utxoledger.core.protocol.TxAux;
import io.utxoledger.core.protocol.TxOutAux;
import io.utxoledger.core.protocol.TxUndo;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stake overlay: holders whose stake changed in this session, with their new
 * absolute stake, and the new total. Unchanged holders read through to the base.
 */
public final class BalancesView {
    private final StakesSource base;
    private final Map<StakeholderId, Coin> stakes;
    private Coin total;

    private BalancesView(StakesSource base, Map<StakeholderId, Coin> stakes, Coin total) {
        this.base = base;
        this.stakes = stakes;
        this.total = total;
    }

    public BalancesView(StakesSource base) {
        this(Objects.requireNonNull(base, "base"), new LinkedHashMap<>(), base.totalStake());
    }

    /** No holders, zero total. */
    public static BalancesView empty() {
        return new BalancesView(StakesSource.EMPTY);
    }

    public Coin stakeOf(StakeholderId id) {
        Coin changed = stakes.get(id);
        if (changed != null) return changed;
        return base.stakeOf(id).orElse(Coin.ZERO);
    }

    public Coin total() { return total; }

    /** Holders changed in this session, with their absolute stake. */
    public Map<StakeholderId, Coin> stakes() { return Collections.unmodifiableMap(stakes); }

    public void credit(StakeholderId id, Coin amount) {
        Coin updated = stakeOf(id).add(amount);
        Coin updatedTotal = total.add(amount);
        stakes.put(id, updated);
        total = updatedTotal;
    }

    /** @throws BalanceUnderflowException if {@code id} holds less than {@code amount} */
    public void debit(StakeholderId id, Coin amount) {
        Coin current = stakeOf(id);
        if (current.compareTo(amount) < 0) {
            throw new BalanceUnderflowException(id, "Stake of " + id + " is " + current + ", cannot debit " + amount);
        }
        if (total.compareTo(amount) < 0) {
            throw new BalanceUnderflowException(id, "Total stake " + total + " is below debit " + amount);
        }
        stakes.put(id, current.subtract(amount));
        total = total.subtract(amount);
    }

    /** Moves the stake of the spent outputs to the new ones. All or nothing. */
    public void applyTx(TxAux tx, TxUndo undo) {
        Map<StakeholderId, BigInteger> deltas = new LinkedHashMap<>();
        for (TxOutAux spent : undo) addStakes(deltas, spent, false);
        for (int i = 0; i < tx.tx().outputs().size(); i++) addStakes(deltas, tx.outputAux(i), true);
        applyDeltas(deltas);
    }

    /** Inverse of {@link #applyTx}. */
    public void revertTx(TxAux tx, TxUndo undo) {
        Map<StakeholderId, BigInteger> deltas = new LinkedHashMap<>();
        for (int i = 0; i < tx.tx().outputs().size(); i++) addStakes(deltas, tx.outputAux(i), false);
        for (TxOutAux spent : undo) addStakes(deltas, spent, true);
        applyDeltas(deltas);
    }

    public BalancesView copy() {
        return new BalancesView(base, new LinkedHashMap<>(stakes), total);
    }

    private static void addStakes(Map<StakeholderId, BigInteger> deltas, TxOutAux out, boolean credit) {
        for (Map.Entry<StakeholderId, Coin> e : out.stakes().entrySet()) {
            BigInteger v = e.getValue().toBigInteger();
            deltas.merge(e.getKey(), credit ? v : v.negate(), BigInteger::add);
        }
    }

    private void applyDeltas(Map<StakeholderId, BigInteger> deltas) {
        BigInteger max = BigInteger.valueOf(Coin.MAX_VALUE);
        Map<StakeholderId, Coin> updated = new HashMap<>();
        BigInteger newTotal = total.toBigInteger();
        for (Map.Entry<StakeholderId, BigInteger> e : deltas.entrySet()) {
            BigInteger next = stakeOf(e.getKey()).toBigInteger().add(e.getValue());
            if (next.signum() < 0) {
                throw new BalanceUnderflowException(e.getKey(),
                        "Stake of " + e.getKey() + " would become " + next);
            }
            if (next.compareTo(max) > 0) {
                throw new ArithmeticException("Stake of " + e.getKey() + " overflows: " + next);
            }
            updated.put(e.getKey(), Coin.of(next.longValueExact()));
            newTotal = newTotal.add(e.getValue());
        }
        if (newTotal.signum() < 0) {
            throw new BalanceUnderflowException(null, "Total stake would become " + newTotal);
        }
        if (newTotal.compareTo(max) > 0) {
            throw new ArithmeticException("Total stake overflows: " + newTotal);
        }
        stakes.putAll(updated);
        total = Coin.of(newTotal.longValueExact());
    }

    @Override public String toString() {
        return "BalancesView{changed=" + stakes.size() + ", total=" + total + "}";
    }
}
