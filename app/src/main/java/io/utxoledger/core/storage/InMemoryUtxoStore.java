package io.utxoledger.core.storage;

import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.StakeholderId;
import io.utxoledger.core.protocol.TxOutAux;
import io.utxoledger.core.state.LedgerModifier;
import io.utxoledger.core.state.UtxoModifier;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of UtxoStore.
 * Not persistent; resets every process run.
 */
public final class InMemoryUtxoStore implements UtxoStore {

    private final Map<OutPoint, TxOutAux> unspent = new HashMap<>();
    private final Map<StakeholderId, Coin> stakes = new HashMap<>();
    private Coin total = Coin.ZERO;

    @Override
    public synchronized Optional<TxOutAux> lookup(OutPoint point) {
        return Optional.ofNullable(unspent.get(point));
    }

    @Override
    public synchronized Optional<Coin> stakeOf(StakeholderId id) {
        return Optional.ofNullable(stakes.get(id));
    }

    @Override
    public synchronized Coin totalStake() {
        return total;
    }

    @Override
    public synchronized void apply(LedgerModifier modifier) {
        UtxoModifier utxo = modifier.utxoModifier();
        for (OutPoint point : utxo.deletions()) {
            unspent.remove(point);
        }
        unspent.putAll(utxo.insertions());
        for (Map.Entry<StakeholderId, Coin> e : modifier.balances().stakes().entrySet()) {
            if (e.getValue().isPositive()) {
                stakes.put(e.getKey(), e.getValue());
            } else {
                stakes.remove(e.getKey());
            }
        }
        total = modifier.balances().total();
    }

    @Override
    public synchronized void addUnspent(OutPoint point, TxOutAux out) {
        if (unspent.containsKey(point)) {
            throw new IllegalArgumentException("Output already unspent: " + point);
        }
        Coin newTotal = total.add(Coin.sum(out.stakes().values()));
        unspent.put(point, out);
        for (Map.Entry<StakeholderId, Coin> e : out.stakes().entrySet()) {
            stakes.merge(e.getKey(), e.getValue(), Coin::add);
        }
        total = newTotal;
    }

    @Override
    public synchronized long size() {
        return unspent.size();
    }
}
