package io.utxoledger.core.state;

import io.utxoledger.core.protocol.Coin;
import io.utxoledger.core.protocol.StakeholderId;

import java.util.Optional;

/** Confirmed stake per holder, plus the running total. */
public interface StakesSource {

    StakesSource EMPTY = new StakesSource() {
        @Override public Optional<Coin> stakeOf(StakeholderId id) { return Optional.empty(); }
        @Override public Coin totalStake() { return Coin.ZERO; }
    };

    Optional<Coin> stakeOf(StakeholderId id);

    Coin totalStake();
}
