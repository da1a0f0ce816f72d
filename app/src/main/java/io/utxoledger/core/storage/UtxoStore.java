package io.utxoledger.core.storage;

import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.TxOutAux;
import io.utxoledger.core.state.LedgerModifier;
import io.utxoledger.core.state.StakesSource;
import io.utxoledger.core.state.UtxoLookup;

/**
 * Confirmed unspent outputs and stakes.
 * Everything speculative lives in a {@link LedgerModifier} until {@link #apply}.
 */
public interface UtxoStore extends UtxoLookup, StakesSource {

    /**
     * Commits a diff atomically: spent outputs removed, new outputs added,
     * changed stakes and the total overwritten.
     */
    void apply(LedgerModifier modifier);

    /** Seeds an unspent output and credits its stake (genesis funding). */
    void addUnspent(OutPoint point, TxOutAux out);

    /** Number of unspent outputs (debug/metrics). */
    long size();
}
