package io.utxoledger.core.validation;

import io.utxoledger.core.protocol.TxIn;
import io.utxoledger.core.protocol.TxOutAux;

import java.util.Optional;

/**
 * Looks up the unspent output an input refers to. Absent means spent or
 * never existed. Called once per input per verification pass.
 */
@FunctionalInterface
public interface UtxoResolver {
    Optional<TxOutAux> resolve(TxIn in);
}
