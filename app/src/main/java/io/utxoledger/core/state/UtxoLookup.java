package io.utxoledger.core.state;

import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.TxOutAux;
import io.utxoledger.core.validation.UtxoResolver;

import java.util.Optional;

/** Read access to an unspent-output set. */
@FunctionalInterface
public interface UtxoLookup {

    UtxoLookup EMPTY = point -> Optional.empty();

    Optional<TxOutAux> lookup(OutPoint point);

    default UtxoResolver asResolver() {
        return in -> lookup(in.outPoint());
    }
}
