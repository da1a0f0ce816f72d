package io.utxoledger.core.state;

import io.utxoledger.core.protocol.OutPoint;

/** An output was added while an unspent output with the same key is still visible. */
public final class DoubleSpendException extends IllegalStateException {
    private final OutPoint outPoint;

    public DoubleSpendException(OutPoint outPoint) {
        super("Output already unspent: " + outPoint);
        this.outPoint = outPoint;
    }

    public OutPoint outPoint() { return outPoint; }
}
