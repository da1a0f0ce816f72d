package io.utxoledger.core.state;

import io.utxoledger.core.protocol.OutPoint;
import io.utxoledger.core.protocol.TxIn;
import io.utxoledger.core.protocol.TxOutAux;
import io.utxoledger.core.validation.UtxoResolver;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unspent-output overlay: outputs created and spent in this session, layered
 * over a base {@link UtxoLookup}.
 */
public final class UtxoModifier {
    private final MapModifier<OutPoint, TxOutAux> diff;

    private UtxoModifier(MapModifier<OutPoint, TxOutAux> diff) {
        this.diff = diff;
    }

    public static UtxoModifier empty() {
        return new UtxoModifier(MapModifier.empty());
    }

    public Optional<TxOutAux> resolve(UtxoLookup base, OutPoint point) {
        return diff.lookup(base::lookup, point);
    }

    public Optional<TxOutAux> resolve(UtxoLookup base, TxIn in) {
        return resolve(base, in.outPoint());
    }

    /** Resolver seeing {@code base} with this overlay applied. */
    public UtxoResolver resolver(UtxoLookup base) {
        return in -> resolve(base, in);
    }

    /** Marks an output spent. Spending twice is a no-op. */
    public void spend(OutPoint point) {
        diff.delete(point);
    }

    public void spend(TxIn in) {
        spend(in.outPoint());
    }

    /**
     * Adds an unspent output.
     *
     * @throws DoubleSpendException if {@code point} is already unspent in base ⊕ overlay
     */
    public void add(UtxoLookup base, OutPoint point, TxOutAux out) {
        if (resolve(base, point).isPresent()) {
            throw new DoubleSpendException(point);
        }
        diff.insert(point, out);
    }

    /** Equivalent to applying this overlay, then {@code next}. */
    public UtxoModifier andThen(UtxoModifier next) {
        return new UtxoModifier(diff.andThen(next.diff));
    }

    public UtxoModifier copy() {
        return new UtxoModifier(diff.copy());
    }

    public Map<OutPoint, TxOutAux> insertions() { return diff.insertions(); }
    public Set<OutPoint> deletions() { return diff.deletions(); }
    public boolean isEmpty() { return diff.isEmpty(); }

    @Override public String toString() {
        return "UtxoModifier{+" + diff.insertions().size() + ", -" + diff.deletions().size() + "}";
    }
}
