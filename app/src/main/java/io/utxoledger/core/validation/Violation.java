package io.utxoledger.core.validation;

import java.util.Objects;

/**
 * One violated property of a transaction or batch. {@code index} points at the
 * offending input or output where the kind is per-item, and is -1 otherwise.
 */
public final class Violation {

    public enum Kind {
        EMPTY_INPUTS(true),
        EMPTY_OUTPUTS(true),
        NON_POSITIVE_OUTPUT(true),
        UNRESOLVED_INPUT(false),
        BAD_SIGNATURE(false),
        INSUFFICIENT_VALUE(false),
        DUPLICATE_INPUT(false),
        BAD_DISTRIBUTION(false),
        CYCLIC_DEPENDENCY(false),
        KNOWN_TRANSACTION(false),
        MEMPOOL_FULL(false);

        private final boolean structural;

        Kind(boolean structural) { this.structural = structural; }

        /** Detectable from the transaction alone. */
        public boolean isStructural() { return structural; }
    }

    public final Kind kind;
    public final int index;
    public final String message;

    private Violation(Kind kind, int index, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.index = index;
        this.message = message;
    }

    public static Violation of(Kind kind, String message) {
        return new Violation(kind, -1, message);
    }

    public static Violation at(Kind kind, int index, String message) {
        return new Violation(kind, index, message);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Violation)) return false;
        Violation other = (Violation) o;
        return kind == other.kind && index == other.index;
    }
    @Override public int hashCode() { return Objects.hash(kind, index); }
    @Override public String toString() {
        return kind + (index >= 0 ? "[" + index + "]" : "") + (message != null ? ": " + message : "");
    }
}
