package io.utxoledger.core.protocol;

import java.util.Objects;

public final class TxOut {
    private final Address address;
    private final Coin value;

    public TxOut(Address address, Coin value) {
        this.address = Objects.requireNonNull(address, "address");
        this.value = Objects.requireNonNull(value, "value");
    }

    public Address address() { return address; }
    public Coin value() { return value; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TxOut)) return false;
        TxOut other = (TxOut) o;
        return address.equals(other.address) && value.equals(other.value);
    }
    @Override public int hashCode() { return Objects.hash(address, value); }
    @Override public String toString() { return "TxOut(" + address + ", " + value + ")"; }
}
