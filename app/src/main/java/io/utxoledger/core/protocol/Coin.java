package io.utxoledger.core.protocol;

import java.math.BigInteger;

/**
 * Bounded, non-negative amount of minor units.
 * Arithmetic never wraps: leaving {@code [0, MAX]} throws {@link ArithmeticException}.
 */
public final class Coin implements Comparable<Coin> {

    public static final long MAX_VALUE = 45_000_000_000_000_000L;

    public static final Coin ZERO = new Coin(0L);
    public static final Coin MAX = new Coin(MAX_VALUE);

    private final long value;

    private Coin(long value) {
        this.value = value;
    }

    public static Coin of(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Coin out of range: " + value);
        }
        return value == 0 ? ZERO : new Coin(value);
    }

    /** Sum of {@code coins}; fails if the total leaves the coin range. */
    public static Coin sum(Iterable<Coin> coins) {
        Coin total = ZERO;
        for (Coin c : coins) {
            total = total.add(c);
        }
        return total;
    }

    public long value() { return value; }

    public BigInteger toBigInteger() { return BigInteger.valueOf(value); }

    public boolean isPositive() { return value > 0; }

    public Coin add(Coin other) {
        long result = Math.addExact(value, other.value);
        if (result > MAX_VALUE) {
            throw new ArithmeticException("Coin overflow: " + value + " + " + other.value);
        }
        return result == 0 ? ZERO : new Coin(result);
    }

    public Coin subtract(Coin other) {
        long result = value - other.value;
        if (result < 0) {
            throw new ArithmeticException("Coin underflow: " + value + " - " + other.value);
        }
        return result == 0 ? ZERO : new Coin(result);
    }

    @Override public int compareTo(Coin o) { return Long.compare(value, o.value); }
    @Override public boolean equals(Object o) { return o instanceof Coin && ((Coin) o).value == value; }
    @Override public int hashCode() { return Long.hashCode(value); }
    @Override public String toString() { return value + " coin(s)"; }
}
