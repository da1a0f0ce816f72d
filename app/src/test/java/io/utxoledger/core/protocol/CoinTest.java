package io.utxoledger.core.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoinTest {

    @Test
    void rejectsValuesOutsideRange() {
        assertThrows(IllegalArgumentException.class, () -> Coin.of(-1));
        assertThrows(IllegalArgumentException.class, () -> Coin.of(Coin.MAX_VALUE + 1));
        assertEquals(Coin.MAX_VALUE, Coin.of(Coin.MAX_VALUE).value());
    }

    @Test
    void additionDetectsOverflowInsteadOfWrapping() {
        assertThrows(ArithmeticException.class, () -> Coin.MAX.add(Coin.of(1)));
        assertThrows(ArithmeticException.class, () -> Coin.sum(List.of(Coin.MAX, Coin.MAX)));
        assertEquals(Coin.of(30), Coin.of(10).add(Coin.of(20)));
    }

    @Test
    void subtractionDetectsUnderflow() {
        assertThrows(ArithmeticException.class, () -> Coin.of(5).subtract(Coin.of(6)));
        assertEquals(Coin.ZERO, Coin.of(5).subtract(Coin.of(5)));
    }

    @Test
    void zeroResultsAreTheSharedZero() {
        assertSame(Coin.ZERO, Coin.ZERO.add(Coin.ZERO));
        assertSame(Coin.ZERO, Coin.of(5).subtract(Coin.of(5)));
        assertSame(Coin.ZERO, Coin.sum(List.of()));
    }
}
