package io.quorumbridge.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

final class TokenUnitsTest {
    @Test
    void parsesWholeAndFractionalTokens() {
        Assertions.assertEquals(new BigInteger("10000000000000000000000"), TokenUnits.parse("10000"));
        Assertions.assertEquals(new BigInteger("1500000000000000000"), TokenUnits.parse("1.5"));
        Assertions.assertEquals(BigInteger.ONE, TokenUnits.parse("0.000000000000000001"));
    }

    @Test
    void rejectsNegativeOverPreciseAndGarbage() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TokenUnits.parse("-1"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TokenUnits.parse("0.0000000000000000001"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TokenUnits.parse("ten"));
    }

    @Test
    void formatsWithoutTrailingZeros() {
        Assertions.assertEquals("1.5", TokenUnits.format(new BigInteger("1500000000000000000")));
        Assertions.assertEquals("10000", TokenUnits.format(TokenUnits.parse("10000")));
        Assertions.assertEquals("0", TokenUnits.format(BigInteger.ZERO));
    }
}
