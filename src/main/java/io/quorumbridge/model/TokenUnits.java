package io.quorumbridge.model;

import java.math.BigDecimal;
import java.math.BigInteger;

public final class TokenUnits {
    public static final int DECIMALS = 18;

    private TokenUnits() {
    }

    public static BigInteger parse(String tokens) {
        if (tokens == null || tokens.isBlank()) {
            throw new IllegalArgumentException("Amount is required");
        }
        BigDecimal scaled;
        try {
            scaled = new BigDecimal(tokens.trim()).movePointRight(DECIMALS);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount: " + tokens, e);
        }
        if (scaled.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + tokens);
        }
        try {
            return scaled.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount has more than " + DECIMALS + " decimals: " + tokens, e);
        }
    }

    public static String format(BigInteger baseUnits) {
        return new BigDecimal(baseUnits, DECIMALS).stripTrailingZeros().toPlainString();
    }
}
