package io.quorumbridge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Locale;

/**
 * 20-byte account identity in canonical lowercase {@code 0x} hex form.
 */
public record Address(String value) {
    private static final BigInteger ADDRESS_MASK = BigInteger.ONE.shiftLeft(160).subtract(BigInteger.ONE);

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        value = normalize(value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address of(String raw) {
        return new Address(raw);
    }

    /**
     * Low 160 bits of a 256-bit word, the way a numeric operation value carries an address.
     */
    public static Address fromWord(BigInteger word) {
        if (word == null || word.signum() < 0) {
            throw new IllegalArgumentException("Address word must be a non-negative integer");
        }
        return new Address(Numeric.toHexStringWithPrefixZeroPadded(word.and(ADDRESS_MASK), 40));
    }

    public BigInteger toWord() {
        return Numeric.toBigInt(value);
    }

    public byte[] bytes() {
        return Numeric.hexStringToByteArray(value);
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }

    private static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        String hex = Numeric.cleanHexPrefix(raw.trim()).toLowerCase(Locale.ROOT);
        if (hex.length() != 40) {
            throw new IllegalArgumentException("Address must be 20 bytes: " + raw);
        }
        for (int i = 0; i < hex.length(); i++) {
            char ch = hex.charAt(i);
            boolean ok = (ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f');
            if (!ok) {
                throw new IllegalArgumentException("Address is not hex: " + raw);
            }
        }
        return "0x" + hex;
    }
}
