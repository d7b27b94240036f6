package io.quorumbridge.model;

import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 32-byte ABI words used in operation payloads.
 */
public final class AbiWords {
    public static final int WORD_BYTES = 32;
    public static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private AbiWords() {
    }

    public static byte[] uint256(BigInteger value) {
        requireUint256(value, "value");
        return Numeric.toBytesPadded(value, WORD_BYTES);
    }

    public static byte[] uint256(long value) {
        return uint256(BigInteger.valueOf(value));
    }

    public static byte[] bool(boolean value) {
        byte[] word = new byte[WORD_BYTES];
        word[WORD_BYTES - 1] = (byte) (value ? 1 : 0);
        return word;
    }

    /**
     * First word of {@code payload} as an unsigned integer, or empty when the payload is too short.
     */
    public static Optional<BigInteger> readUint256(byte[] payload) {
        if (payload == null || payload.length < WORD_BYTES) {
            return Optional.empty();
        }
        byte[] word = new byte[WORD_BYTES];
        System.arraycopy(payload, 0, word, 0, WORD_BYTES);
        return Optional.of(new BigInteger(1, word));
    }

    public static Optional<Boolean> readBool(byte[] payload) {
        return readUint256(payload).map(v -> v.signum() != 0);
    }

    public static void requireUint256(BigInteger value, String name) {
        if (value == null || value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
            throw new IllegalArgumentException(name + " must be a uint256");
        }
    }
}
