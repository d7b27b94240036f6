package io.quorumbridge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fixed 32-byte value: operation ids, digests and inbound transfer ids.
 */
public final class Bytes32 {
    public static final Bytes32 ZERO = new Bytes32(new byte[32]);

    private final byte[] bytes;

    private Bytes32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Bytes32 wrap(byte[] raw) {
        if (raw == null || raw.length != 32) {
            throw new IllegalArgumentException("Expected 32 bytes, got " + (raw == null ? 0 : raw.length));
        }
        return new Bytes32(raw.clone());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Bytes32 fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("32-byte hex value is required");
        }
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() != 64) {
            throw new IllegalArgumentException("Expected 64 hex characters: " + hex);
        }
        for (int i = 0; i < clean.length(); i++) {
            if (Character.digit(clean.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("Value is not hex: " + hex);
            }
        }
        return new Bytes32(Numeric.hexStringToByteArray(clean));
    }

    /**
     * Keccak-256 of the UTF-8 text, the usual way a relayer derives a transfer id from a label.
     */
    public static Bytes32 keccakOf(String text) {
        return new Bytes32(Hash.sha3(text.getBytes(StandardCharsets.UTF_8)));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    @JsonValue
    public String toHex() {
        return Numeric.toHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bytes32)) {
            return false;
        }
        return Arrays.equals(bytes, ((Bytes32) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
