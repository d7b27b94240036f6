package io.quorumbridge.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Numeric operation codes of one deployment. Codes differ between deployed variants, so the
 * state machine only ever sees the resolved {@link OperationType}.
 */
public final class OperationCodebook {
    private final Map<Integer, OperationType> byCode;
    private final Map<OperationType, Integer> byType;

    private OperationCodebook(Map<Integer, OperationType> byCode) {
        this.byCode = Collections.unmodifiableMap(new TreeMap<>(byCode));
        Map<OperationType, Integer> reverse = new EnumMap<>(OperationType.class);
        for (Map.Entry<Integer, OperationType> entry : byCode.entrySet()) {
            reverse.put(entry.getValue(), entry.getKey());
        }
        this.byType = Collections.unmodifiableMap(reverse);
    }

    public static OperationCodebook burnAndMint() {
        Map<Integer, OperationType> codes = new LinkedHashMap<>();
        codes.put(0, OperationType.PAUSE);
        codes.put(1, OperationType.UNPAUSE);
        codes.put(2, OperationType.SET_BRIDGE_IN_CALLER);
        codes.put(3, OperationType.SET_BRIDGE_IN_LIMITS);
        codes.put(4, OperationType.UPDATE_SIGNER);
        codes.put(5, OperationType.SET_BRIDGE_IN_ENABLED);
        codes.put(6, OperationType.SET_BRIDGE_OUT_ENABLED);
        codes.put(7, OperationType.SET_BRIDGE_OUT_AMOUNT);
        return new OperationCodebook(codes);
    }

    public static OperationCodebook lockAndRelease() {
        Map<Integer, OperationType> codes = new LinkedHashMap<>();
        codes.put(0, OperationType.PAUSE);
        codes.put(1, OperationType.UNPAUSE);
        codes.put(2, OperationType.SET_BRIDGE_IN_CALLER);
        codes.put(3, OperationType.SET_BRIDGE_IN_LIMITS);
        codes.put(4, OperationType.UPDATE_SIGNER);
        codes.put(5, OperationType.RELINQUISH_TOKENS);
        codes.put(6, OperationType.SET_BRIDGE_OUT_ENABLED);
        codes.put(7, OperationType.SET_BRIDGE_IN_ENABLED);
        codes.put(8, OperationType.SET_BRIDGE_OUT_AMOUNT);
        return new OperationCodebook(codes);
    }

    /**
     * Table of the later vault deployments, which only govern the outbound side.
     */
    public static OperationCodebook outboundVault() {
        Map<Integer, OperationType> codes = new LinkedHashMap<>();
        codes.put(0, OperationType.SET_BRIDGE_OUT_AMOUNT);
        codes.put(1, OperationType.UPDATE_SIGNER);
        codes.put(2, OperationType.SET_BRIDGE_OUT_ENABLED);
        codes.put(3, OperationType.RELINQUISH_TOKENS);
        return new OperationCodebook(codes);
    }

    public static OperationCodebook defaultFor(LedgerVariant variant) {
        return switch (variant) {
            case BURN_AND_MINT -> burnAndMint();
            case LOCK_AND_RELEASE -> lockAndRelease();
        };
    }

    /**
     * Validates a deployment-supplied codebook: codes fit in a byte, each type appears once, and
     * custody sweeping is only offered where there is custody.
     */
    public static OperationCodebook of(Map<Integer, OperationType> codes, LedgerVariant variant) {
        if (codes == null || codes.isEmpty()) {
            throw new IllegalArgumentException("Operation codebook must not be empty");
        }
        Map<OperationType, Integer> seen = new EnumMap<>(OperationType.class);
        for (Map.Entry<Integer, OperationType> entry : codes.entrySet()) {
            Integer code = entry.getKey();
            OperationType type = entry.getValue();
            if (code == null || code < 0 || code > 255) {
                throw new IllegalArgumentException("Operation code out of range: " + code);
            }
            if (type == null) {
                throw new IllegalArgumentException("Operation code " + code + " has no type");
            }
            Integer previous = seen.put(type, code);
            if (previous != null) {
                throw new IllegalArgumentException("Operation type " + type + " mapped twice: " + previous + ", " + code);
            }
            if (type == OperationType.RELINQUISH_TOKENS && variant != LedgerVariant.LOCK_AND_RELEASE) {
                throw new IllegalArgumentException("RELINQUISH_TOKENS requires the lock-release variant");
            }
        }
        return new OperationCodebook(codes);
    }

    public Optional<OperationType> resolve(int code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public int codeOf(OperationType type) {
        Integer code = byType.get(type);
        if (code == null) {
            throw new IllegalArgumentException("Operation type not supported by this deployment: " + type);
        }
        return code;
    }

    public boolean supports(OperationType type) {
        return byType.containsKey(type);
    }

    public Map<Integer, OperationType> asMap() {
        return byCode;
    }
}
