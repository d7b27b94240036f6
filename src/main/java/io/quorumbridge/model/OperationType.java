package io.quorumbridge.model;

public enum OperationType {
    PAUSE,
    UNPAUSE,
    SET_BRIDGE_IN_CALLER,
    SET_BRIDGE_IN_LIMITS,
    UPDATE_SIGNER,
    SET_BRIDGE_IN_ENABLED,
    SET_BRIDGE_OUT_ENABLED,
    RELINQUISH_TOKENS,
    SET_BRIDGE_OUT_AMOUNT;

    public static OperationType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Operation type is required");
        }
        String normalized = raw.trim().replace('-', '_');
        for (OperationType value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown operation type: " + raw);
    }
}
