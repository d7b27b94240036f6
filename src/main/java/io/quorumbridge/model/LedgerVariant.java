package io.quorumbridge.model;

public enum LedgerVariant {
    BURN_AND_MINT("burn-mint"),
    LOCK_AND_RELEASE("lock-release");

    private final String label;

    LedgerVariant(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static LedgerVariant fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Ledger variant is required");
        }
        for (LedgerVariant value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ledger variant: " + raw);
    }
}
