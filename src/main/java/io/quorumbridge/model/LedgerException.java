package io.quorumbridge.model;

/**
 * A refused ledger call. Thrown before any state change becomes visible.
 */
public final class LedgerException extends RuntimeException {
    private final Rejection rejection;

    public LedgerException(Rejection rejection) {
        super(rejection.reason());
        this.rejection = rejection;
    }

    public Rejection rejection() {
        return rejection;
    }

    public static void require(boolean condition, Rejection rejection) {
        if (!condition) {
            throw new LedgerException(rejection);
        }
    }
}
