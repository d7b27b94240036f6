package io.quorumbridge.auth;

/**
 * Applies an approved operation to the owning ledger. Any {@link RuntimeException} aborts the whole call.
 */
@FunctionalInterface
public interface OperationEffects {
    void apply(OperationRecord operation);
}
