package io.quorumbridge.observability;

import java.util.Map;

/**
 * Structured record of one state change. Events are the only audit trail a ledger keeps.
 */
public interface LedgerEvent {
    String name();

    long timestamp();

    Map<String, Object> fields();
}
