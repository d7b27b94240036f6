package io.quorumbridge.ledger;

import io.quorumbridge.auth.OperationRecord;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LifecycleState;

import java.math.BigInteger;
import java.util.List;

/**
 * Complete owned state of one ledger. {@code token} is null for the lock-and-release variant, whose
 * balances live in the origin token. A null {@code maxBridgeOutAmount} means bridge-out follows the
 * bridge-in cap.
 */
public record LedgerState(
        List<Address> signers,
        long nextSequence,
        List<OperationRecord> operations,
        LifecycleState lifecycle,
        Address bridgeInCaller,
        BigInteger maxBridgeInAmount,
        BigInteger maxBridgeOutAmount,
        long bridgeInCooldownSeconds,
        long lastBridgeInAt,
        boolean bridgeInEnabled,
        boolean bridgeOutEnabled,
        List<Bytes32> replaySlots,
        long replayCursor,
        TokenAccounts.State token
) {
    public LedgerState {
        signers = List.copyOf(signers);
        operations = operations == null ? List.of() : List.copyOf(operations);
        replaySlots = replaySlots == null ? List.of() : List.copyOf(replaySlots);
    }
}
