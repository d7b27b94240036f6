package io.quorumbridge.auth;

import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.OperationType;

import java.math.BigInteger;
import java.util.List;

/**
 * Immutable view of an operation, used for reads and for persisted snapshots. {@code payload} is hex.
 */
public record OperationRecord(
        Bytes32 operationId,
        long sequence,
        int typeCode,
        OperationType type,
        Address target,
        BigInteger value,
        String payload,
        Address requester,
        long createdAt,
        long deadline,
        List<Address> signedBy,
        boolean executed
) {
    public OperationRecord {
        signedBy = signedBy == null ? List.of() : List.copyOf(signedBy);
    }

    public int signatureCount() {
        return signedBy.size();
    }

    public boolean hasSigned(Address signer) {
        return signedBy.contains(signer);
    }
}
