package io.quorumbridge.auth;

import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.OperationType;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

final class Operation {
    private final Bytes32 operationId;
    private final long sequence;
    private final int typeCode;
    private final OperationType type;
    private final Address target;
    private final BigInteger value;
    private final byte[] payload;
    private final Address requester;
    private final long createdAt;
    private final long deadline;
    private final Set<Address> signedBy = new LinkedHashSet<>();
    private boolean executed;

    Operation(
            Bytes32 operationId,
            long sequence,
            int typeCode,
            OperationType type,
            Address target,
            BigInteger value,
            byte[] payload,
            Address requester,
            long createdAt,
            long deadline
    ) {
        this.operationId = operationId;
        this.sequence = sequence;
        this.typeCode = typeCode;
        this.type = type;
        this.target = target;
        this.value = value;
        this.payload = payload.clone();
        this.requester = requester;
        this.createdAt = createdAt;
        this.deadline = deadline;
    }

    static Operation fromRecord(OperationRecord record) {
        Operation op = new Operation(
                record.operationId(),
                record.sequence(),
                record.typeCode(),
                record.type(),
                record.target(),
                record.value(),
                Numeric.hexStringToByteArray(record.payload() == null ? "0x" : record.payload()),
                record.requester(),
                record.createdAt(),
                record.deadline()
        );
        op.signedBy.addAll(record.signedBy());
        op.executed = record.executed();
        return op;
    }

    OperationRecord toRecord() {
        return new OperationRecord(
                operationId,
                sequence,
                typeCode,
                type,
                target,
                value,
                Numeric.toHexString(payload),
                requester,
                createdAt,
                deadline,
                new ArrayList<>(signedBy),
                executed
        );
    }

    Bytes32 operationId() {
        return operationId;
    }

    int typeCode() {
        return typeCode;
    }

    OperationType type() {
        return type;
    }

    Address target() {
        return target;
    }

    BigInteger value() {
        return value;
    }

    byte[] payload() {
        return payload.clone();
    }

    long deadline() {
        return deadline;
    }

    boolean executed() {
        return executed;
    }

    void markExecuted() {
        executed = true;
    }

    boolean hasSigned(Address signer) {
        return signedBy.contains(signer);
    }

    int addSignature(Address signer) {
        signedBy.add(signer);
        return signedBy.size();
    }
}
