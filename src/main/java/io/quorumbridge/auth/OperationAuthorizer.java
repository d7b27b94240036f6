package io.quorumbridge.auth;

import io.quorumbridge.model.AbiWords;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.OperationCodebook;
import io.quorumbridge.model.OperationType;
import io.quorumbridge.model.Rejection;
import io.quorumbridge.observability.LedgerEvent;
import io.quorumbridge.observability.LedgerEvents;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Request, sign and execute cycle for privileged operations. An operation runs exactly once, in the call
 * that delivers its {@value #QUORUM}th distinct valid signature, and only before its deadline.
 *
 * <p>Not thread-safe on its own; the owning ledger serializes calls.
 */
public final class OperationAuthorizer {
    public static final int QUORUM = 3;
    public static final Duration OPERATION_TTL = Duration.ofDays(3);

    private final long chainId;
    private final OperationCodebook codebook;
    private final SignerRegistry registry;
    private final Clock clock;
    private final Consumer<LedgerEvent> emitter;
    private final OperationEffects effects;
    private final Map<Bytes32, Operation> operations = new LinkedHashMap<>();
    private long nextSequence;

    public OperationAuthorizer(
            long chainId,
            OperationCodebook codebook,
            SignerRegistry registry,
            Clock clock,
            Consumer<LedgerEvent> emitter,
            OperationEffects effects
    ) {
        this.chainId = chainId;
        this.codebook = Objects.requireNonNull(codebook, "codebook");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.effects = Objects.requireNonNull(effects, "effects");
    }

    public Bytes32 request(Address caller, int typeCode, Address target, BigInteger value, byte[] payload) {
        LedgerException.require(registry.isSigner(caller) || registry.isAdministrator(caller),
                Rejection.NOT_SIGNER_OR_OWNER);
        OperationType type = codebook.resolve(typeCode)
                .orElseThrow(() -> new LedgerException(Rejection.INVALID_OPERATION_TYPE));
        LedgerException.require(target != null, Rejection.INVALID_TARGET);
        LedgerException.require(value != null && value.signum() >= 0 && value.compareTo(AbiWords.UINT256_MAX) <= 0,
                Rejection.INVALID_AMOUNT);
        byte[] data = payload == null ? new byte[0] : payload.clone();

        if (type == OperationType.UPDATE_SIGNER) {
            LedgerException.require(registry.isSigner(target), Rejection.INVALID_OLD_SIGNER);
            Address replacement = Address.fromWord(value);
            LedgerException.require(!replacement.isZero() && !registry.isSigner(replacement),
                    Rejection.INVALID_NEW_SIGNER);
            LedgerException.require(!caller.equals(target), Rejection.CANNOT_REQUEST_OWN_REMOVAL);
        }

        long sequence = nextSequence;
        Bytes32 operationId = OperationHasher.operationId(sequence, typeCode, target, value, data, chainId);
        long now = now();
        long deadline = now + OPERATION_TTL.getSeconds();
        operations.put(operationId, new Operation(
                operationId, sequence, typeCode, type, target, value, data, caller, now, deadline));
        nextSequence = sequence + 1;
        emitter.accept(new LedgerEvents.OperationRequested(
                operationId, sequence, typeCode, type, target, value, Numeric.toHexString(data), caller, deadline, now));
        return operationId;
    }

    public Bytes32 operationHash(Bytes32 operationId) {
        Operation op = find(operationId);
        return OperationHasher.digest(op.operationId(), op.typeCode(), op.target(), op.value(), op.payload(), chainId);
    }

    /**
     * Records {@code caller}'s approval and executes the operation when it completes the quorum. Only
     * signers approve, except that the administrator may also approve a signer replacement.
     *
     * @return true when this signature executed the operation
     */
    public boolean submit(Address caller, Bytes32 operationId, byte[] signature) {
        Operation op = find(operationId);
        boolean signerUpdate = op.type() == OperationType.UPDATE_SIGNER;
        LedgerException.require(registry.isSigner(caller) || (signerUpdate && registry.isAdministrator(caller)),
                Rejection.NOT_SIGNER);
        LedgerException.require(!op.executed(), Rejection.ALREADY_EXECUTED);
        LedgerException.require(now() <= op.deadline(), Rejection.DEADLINE_PASSED);
        LedgerException.require(!op.hasSigned(caller), Rejection.DUPLICATE_SIGNATURE);

        Address recovered = SignatureVerifier.recover(operationHash(operationId), signature);
        LedgerException.require(recovered.equals(caller), Rejection.SIGNATURE_NOT_FROM_CALLER);
        if (signerUpdate) {
            LedgerException.require(!recovered.equals(op.target()), Rejection.REPLACED_SIGNER_CANNOT_APPROVE);
        }

        int count = op.addSignature(caller);
        emitter.accept(new LedgerEvents.SignatureSubmitted(operationId, caller, count, now()));
        if (count == QUORUM) {
            execute(op);
            return true;
        }
        return false;
    }

    /**
     * False for an id that was never requested; only a known operation has a deadline to pass.
     */
    public boolean isExpired(Bytes32 operationId) {
        Operation op = operations.get(operationId);
        return op != null && now() > op.deadline();
    }

    public Optional<OperationRecord> operation(Bytes32 operationId) {
        Operation op = operations.get(operationId);
        return op == null ? Optional.empty() : Optional.of(op.toRecord());
    }

    public List<OperationRecord> operations() {
        List<OperationRecord> out = new ArrayList<>();
        for (Operation op : operations.values()) {
            out.add(op.toRecord());
        }
        return out;
    }

    public long nextSequence() {
        return nextSequence;
    }

    public long chainId() {
        return chainId;
    }

    public OperationCodebook codebook() {
        return codebook;
    }

    public SignerRegistry registry() {
        return registry;
    }

    /**
     * Replaces all operation state; used when loading a stored ledger and when rolling back a failed call.
     */
    public void restore(long nextSequence, List<OperationRecord> records) {
        operations.clear();
        for (OperationRecord record : records) {
            operations.put(record.operationId(), Operation.fromRecord(record));
        }
        this.nextSequence = nextSequence;
    }

    public void restoreSigners(List<Address> signers) {
        registry.restore(signers);
    }

    private void execute(Operation op) {
        op.markExecuted();
        effects.apply(op.toRecord());
        emitter.accept(new LedgerEvents.OperationExecuted(op.operationId(), op.type(), now()));
    }

    private Operation find(Bytes32 operationId) {
        Operation op = operationId == null ? null : operations.get(operationId);
        if (op == null) {
            throw new LedgerException(Rejection.OPERATION_NOT_FOUND);
        }
        return op;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
