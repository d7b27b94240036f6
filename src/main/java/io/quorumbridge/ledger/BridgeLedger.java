package io.quorumbridge.ledger;

import io.quorumbridge.auth.OperationAuthorizer;
import io.quorumbridge.auth.OperationRecord;
import io.quorumbridge.auth.SignerRegistry;
import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.model.AbiWords;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.LedgerVariant;
import io.quorumbridge.model.LifecycleState;
import io.quorumbridge.model.OperationType;
import io.quorumbridge.model.Rejection;
import io.quorumbridge.observability.EventSink;
import io.quorumbridge.observability.LedgerEvent;
import io.quorumbridge.observability.LedgerEvents;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * State and policy shared by both ledger variants: the approval state machine, bridge-in limits and
 * replay protection, lifecycle, and the two bridging entry points.
 *
 * <p>Every public mutating method is all-or-nothing. The ledger snapshots its state on entry and
 * restores it when the call is rejected; events raised during the call reach the {@link EventSink}
 * only when the outermost call returns normally.
 */
public abstract class BridgeLedger {
    protected final DeploymentConfig config;
    protected final Clock clock;

    private final EventSink sink;
    private final SignerRegistry registry;
    private final OperationAuthorizer authorizer;
    private final Lifecycle lifecycle = new Lifecycle();
    private final ReplayRegistry replay;
    private final ReentrancyGuard guard = new ReentrancyGuard();
    private final List<LedgerEvent> pending = new ArrayList<>();
    private int depth;

    private Address bridgeInCaller = Address.ZERO;
    private BigInteger maxBridgeInAmount;
    private BigInteger maxBridgeOutAmount;
    private long bridgeInCooldownSeconds;
    private long lastBridgeInAt;
    private boolean bridgeInEnabled = true;
    private boolean bridgeOutEnabled = true;

    protected BridgeLedger(DeploymentConfig config, Clock clock, EventSink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = sink == null ? EventSink.NONE : sink;
        this.registry = new SignerRegistry(config.signers(), config.administrator());
        this.replay = new ReplayRegistry(config.replayCapacity());
        this.maxBridgeInAmount = config.maxBridgeInAmount();
        this.bridgeInCooldownSeconds = config.bridgeInCooldownSeconds();
        this.authorizer = new OperationAuthorizer(
                config.chainId(),
                config.codebook(),
                registry,
                clock,
                this::emit,
                op -> guard.run(() -> apply(op))
        );
    }

    public Address address() {
        return config.ledgerAddress();
    }

    public LedgerVariant variant() {
        return config.variant();
    }

    public DeploymentConfig config() {
        return config;
    }

    public synchronized Bytes32 requestOperation(
            Address caller,
            int typeCode,
            Address target,
            BigInteger value,
            byte[] payload
    ) {
        return transact(() -> {
            lifecycle.requireNotHalted();
            return authorizer.request(caller, typeCode, target, value, payload);
        });
    }

    public synchronized Bytes32 requestOperation(
            Address caller,
            OperationType type,
            Address target,
            BigInteger value,
            byte[] payload
    ) {
        LedgerException.require(type != null && authorizer.codebook().supports(type), Rejection.INVALID_OPERATION_TYPE);
        return requestOperation(caller, authorizer.codebook().codeOf(type), target, value, payload);
    }

    public synchronized Bytes32 getOperationHash(Bytes32 operationId) {
        return authorizer.operationHash(operationId);
    }

    /**
     * @return true when this signature completed the quorum and the operation executed
     */
    public synchronized boolean submitSignature(Address caller, Bytes32 operationId, byte[] signature) {
        return transact(() -> {
            lifecycle.requireNotHalted();
            return authorizer.submit(caller, operationId, signature);
        });
    }

    public synchronized boolean isOperationExpired(Bytes32 operationId) {
        return authorizer.isExpired(operationId);
    }

    public synchronized Optional<OperationRecord> getOperation(Bytes32 operationId) {
        return authorizer.operation(operationId);
    }

    public synchronized List<OperationRecord> operations() {
        return authorizer.operations();
    }

    public synchronized boolean isSigner(Address identity) {
        return registry.isSigner(identity);
    }

    public synchronized List<Address> signers() {
        return registry.signers();
    }

    public Address administrator() {
        return registry.administrator();
    }

    public synchronized void bridgeOut(Address caller, BigInteger amount, Address target, long chainId) {
        bridgeOut(caller, amount, target, chainId, 0L);
    }

    /**
     * Takes {@code amount} from {@code caller} on this chain for delivery to {@code target} elsewhere.
     * A destination of zero means unspecified.
     */
    public synchronized void bridgeOut(
            Address caller,
            BigInteger amount,
            Address target,
            long chainId,
            long destinationChainId
    ) {
        transact(() -> {
            Objects.requireNonNull(caller, "caller");
            lifecycle.requireActive();
            LedgerException.require(bridgeOutEnabled, Rejection.BRIDGE_OUT_DISABLED);
            LedgerException.require(chainId == config.chainId(), Rejection.INVALID_CHAIN);
            requireUint256(amount);
            LedgerException.require(amount.signum() > 0, Rejection.ZERO_BRIDGE_OUT);
            LedgerException.require(target != null && !target.isZero(), Rejection.INVALID_TARGET);
            if (maxBridgeOutAmount == null) {
                LedgerException.require(amount.compareTo(maxBridgeInAmount) <= 0, Rejection.AMOUNT_OVER_CAP);
            } else {
                LedgerException.require(amount.compareTo(maxBridgeOutAmount) <= 0, Rejection.AMOUNT_OVER_BRIDGE_OUT_CAP);
            }
            LedgerException.require(destinationChainId == 0L || destinationChainId != config.chainId(),
                    Rejection.SAME_DESTINATION_CHAIN);
            debitOutbound(caller, amount);
            emit(new LedgerEvents.BridgedOut(caller, amount, target, chainId, destinationChainId, now()));
            return null;
        });
    }

    public synchronized void bridgeIn(Address caller, Address recipient, BigInteger amount, long chainId, Bytes32 transferId) {
        bridgeIn(caller, recipient, amount, chainId, transferId, 0L);
    }

    /**
     * Settles a transfer committed on another chain. The transfer id and settlement time are recorded
     * before value moves.
     */
    public synchronized void bridgeIn(
            Address caller,
            Address recipient,
            BigInteger amount,
            long chainId,
            Bytes32 transferId,
            long sourceChainId
    ) {
        transact(() -> guard.call(() -> {
            lifecycle.requireNotHalted();
            LedgerException.require(caller != null && !bridgeInCaller.isZero() && bridgeInCaller.equals(caller),
                    Rejection.NOT_BRIDGE_IN_CALLER);
            if (config.pauseBlocksBridgeIn()) {
                LedgerException.require(!lifecycle.isPaused(), Rejection.PAUSED);
            }
            LedgerException.require(bridgeInEnabled, Rejection.BRIDGE_IN_DISABLED);
            LedgerException.require(chainId == config.chainId(), Rejection.INVALID_CHAIN);
            requireUint256(amount);
            LedgerException.require(amount.signum() > 0, Rejection.ZERO_BRIDGE_IN);
            LedgerException.require(recipient != null && !recipient.isZero(), Rejection.INVALID_RECIPIENT);
            LedgerException.require(amount.compareTo(maxBridgeInAmount) <= 0, Rejection.AMOUNT_OVER_CAP);
            long now = now();
            LedgerException.require(now >= lastBridgeInAt + bridgeInCooldownSeconds, Rejection.COOLDOWN_NOT_MET);
            Objects.requireNonNull(transferId, "transferId");
            LedgerException.require(!replay.contains(transferId), Rejection.TRANSFER_ALREADY_PROCESSED);
            checkInboundCapacity(amount);

            replay.insert(transferId);
            lastBridgeInAt = now;
            creditInbound(recipient, amount);
            emit(new LedgerEvents.BridgedIn(recipient, amount, chainId, transferId, sourceChainId, now));
            return null;
        }));
    }

    public long getChainId() {
        return config.chainId();
    }

    public synchronized Address getBridgeInCaller() {
        return bridgeInCaller;
    }

    public synchronized BigInteger getMaxBridgeInAmount() {
        return maxBridgeInAmount;
    }

    /**
     * Outbound per-transfer cap. Tracks the bridge-in cap until an approved {@code SET_BRIDGE_OUT_AMOUNT}
     * gives bridge-out a cap of its own.
     */
    public synchronized BigInteger getMaxBridgeOutAmount() {
        return maxBridgeOutAmount == null ? maxBridgeInAmount : maxBridgeOutAmount;
    }

    public synchronized boolean hasSeparateBridgeOutCap() {
        return maxBridgeOutAmount != null;
    }

    public synchronized long getBridgeInCooldown() {
        return bridgeInCooldownSeconds;
    }

    public synchronized long getLastBridgeInAt() {
        return lastBridgeInAt;
    }

    public synchronized boolean isBridgeInEnabled() {
        return bridgeInEnabled;
    }

    public synchronized boolean isBridgeOutEnabled() {
        return bridgeOutEnabled;
    }

    public synchronized boolean isTransferProcessed(Bytes32 transferId) {
        return replay.contains(transferId);
    }

    public synchronized int replaySize() {
        return replay.size();
    }

    public synchronized LifecycleState lifecycleState() {
        return lifecycle.state();
    }

    public synchronized boolean isPaused() {
        return lifecycle.isPaused();
    }

    public synchronized boolean isHalted() {
        return lifecycle.isHalted();
    }

    /**
     * Balance of the ledger's working token held at the ledger's own address.
     */
    public abstract BigInteger getVaultBalance();

    public synchronized LedgerState snapshot() {
        return new LedgerState(
                registry.signers(),
                authorizer.nextSequence(),
                authorizer.operations(),
                lifecycle.state(),
                bridgeInCaller,
                maxBridgeInAmount,
                maxBridgeOutAmount,
                bridgeInCooldownSeconds,
                lastBridgeInAt,
                bridgeInEnabled,
                bridgeOutEnabled,
                replay.slots(),
                replay.cursor(),
                tokenSnapshot()
        );
    }

    public synchronized void restore(LedgerState state) {
        authorizer.restoreSigners(state.signers());
        authorizer.restore(state.nextSequence(), state.operations());
        lifecycle.restore(state.lifecycle());
        bridgeInCaller = state.bridgeInCaller();
        maxBridgeInAmount = state.maxBridgeInAmount();
        maxBridgeOutAmount = state.maxBridgeOutAmount();
        bridgeInCooldownSeconds = state.bridgeInCooldownSeconds();
        lastBridgeInAt = state.lastBridgeInAt();
        bridgeInEnabled = state.bridgeInEnabled();
        bridgeOutEnabled = state.bridgeOutEnabled();
        replay.restore(state.replaySlots(), state.replayCursor());
        restoreToken(state.token());
    }

    protected abstract void debitOutbound(Address from, BigInteger amount);

    protected abstract void checkInboundCapacity(BigInteger amount);

    protected abstract void creditInbound(Address to, BigInteger amount);

    protected void relinquishCustody() {
        throw new LedgerException(Rejection.UNKNOWN_OPERATION_TYPE);
    }

    /**
     * Opens a rollback scope on state this ledger does not own, closed when the surrounding call ends.
     */
    protected CustodyScope openCustodyScope() {
        return CustodyScope.NONE;
    }

    protected abstract TokenAccounts.State tokenSnapshot();

    protected abstract void restoreToken(TokenAccounts.State state);

    protected final void emit(LedgerEvent event) {
        pending.add(event);
    }

    protected final long now() {
        return clock.instant().getEpochSecond();
    }

    protected final void requireTransfersOpen() {
        LedgerException.require(!lifecycle.isPaused() && !lifecycle.isHalted(), Rejection.TRANSFERS_PAUSED);
    }

    protected final void halt() {
        lifecycle.halt();
    }

    /**
     * Runs {@code body} as one atomic step. Nested calls (a token calling back into this ledger) get their
     * own snapshot so a rejected inner call leaves the outer call's progress intact.
     */
    protected final <T> T transact(Supplier<T> body) {
        LedgerState before = snapshot();
        CustodyScope custody = openCustodyScope();
        int mark = pending.size();
        depth++;
        boolean completed = false;
        try {
            T result = body.get();
            completed = true;
            return result;
        } finally {
            depth--;
            custody.close(completed);
            if (!completed) {
                restore(before);
                pending.subList(mark, pending.size()).clear();
            } else if (depth == 0) {
                List<LedgerEvent> ready = new ArrayList<>(pending);
                pending.clear();
                for (LedgerEvent event : ready) {
                    sink.publish(event);
                }
            }
        }
    }

    protected interface CustodyScope {
        CustodyScope NONE = committed -> {
        };

        void close(boolean committed);
    }

    private void apply(OperationRecord op) {
        long now = now();
        byte[] payload = Numeric.hexStringToByteArray(op.payload());
        switch (op.type()) {
            case PAUSE -> {
                lifecycle.pause();
                emit(new LedgerEvents.Paused(address(), now));
            }
            case UNPAUSE -> {
                lifecycle.unpause();
                emit(new LedgerEvents.Unpaused(address(), now));
            }
            case SET_BRIDGE_IN_CALLER -> {
                LedgerException.require(!op.target().isZero(), Rejection.INVALID_BRIDGE_IN_CALLER);
                Address previous = bridgeInCaller;
                bridgeInCaller = op.target();
                emit(new LedgerEvents.BridgeInCallerUpdated(previous, bridgeInCaller, now));
            }
            case SET_BRIDGE_IN_LIMITS -> {
                LedgerException.require(op.value().signum() > 0, Rejection.INVALID_LIMIT);
                BigInteger cooldown = AbiWords.readUint256(payload)
                        .orElseThrow(() -> new LedgerException(Rejection.INVALID_LIMITS_PAYLOAD));
                LedgerException.require(cooldown.bitLength() < Long.SIZE, Rejection.INVALID_LIMITS_PAYLOAD);
                maxBridgeInAmount = op.value();
                bridgeInCooldownSeconds = cooldown.longValue();
                emit(new LedgerEvents.BridgeInLimitsUpdated(maxBridgeInAmount, bridgeInCooldownSeconds, now));
            }
            case SET_BRIDGE_OUT_AMOUNT -> {
                LedgerException.require(op.value().signum() > 0, Rejection.INVALID_BRIDGE_OUT_LIMIT);
                maxBridgeOutAmount = op.value();
                emit(new LedgerEvents.BridgeOutLimitUpdated(maxBridgeOutAmount, now));
            }
            case UPDATE_SIGNER -> {
                Address replacement = Address.fromWord(op.value());
                registry.replace(op.target(), replacement);
                emit(new LedgerEvents.SignerUpdated(op.target(), replacement, now));
            }
            case SET_BRIDGE_IN_ENABLED -> {
                bridgeInEnabled = AbiWords.readBool(payload)
                        .orElseThrow(() -> new LedgerException(Rejection.INVALID_FLAG_PAYLOAD));
                emit(new LedgerEvents.BridgeDirectionToggled("in", bridgeInEnabled, now));
            }
            case SET_BRIDGE_OUT_ENABLED -> {
                bridgeOutEnabled = AbiWords.readBool(payload)
                        .orElseThrow(() -> new LedgerException(Rejection.INVALID_FLAG_PAYLOAD));
                emit(new LedgerEvents.BridgeDirectionToggled("out", bridgeOutEnabled, now));
            }
            case RELINQUISH_TOKENS -> relinquishCustody();
            default -> throw new LedgerException(Rejection.UNKNOWN_OPERATION_TYPE);
        }
    }

    private static void requireUint256(BigInteger amount) {
        LedgerException.require(amount != null && amount.signum() >= 0
                && amount.compareTo(AbiWords.UINT256_MAX) <= 0, Rejection.INVALID_AMOUNT);
    }
}
