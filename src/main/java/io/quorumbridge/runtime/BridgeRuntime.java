package io.quorumbridge.runtime;

import io.quorumbridge.auth.OperationRecord;
import io.quorumbridge.config.BridgeConfig;
import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.ledger.BridgeLedger;
import io.quorumbridge.ledger.BurnMintLedger;
import io.quorumbridge.ledger.FungibleToken;
import io.quorumbridge.ledger.LockReleaseVault;
import io.quorumbridge.ledger.OriginToken;
import io.quorumbridge.ledger.TokenAccounts;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.LedgerVariant;
import io.quorumbridge.model.LifecycleState;
import io.quorumbridge.model.OperationType;
import io.quorumbridge.model.Rejection;
import io.quorumbridge.observability.EventJournal;
import io.quorumbridge.observability.LedgerEvent;
import io.quorumbridge.observability.RecordingEventSink;
import io.quorumbridge.storage.Database;
import io.quorumbridge.storage.LedgerStore;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs ledger calls against stored deployments. Each call loads the deployment, applies exactly one ledger
 * operation, and on success commits the new state and its events together; a rejected call persists
 * nothing.
 */
public final class BridgeRuntime {
    private final BridgeConfig config;
    private final Clock clock;
    private final Database database;
    private final LedgerStore store;
    private final EventJournal journal;

    public BridgeRuntime(BridgeConfig config) {
        this(config, Clock.systemUTC());
    }

    public BridgeRuntime(BridgeConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.database = new Database(config);
        this.store = new LedgerStore(database);
        this.journal = new EventJournal(
                config.journalFile(),
                config.namespace(),
                EventJournal.loadOrCreateSigningSecret(config.journalKeyFile()),
                clock
        );
    }

    public void init() {
        database.init();
    }

    public BridgeConfig config() {
        return config;
    }

    public DeployOutcome deploy(DeploymentConfig deployment) {
        RecordingEventSink sink = new RecordingEventSink();
        Loaded loaded = build(deployment, sink);
        store.create(deployment, loaded.ledger().snapshot(), loaded.originState(), clock.millis());
        return new DeployOutcome(
                deployment.name(),
                deployment.variant(),
                deployment.chainId(),
                deployment.ledgerAddress(),
                deployment.originToken(),
                deployment.signers(),
                deployment.administrator(),
                deployment.operationCodes()
        );
    }

    public List<String> deployments() {
        List<String> out = new ArrayList<>();
        for (LedgerStore.StoredDeployment stored : store.list()) {
            out.add(stored.name());
        }
        return out;
    }

    public RequestOutcome requestOperation(
            String deployment,
            Address caller,
            int typeCode,
            Address target,
            BigInteger value,
            byte[] payload
    ) {
        return apply(deployment, loaded -> {
            BridgeLedger ledger = loaded.ledger();
            Bytes32 operationId = ledger.requestOperation(caller, typeCode, target, value, payload);
            OperationRecord op = ledger.getOperation(operationId).orElseThrow();
            return new RequestOutcome(
                    deployment,
                    operationId,
                    op.sequence(),
                    op.typeCode(),
                    op.type(),
                    ledger.getOperationHash(operationId),
                    op.deadline()
            );
        });
    }

    public RequestOutcome requestOperation(
            String deployment,
            Address caller,
            OperationType type,
            Address target,
            BigInteger value,
            byte[] payload
    ) {
        DeploymentConfig stored = load(deployment).config();
        LedgerException.require(stored.codebook().supports(type), Rejection.INVALID_OPERATION_TYPE);
        return requestOperation(deployment, caller, stored.codebook().codeOf(type), target, value, payload);
    }

    public Bytes32 operationHash(String deployment, Bytes32 operationId) {
        return read(deployment, loaded -> loaded.ledger().getOperationHash(operationId));
    }

    public OperationView operation(String deployment, Bytes32 operationId) {
        return read(deployment, loaded -> {
            BridgeLedger ledger = loaded.ledger();
            OperationRecord op = ledger.getOperation(operationId)
                    .orElseThrow(() -> new LedgerException(Rejection.OPERATION_NOT_FOUND));
            return new OperationView(op, ledger.isOperationExpired(operationId), ledger.getOperationHash(operationId));
        });
    }

    public List<OperationRecord> operations(String deployment) {
        return read(deployment, loaded -> loaded.ledger().operations());
    }

    public SignatureOutcome submitSignature(String deployment, Address caller, Bytes32 operationId, byte[] signature) {
        return apply(deployment, loaded -> {
            BridgeLedger ledger = loaded.ledger();
            boolean executed = ledger.submitSignature(caller, operationId, signature);
            OperationRecord op = ledger.getOperation(operationId).orElseThrow();
            return new SignatureOutcome(deployment, operationId, caller, op.signatureCount(), executed, op.executed());
        });
    }

    public BridgeOutOutcome bridgeOut(
            String deployment,
            Address caller,
            BigInteger amount,
            Address target,
            long chainId,
            long destinationChainId
    ) {
        return apply(deployment, loaded -> {
            loaded.ledger().bridgeOut(caller, amount, target, chainId, destinationChainId);
            return new BridgeOutOutcome(deployment, caller, amount, target, chainId, destinationChainId);
        });
    }

    public BridgeInOutcome bridgeIn(
            String deployment,
            Address caller,
            Address recipient,
            BigInteger amount,
            long chainId,
            Bytes32 transferId,
            long sourceChainId
    ) {
        return apply(deployment, loaded -> {
            loaded.ledger().bridgeIn(caller, recipient, amount, chainId, transferId, sourceChainId);
            return new BridgeInOutcome(deployment, recipient, amount, chainId, transferId, sourceChainId);
        });
    }

    /**
     * Transfers the deployment's working token: the ledger's own token for burn-mint, the origin token for a
     * vault.
     */
    public TokenOutcome transfer(String deployment, Address caller, Address to, BigInteger amount) {
        return apply(deployment, loaded -> {
            loaded.token().transfer(caller, to, amount);
            return new TokenOutcome(deployment, "transfer", caller, to, amount, loaded.token().balanceOf(caller));
        });
    }

    public TokenOutcome approve(String deployment, Address caller, Address spender, BigInteger amount) {
        return apply(deployment, loaded -> {
            loaded.token().approve(caller, spender, amount);
            return new TokenOutcome(deployment, "approve", caller, spender, amount, loaded.token().allowance(caller, spender));
        });
    }

    public TokenOutcome seedOriginBalance(String deployment, Address account, BigInteger amount) {
        return apply(deployment, loaded -> {
            if (loaded.origin() == null) {
                throw new IllegalArgumentException("Deployment " + deployment + " has no local origin token");
            }
            loaded.origin().mint(account, amount);
            return new TokenOutcome(deployment, "seed", Address.ZERO, account, amount, loaded.origin().balanceOf(account));
        });
    }

    public BalanceView balance(String deployment, Address account) {
        return read(deployment, loaded -> new BalanceView(
                deployment,
                loaded.token().address(),
                account,
                loaded.token().balanceOf(account)
        ));
    }

    public StatusView status(String deployment) {
        LedgerStore.StoredDeployment stored = load(deployment);
        Loaded loaded = restore(stored, new RecordingEventSink());
        BridgeLedger ledger = loaded.ledger();
        DeploymentConfig cfg = stored.config();
        return new StatusView(
                cfg.name(),
                cfg.variant(),
                cfg.chainId(),
                cfg.ledgerAddress(),
                cfg.originToken(),
                ledger.lifecycleState(),
                ledger.signers(),
                ledger.administrator(),
                ledger.getBridgeInCaller(),
                ledger.getMaxBridgeInAmount(),
                ledger.getMaxBridgeOutAmount(),
                ledger.getBridgeInCooldown(),
                ledger.getLastBridgeInAt(),
                ledger.isBridgeInEnabled(),
                ledger.isBridgeOutEnabled(),
                cfg.pauseBlocksBridgeIn(),
                ledger.replaySize(),
                cfg.replayCapacity(),
                ledger.getVaultBalance(),
                loaded.token().totalSupply(),
                ledger.operations().size(),
                cfg.operationCodes(),
                stored.version()
        );
    }

    public boolean isTransferProcessed(String deployment, Bytes32 transferId) {
        return read(deployment, loaded -> loaded.ledger().isTransferProcessed(transferId));
    }

    public List<LedgerStore.EventRow> events(String deployment, String eventName, int limit) {
        load(deployment);
        return store.events(deployment, eventName, limit);
    }

    public EventJournal.IntegrityOutcome verifyJournal() {
        return journal.verifyIntegrity();
    }

    private <T> T apply(String deployment, Function<Loaded, T> action) {
        LedgerStore.StoredDeployment stored = load(deployment);
        RecordingEventSink sink = new RecordingEventSink();
        Loaded loaded = restore(stored, sink);
        T result = action.apply(loaded);
        List<LedgerEvent> events = sink.drain();
        store.save(
                stored.name(),
                stored.version(),
                loaded.ledger().snapshot(),
                loaded.originState(),
                events,
                clock.millis()
        );
        journal.appendAll(stored.name(), events);
        return result;
    }

    private <T> T read(String deployment, Function<Loaded, T> query) {
        return query.apply(restore(load(deployment), new RecordingEventSink()));
    }

    private LedgerStore.StoredDeployment load(String deployment) {
        String name = BridgeConfig.sanitizeName(deployment, "");
        return store.find(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown deployment: " + deployment));
    }

    private Loaded restore(LedgerStore.StoredDeployment stored, RecordingEventSink sink) {
        Loaded loaded = build(stored.config(), sink);
        if (loaded.origin() != null && stored.origin() != null) {
            loaded.origin().restore(stored.origin());
        }
        loaded.ledger().restore(stored.state());
        return loaded;
    }

    private Loaded build(DeploymentConfig deployment, RecordingEventSink sink) {
        if (deployment.variant() == LedgerVariant.BURN_AND_MINT) {
            BurnMintLedger ledger = new BurnMintLedger(deployment, clock, sink);
            return new Loaded(ledger, ledger, null);
        }
        OriginToken origin = new OriginToken(
                deployment.originToken(), deployment.tokenName(), deployment.tokenSymbol(), clock, sink);
        return new Loaded(new LockReleaseVault(deployment, origin, clock, sink), origin, origin);
    }

    private record Loaded(BridgeLedger ledger, FungibleToken token, OriginToken origin) {
        TokenAccounts.State originState() {
            return origin == null ? null : origin.snapshot();
        }
    }

    public record DeployOutcome(
            String name,
            LedgerVariant variant,
            long chainId,
            Address ledgerAddress,
            Address originToken,
            List<Address> signers,
            Address administrator,
            Map<Integer, OperationType> operationCodes
    ) {
    }

    public record RequestOutcome(
            String deployment,
            Bytes32 operationId,
            long sequence,
            int typeCode,
            OperationType type,
            Bytes32 digest,
            long deadline
    ) {
    }

    public record OperationView(OperationRecord operation, boolean expired, Bytes32 digest) {
    }

    public record SignatureOutcome(
            String deployment,
            Bytes32 operationId,
            Address signer,
            int signatureCount,
            boolean executedNow,
            boolean executed
    ) {
    }

    public record BridgeOutOutcome(
            String deployment,
            Address from,
            BigInteger amount,
            Address target,
            long chainId,
            long destinationChainId
    ) {
    }

    public record BridgeInOutcome(
            String deployment,
            Address recipient,
            BigInteger amount,
            long chainId,
            Bytes32 transferId,
            long sourceChainId
    ) {
    }

    public record TokenOutcome(
            String deployment,
            String action,
            Address from,
            Address to,
            BigInteger amount,
            BigInteger resultingAmount
    ) {
    }

    public record BalanceView(String deployment, Address token, Address account, BigInteger balance) {
    }

    public record StatusView(
            String name,
            LedgerVariant variant,
            long chainId,
            Address ledgerAddress,
            Address originToken,
            LifecycleState lifecycle,
            List<Address> signers,
            Address administrator,
            Address bridgeInCaller,
            BigInteger maxBridgeInAmount,
            BigInteger maxBridgeOutAmount,
            long bridgeInCooldownSeconds,
            long lastBridgeInAt,
            boolean bridgeInEnabled,
            boolean bridgeOutEnabled,
            boolean pauseBlocksBridgeIn,
            int replaySize,
            int replayCapacity,
            BigInteger vaultBalance,
            BigInteger totalSupply,
            int operationCount,
            Map<Integer, OperationType> operationCodes,
            long version
    ) {
    }
}
