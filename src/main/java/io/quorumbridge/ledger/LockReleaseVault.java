package io.quorumbridge.ledger;

import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.LedgerVariant;
import io.quorumbridge.model.Rejection;
import io.quorumbridge.observability.EventSink;
import io.quorumbridge.observability.LedgerEvents;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;

/**
 * Custody ledger on the token's home chain. Bridging out locks the caller's tokens at the vault address,
 * bridging in releases them, and an approved relinquish sweeps the whole custody to the token's own
 * address and halts the vault for good.
 *
 * <p>An {@link OriginToken} is rolled back together with the vault when a call is rejected. Any other
 * {@link FungibleToken} is not, so the hooks below move tokens only after every check of the call
 * has passed.
 */
public final class LockReleaseVault extends BridgeLedger {
    private final FungibleToken token;

    public LockReleaseVault(DeploymentConfig config, FungibleToken token, Clock clock, EventSink sink) {
        super(config, clock, sink);
        if (config.variant() != LedgerVariant.LOCK_AND_RELEASE) {
            throw new IllegalArgumentException("Deployment is not a lock-release vault: " + config.name());
        }
        this.token = Objects.requireNonNull(token, "token");
        if (token.address() == null || token.address().isZero()) {
            throw new IllegalArgumentException("Invalid token address");
        }
        if (!token.address().equals(config.originToken())) {
            throw new IllegalArgumentException("Token " + token.address() + " does not match deployment token "
                    + config.originToken());
        }
    }

    public FungibleToken token() {
        return token;
    }

    @Override
    public BigInteger getVaultBalance() {
        return token.balanceOf(address());
    }

    @Override
    protected void debitOutbound(Address from, BigInteger amount) {
        LedgerException.require(token.balanceOf(from).compareTo(amount) >= 0, Rejection.INSUFFICIENT_BALANCE);
        token.transferFrom(address(), from, address(), amount);
    }

    @Override
    protected void checkInboundCapacity(BigInteger amount) {
        LedgerException.require(getVaultBalance().compareTo(amount) >= 0, Rejection.INSUFFICIENT_VAULT_BALANCE);
    }

    @Override
    protected void creditInbound(Address to, BigInteger amount) {
        token.transfer(address(), to, amount);
    }

    @Override
    protected void relinquishCustody() {
        BigInteger custody = getVaultBalance();
        LedgerException.require(custody.signum() > 0, Rejection.NOTHING_TO_RELINQUISH);
        halt();
        token.transfer(address(), token.address(), custody);
        long now = now();
        emit(new LedgerEvents.TokensRelinquished(custody, token.address(), now));
        emit(new LedgerEvents.VaultHalted(address(), now));
    }

    @Override
    protected CustodyScope openCustodyScope() {
        if (!(token instanceof OriginToken)) {
            return CustodyScope.NONE;
        }
        OriginToken origin = (OriginToken) token;
        OriginToken.Checkpoint checkpoint = origin.checkpoint();
        return committed -> origin.close(checkpoint, committed);
    }

    @Override
    protected TokenAccounts.State tokenSnapshot() {
        return null;
    }

    @Override
    protected void restoreToken(TokenAccounts.State state) {
        // balances live in the origin token
    }
}
