package io.quorumbridge.ledger;

import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.LedgerVariant;
import io.quorumbridge.model.TokenUnits;
import io.quorumbridge.observability.EventSink;
import io.quorumbridge.observability.LedgerEvents;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Ledger that is its own token. Bridging out burns from the caller, bridging in mints to the recipient,
 * so supply on this chain always equals what was settled in minus what was sent out.
 */
public final class BurnMintLedger extends BridgeLedger implements FungibleToken {
    private final TokenAccounts accounts = new TokenAccounts();

    public BurnMintLedger(DeploymentConfig config, Clock clock, EventSink sink) {
        super(config, clock, sink);
        if (config.variant() != LedgerVariant.BURN_AND_MINT) {
            throw new IllegalArgumentException("Deployment is not a burn-mint ledger: " + config.name());
        }
    }

    @Override
    public String name() {
        return config.tokenName();
    }

    @Override
    public String symbol() {
        return config.tokenSymbol();
    }

    public int decimals() {
        return TokenUnits.DECIMALS;
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return accounts.totalSupply();
    }

    @Override
    public synchronized BigInteger balanceOf(Address account) {
        return accounts.balanceOf(account);
    }

    @Override
    public synchronized BigInteger allowance(Address owner, Address spender) {
        return accounts.allowance(owner, spender);
    }

    @Override
    public synchronized void transfer(Address caller, Address to, BigInteger amount) {
        transact(() -> {
            requireTransfersOpen();
            accounts.transfer(caller, to, amount);
            emit(new LedgerEvents.Transfer(caller, to, amount, now()));
            return null;
        });
    }

    @Override
    public synchronized void approve(Address caller, Address spender, BigInteger amount) {
        transact(() -> {
            accounts.approve(caller, spender, amount);
            emit(new LedgerEvents.Approval(caller, spender, amount, now()));
            return null;
        });
    }

    @Override
    public synchronized void transferFrom(Address caller, Address from, Address to, BigInteger amount) {
        transact(() -> {
            requireTransfersOpen();
            accounts.transferFrom(caller, from, to, amount);
            emit(new LedgerEvents.Transfer(from, to, amount, now()));
            return null;
        });
    }

    @Override
    public synchronized BigInteger getVaultBalance() {
        return accounts.balanceOf(address());
    }

    @Override
    protected void debitOutbound(Address from, BigInteger amount) {
        accounts.burn(from, amount);
        emit(new LedgerEvents.Transfer(from, Address.ZERO, amount, now()));
    }

    @Override
    protected void checkInboundCapacity(BigInteger amount) {
        // minting has no custody limit
    }

    @Override
    protected void creditInbound(Address to, BigInteger amount) {
        accounts.mint(to, amount);
        emit(new LedgerEvents.Transfer(Address.ZERO, to, amount, now()));
    }

    @Override
    protected TokenAccounts.State tokenSnapshot() {
        return accounts.snapshot();
    }

    @Override
    protected void restoreToken(TokenAccounts.State state) {
        accounts.restore(state == null ? new TokenAccounts.State(null, null, null) : state);
    }
}
