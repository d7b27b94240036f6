package io.quorumbridge.ledger;

import io.quorumbridge.model.Address;
import io.quorumbridge.observability.EventSink;
import io.quorumbridge.observability.LedgerEvent;
import io.quorumbridge.observability.LedgerEvents;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Locally simulated origin-chain token that a {@link LockReleaseVault} holds in custody. Supply only
 * enters through {@link #mint}, which stands in for whatever issued the token on its home chain.
 *
 * <p>While a {@link Checkpoint} is open, events are held back and published when the outermost
 * checkpoint commits.
 */
public final class OriginToken implements FungibleToken {
    private final Address address;
    private final String name;
    private final String symbol;
    private final Clock clock;
    private final EventSink sink;
    private final TokenAccounts accounts = new TokenAccounts();
    private final List<LedgerEvent> held = new ArrayList<>();
    private int openCheckpoints;

    record Checkpoint(TokenAccounts.State state, int mark) {
    }

    public OriginToken(Address address, String name, String symbol, Clock clock, EventSink sink) {
        if (address == null || address.isZero()) {
            throw new IllegalArgumentException("Invalid token address");
        }
        this.address = address;
        this.name = Objects.requireNonNull(name, "name");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = sink == null ? EventSink.NONE : sink;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String symbol() {
        return symbol;
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

    public synchronized void mint(Address to, BigInteger amount) {
        accounts.mint(to, amount);
        publish(new LedgerEvents.Transfer(Address.ZERO, to, amount, now()));
    }

    @Override
    public synchronized void transfer(Address caller, Address to, BigInteger amount) {
        accounts.transfer(caller, to, amount);
        publish(new LedgerEvents.Transfer(caller, to, amount, now()));
    }

    @Override
    public synchronized void approve(Address caller, Address spender, BigInteger amount) {
        accounts.approve(caller, spender, amount);
        publish(new LedgerEvents.Approval(caller, spender, amount, now()));
    }

    @Override
    public synchronized void transferFrom(Address caller, Address from, Address to, BigInteger amount) {
        accounts.transferFrom(caller, from, to, amount);
        publish(new LedgerEvents.Transfer(from, to, amount, now()));
    }

    public synchronized TokenAccounts.State snapshot() {
        return accounts.snapshot();
    }

    public synchronized void restore(TokenAccounts.State state) {
        accounts.restore(state);
    }

    synchronized Checkpoint checkpoint() {
        openCheckpoints++;
        return new Checkpoint(accounts.snapshot(), held.size());
    }

    /**
     * Closes {@code checkpoint}; a rollback restores balances and allowances and drops the events raised
     * since it was opened.
     */
    synchronized void close(Checkpoint checkpoint, boolean committed) {
        openCheckpoints--;
        if (!committed) {
            accounts.restore(checkpoint.state());
            held.subList(checkpoint.mark(), held.size()).clear();
        }
        if (openCheckpoints == 0 && !held.isEmpty()) {
            List<LedgerEvent> ready = new ArrayList<>(held);
            held.clear();
            for (LedgerEvent event : ready) {
                sink.publish(event);
            }
        }
    }

    private void publish(LedgerEvent event) {
        if (openCheckpoints > 0) {
            held.add(event);
        } else {
            sink.publish(event);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
