package io.quorumbridge.ledger;

import io.quorumbridge.model.AbiWords;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.Rejection;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Balance and allowance bookkeeping shared by the token-bearing ledgers. Every method validates fully
 * before it mutates anything.
 */
public final class TokenAccounts {
    private final Map<Address, BigInteger> balances = new LinkedHashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new LinkedHashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public record Balance(Address account, BigInteger amount) {
    }

    public record Allowance(Address owner, Address spender, BigInteger amount) {
    }

    public record State(List<Balance> balances, List<Allowance> allowances, BigInteger totalSupply) {
        public State {
            balances = balances == null ? List.of() : List.copyOf(balances);
            allowances = allowances == null ? List.of() : List.copyOf(allowances);
            totalSupply = totalSupply == null ? BigInteger.ZERO : totalSupply;
        }
    }

    public BigInteger totalSupply() {
        return totalSupply;
    }

    public BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    public BigInteger allowance(Address owner, Address spender) {
        Map<Address, BigInteger> granted = allowances.get(owner);
        return granted == null ? BigInteger.ZERO : granted.getOrDefault(spender, BigInteger.ZERO);
    }

    public void mint(Address to, BigInteger amount) {
        requireAmount(amount);
        LedgerException.require(to != null && !to.isZero(), Rejection.INVALID_TRANSFER_ADDRESS);
        BigInteger supply = totalSupply.add(amount);
        LedgerException.require(supply.compareTo(AbiWords.UINT256_MAX) <= 0, Rejection.INVALID_AMOUNT);
        totalSupply = supply;
        credit(to, amount);
    }

    public void burn(Address from, BigInteger amount) {
        requireAmount(amount);
        LedgerException.require(from != null && !from.isZero(), Rejection.INVALID_TRANSFER_ADDRESS);
        LedgerException.require(balanceOf(from).compareTo(amount) >= 0, Rejection.INSUFFICIENT_BALANCE);
        debit(from, amount);
        totalSupply = totalSupply.subtract(amount);
    }

    public void transfer(Address from, Address to, BigInteger amount) {
        requireAmount(amount);
        LedgerException.require(from != null && !from.isZero() && to != null && !to.isZero(),
                Rejection.INVALID_TRANSFER_ADDRESS);
        LedgerException.require(balanceOf(from).compareTo(amount) >= 0, Rejection.INSUFFICIENT_BALANCE);
        debit(from, amount);
        credit(to, amount);
    }

    public void approve(Address owner, Address spender, BigInteger amount) {
        requireAmount(amount);
        LedgerException.require(owner != null && !owner.isZero() && spender != null && !spender.isZero(),
                Rejection.INVALID_TRANSFER_ADDRESS);
        allowances.computeIfAbsent(owner, k -> new LinkedHashMap<>()).put(spender, amount);
    }

    /**
     * Spends {@code spender}'s allowance on {@code from} and moves the tokens. A maximal allowance is
     * never decreased.
     */
    public void transferFrom(Address spender, Address from, Address to, BigInteger amount) {
        requireAmount(amount);
        BigInteger granted = allowance(from, spender);
        LedgerException.require(granted.compareTo(amount) >= 0, Rejection.INSUFFICIENT_ALLOWANCE);
        transfer(from, to, amount);
        if (!granted.equals(AbiWords.UINT256_MAX)) {
            allowances.get(from).put(spender, granted.subtract(amount));
        }
    }

    public State snapshot() {
        List<Balance> balanceRows = new ArrayList<>();
        for (Map.Entry<Address, BigInteger> entry : balances.entrySet()) {
            balanceRows.add(new Balance(entry.getKey(), entry.getValue()));
        }
        List<Allowance> allowanceRows = new ArrayList<>();
        for (Map.Entry<Address, Map<Address, BigInteger>> owner : allowances.entrySet()) {
            for (Map.Entry<Address, BigInteger> spender : owner.getValue().entrySet()) {
                allowanceRows.add(new Allowance(owner.getKey(), spender.getKey(), spender.getValue()));
            }
        }
        return new State(balanceRows, allowanceRows, totalSupply);
    }

    public void restore(State state) {
        balances.clear();
        allowances.clear();
        for (Balance row : state.balances()) {
            balances.put(row.account(), row.amount());
        }
        for (Allowance row : state.allowances()) {
            allowances.computeIfAbsent(row.owner(), k -> new LinkedHashMap<>()).put(row.spender(), row.amount());
        }
        totalSupply = state.totalSupply();
    }

    private void credit(Address account, BigInteger amount) {
        balances.merge(account, amount, BigInteger::add);
    }

    private void debit(Address account, BigInteger amount) {
        BigInteger remaining = balanceOf(account).subtract(amount);
        if (remaining.signum() == 0) {
            balances.remove(account);
        } else {
            balances.put(account, remaining);
        }
    }

    private static void requireAmount(BigInteger amount) {
        LedgerException.require(amount != null && amount.signum() >= 0
                && amount.compareTo(AbiWords.UINT256_MAX) <= 0, Rejection.INVALID_AMOUNT);
    }
}
