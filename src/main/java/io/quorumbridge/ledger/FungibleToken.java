package io.quorumbridge.ledger;

import io.quorumbridge.model.Address;

import java.math.BigInteger;

/**
 * Minimal fungible token surface. {@code caller} is the identity the call is made as.
 */
public interface FungibleToken {
    Address address();

    String name();

    String symbol();

    BigInteger totalSupply();

    BigInteger balanceOf(Address account);

    BigInteger allowance(Address owner, Address spender);

    void transfer(Address caller, Address to, BigInteger amount);

    void approve(Address caller, Address spender, BigInteger amount);

    void transferFrom(Address caller, Address from, Address to, BigInteger amount);
}
