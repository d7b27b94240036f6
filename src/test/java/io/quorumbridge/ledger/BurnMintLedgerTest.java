package io.quorumbridge.ledger;

import io.quorumbridge.config.BridgeConfig;
import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.model.AbiWords;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.LifecycleState;
import io.quorumbridge.model.OperationType;
import io.quorumbridge.model.Rejection;
import io.quorumbridge.model.TokenUnits;
import io.quorumbridge.observability.LedgerEvents;
import io.quorumbridge.observability.RecordingEventSink;
import io.quorumbridge.testing.MutableClock;
import io.quorumbridge.testing.TestSigners;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;

final class BurnMintLedgerTest {
    private static final long CHAIN = 31337L;
    private static final Address RELAYER = TestSigners.address(5);
    private static final Address USER = TestSigners.address(6);

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
    private final RecordingEventSink sink = new RecordingEventSink();
    private final BurnMintLedger ledger = new BurnMintLedger(
            DeploymentConfig.burnAndMint("secondary", CHAIN, TestSigners.signers(), TestSigners.administrator()),
            clock,
            sink
    );

    @Test
    void pauseNeedsThreeSignaturesAndBlocksOutboundAndTransfers() {
        enableRelayer();
        ledger.bridgeIn(RELAYER, USER, tokens("50"), CHAIN, Bytes32.keccakOf("seed"));

        Bytes32 id = ledger.requestOperation(TestSigners.address(0), OperationType.PAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]);
        Bytes32 digest = ledger.getOperationHash(id);
        ledger.submitSignature(TestSigners.address(1), id, TestSigners.sign(1, digest));
        ledger.submitSignature(TestSigners.address(2), id, TestSigners.sign(2, digest));
        Assertions.assertFalse(ledger.isPaused());
        Assertions.assertTrue(ledger.submitSignature(TestSigners.address(3), id, TestSigners.sign(3, digest)));
        Assertions.assertEquals(LifecycleState.PAUSED, ledger.lifecycleState());

        assertRejected(Rejection.PAUSED, () -> ledger.bridgeOut(USER, tokens("1"), USER, CHAIN));
        assertRejected(Rejection.TRANSFERS_PAUSED, () -> ledger.transfer(USER, RELAYER, tokens("1")));
        clock.advanceSeconds(120);
        assertRejected(Rejection.PAUSED, () -> ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("p")));
        ledger.approve(USER, RELAYER, tokens("1"));

        assertRejected(Rejection.ALREADY_PAUSED, () -> TestSigners.approve(
                ledger, OperationType.PAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]));

        TestSigners.approve(ledger, OperationType.UNPAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]);
        Assertions.assertEquals(LifecycleState.ACTIVE, ledger.lifecycleState());
        ledger.transfer(USER, RELAYER, tokens("1"));
        Assertions.assertEquals(tokens("1"), ledger.balanceOf(RELAYER));
        Assertions.assertEquals(1, sink.ofType(LedgerEvents.Paused.class).size());
        Assertions.assertEquals(1, sink.ofType(LedgerEvents.Unpaused.class).size());
    }

    @Test
    void bridgeInMintsAndBridgeOutBurns() {
        enableRelayer();
        Bytes32 transferId = Bytes32.keccakOf("inbound-1");
        ledger.bridgeIn(RELAYER, USER, tokens("100"), CHAIN, transferId, 1L);

        Assertions.assertEquals(tokens("100"), ledger.balanceOf(USER));
        Assertions.assertEquals(tokens("100"), ledger.totalSupply());
        Assertions.assertTrue(ledger.isTransferProcessed(transferId));
        LedgerEvents.BridgedIn in = sink.last(LedgerEvents.BridgedIn.class).orElseThrow();
        Assertions.assertEquals(USER, in.to());
        Assertions.assertEquals(transferId, in.txId());
        Assertions.assertEquals(1L, in.sourceChainId());

        Address target = TestSigners.address(4);
        ledger.bridgeOut(USER, tokens("40"), target, CHAIN, 1L);
        Assertions.assertEquals(tokens("60"), ledger.balanceOf(USER));
        Assertions.assertEquals(tokens("60"), ledger.totalSupply());
        LedgerEvents.BridgedOut out = sink.last(LedgerEvents.BridgedOut.class).orElseThrow();
        Assertions.assertEquals(target, out.targetAddress());
        Assertions.assertEquals(tokens("40"), out.amount());
        Assertions.assertEquals(1L, out.destinationChainId());
    }

    @Test
    void bridgeInEnforcesCallerChainAmountCapCooldownAndReplay() {
        assertRejected(Rejection.NOT_BRIDGE_IN_CALLER,
                () -> ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("x")));
        enableRelayer();

        assertRejected(Rejection.NOT_BRIDGE_IN_CALLER,
                () -> ledger.bridgeIn(USER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("x")));
        assertRejected(Rejection.INVALID_CHAIN,
                () -> ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN + 1, Bytes32.keccakOf("x")));
        assertRejected(Rejection.ZERO_BRIDGE_IN,
                () -> ledger.bridgeIn(RELAYER, USER, BigInteger.ZERO, CHAIN, Bytes32.keccakOf("x")));
        assertRejected(Rejection.INVALID_RECIPIENT,
                () -> ledger.bridgeIn(RELAYER, Address.ZERO, tokens("1"), CHAIN, Bytes32.keccakOf("x")));
        assertRejected(Rejection.AMOUNT_OVER_CAP,
                () -> ledger.bridgeIn(RELAYER, USER, tokens("10000.000000000000000001"), CHAIN, Bytes32.keccakOf("x")));

        ledger.bridgeIn(RELAYER, USER, tokens("10000"), CHAIN, Bytes32.keccakOf("first"));
        assertRejected(Rejection.COOLDOWN_NOT_MET,
                () -> ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("second")));

        clock.advanceSeconds(61);
        assertRejected(Rejection.TRANSFER_ALREADY_PROCESSED,
                () -> ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("first")));
        ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("second"));
        Assertions.assertEquals(tokens("10001"), ledger.balanceOf(USER));
    }

    @Test
    void bridgeOutEnforcesChainAmountTargetCapDestinationAndBalance() {
        enableRelayer();
        ledger.bridgeIn(RELAYER, USER, tokens("10"), CHAIN, Bytes32.keccakOf("funding"));
        Address target = TestSigners.address(4);

        assertRejected(Rejection.INVALID_CHAIN, () -> ledger.bridgeOut(USER, tokens("1"), target, 1L));
        assertRejected(Rejection.ZERO_BRIDGE_OUT, () -> ledger.bridgeOut(USER, BigInteger.ZERO, target, CHAIN));
        assertRejected(Rejection.INVALID_TARGET, () -> ledger.bridgeOut(USER, tokens("1"), Address.ZERO, CHAIN));
        assertRejected(Rejection.AMOUNT_OVER_CAP, () -> ledger.bridgeOut(USER, tokens("10001"), target, CHAIN));
        assertRejected(Rejection.SAME_DESTINATION_CHAIN, () -> ledger.bridgeOut(USER, tokens("1"), target, CHAIN, CHAIN));
        assertRejected(Rejection.INSUFFICIENT_BALANCE, () -> ledger.bridgeOut(USER, tokens("11"), target, CHAIN));
        Assertions.assertEquals(tokens("10"), ledger.balanceOf(USER));

        TestSigners.approve(ledger, OperationType.SET_BRIDGE_OUT_ENABLED, Address.ZERO, BigInteger.ZERO, AbiWords.bool(false));
        Assertions.assertFalse(ledger.isBridgeOutEnabled());
        assertRejected(Rejection.BRIDGE_OUT_DISABLED, () -> ledger.bridgeOut(USER, tokens("1"), target, CHAIN));
    }

    @Test
    void bridgeInCanBeDisabled() {
        enableRelayer();
        TestSigners.approve(ledger, OperationType.SET_BRIDGE_IN_ENABLED, Address.ZERO, BigInteger.ZERO, AbiWords.bool(false));

        assertRejected(Rejection.BRIDGE_IN_DISABLED,
                () -> ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("x")));
        Assertions.assertTrue(sink.last(LedgerEvents.BridgeDirectionToggled.class).isPresent());
    }

    @Test
    void replayRegistryForgetsOnlyTheOldestIdAfterHundredInserts() {
        enableRelayer();
        for (int i = 0; i <= 100; i++) {
            ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("tx-" + i));
            clock.advanceSeconds(60);
        }

        Assertions.assertFalse(ledger.isTransferProcessed(Bytes32.keccakOf("tx-0")));
        Assertions.assertTrue(ledger.isTransferProcessed(Bytes32.keccakOf("tx-1")));
        Assertions.assertTrue(ledger.isTransferProcessed(Bytes32.keccakOf("tx-100")));
        Assertions.assertEquals(100, ledger.replaySize());

        ledger.bridgeIn(RELAYER, USER, tokens("1"), CHAIN, Bytes32.keccakOf("tx-0"));
        Assertions.assertEquals(tokens("102"), ledger.balanceOf(USER));
    }

    @Test
    void updateSignerReplacesSlotAndRevokesOldSigner() {
        Address newcomer = TestSigners.address(5);
        TestSigners.approve(ledger, 0, new int[]{0, 1, 2},
                OperationType.UPDATE_SIGNER, TestSigners.address(3), newcomer.toWord(), new byte[0]);

        Assertions.assertEquals(newcomer, ledger.signers().get(3));
        Assertions.assertFalse(ledger.isSigner(TestSigners.address(3)));
        LedgerEvents.SignerUpdated updated = sink.last(LedgerEvents.SignerUpdated.class).orElseThrow();
        Assertions.assertEquals(TestSigners.address(3), updated.oldSigner());
        Assertions.assertEquals(newcomer, updated.newSigner());

        assertRejected(Rejection.NOT_SIGNER_OR_OWNER, () -> ledger.requestOperation(
                TestSigners.address(3), OperationType.PAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]));
        TestSigners.approve(ledger, 5, new int[]{5, 0, 1}, OperationType.PAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]);
        Assertions.assertTrue(ledger.isPaused());
    }

    @Test
    void limitsUpdateAppliesCapAndCooldown() {
        TestSigners.approve(ledger, OperationType.SET_BRIDGE_IN_LIMITS, Address.ZERO, tokens("5"), AbiWords.uint256(10));
        Assertions.assertEquals(tokens("5"), ledger.getMaxBridgeInAmount());
        Assertions.assertEquals(10L, ledger.getBridgeInCooldown());

        enableRelayer();
        assertRejected(Rejection.AMOUNT_OVER_CAP,
                () -> ledger.bridgeIn(RELAYER, USER, tokens("6"), CHAIN, Bytes32.keccakOf("a")));
        ledger.bridgeIn(RELAYER, USER, tokens("5"), CHAIN, Bytes32.keccakOf("a"));
        clock.advanceSeconds(10);
        ledger.bridgeIn(RELAYER, USER, tokens("5"), CHAIN, Bytes32.keccakOf("b"));
    }

    @Test
    void failedExecutionRollsBackTheWholeSignatureCall() {
        Bytes32 id = ledger.requestOperation(
                TestSigners.address(0), OperationType.SET_BRIDGE_IN_LIMITS, Address.ZERO, tokens("5"), new byte[0]);
        Bytes32 digest = ledger.getOperationHash(id);
        ledger.submitSignature(TestSigners.address(0), id, TestSigners.sign(0, digest));
        ledger.submitSignature(TestSigners.address(1), id, TestSigners.sign(1, digest));
        int published = sink.events().size();

        assertRejected(Rejection.INVALID_LIMITS_PAYLOAD,
                () -> ledger.submitSignature(TestSigners.address(2), id, TestSigners.sign(2, digest)));

        Assertions.assertFalse(ledger.getOperation(id).orElseThrow().executed());
        Assertions.assertEquals(2, ledger.getOperation(id).orElseThrow().signatureCount());
        Assertions.assertFalse(ledger.getOperation(id).orElseThrow().hasSigned(TestSigners.address(2)));
        Assertions.assertEquals(published, sink.events().size());
        Assertions.assertEquals(BridgeConfig.DEFAULT_MAX_BRIDGE_IN_AMOUNT, ledger.getMaxBridgeInAmount());
    }

    @Test
    void zeroBridgeInCallerAndZeroLimitAreRejectedAtExecution() {
        assertRejected(Rejection.INVALID_BRIDGE_IN_CALLER, () -> TestSigners.approve(
                ledger, OperationType.SET_BRIDGE_IN_CALLER, Address.ZERO, BigInteger.ZERO, new byte[0]));
        assertRejected(Rejection.INVALID_LIMIT, () -> TestSigners.approve(
                ledger, OperationType.SET_BRIDGE_IN_LIMITS, Address.ZERO, BigInteger.ZERO, AbiWords.uint256(1)));
        assertRejected(Rejection.INVALID_FLAG_PAYLOAD, () -> TestSigners.approve(
                ledger, OperationType.SET_BRIDGE_OUT_ENABLED, Address.ZERO, BigInteger.ZERO, new byte[3]));
        Assertions.assertEquals(Address.ZERO, ledger.getBridgeInCaller());
    }

    @Test
    void relinquishIsNotOfferedByBurnMint() {
        assertRejected(Rejection.INVALID_OPERATION_TYPE, () -> ledger.requestOperation(
                TestSigners.address(0), OperationType.RELINQUISH_TOKENS, Address.ZERO, BigInteger.ZERO, new byte[0]));
        assertRejected(Rejection.INVALID_OPERATION_TYPE, () -> ledger.requestOperation(
                TestSigners.address(0), 7, Address.ZERO, BigInteger.ZERO, new byte[0]));
    }

    @Test
    void sameRequestOnTwoChainsCannotShareSignatures() {
        BurnMintLedger other = new BurnMintLedger(
                DeploymentConfig.burnAndMint("secondary-b", CHAIN + 1, TestSigners.signers(), TestSigners.administrator()),
                clock,
                new RecordingEventSink()
        );
        Bytes32 idA = ledger.requestOperation(TestSigners.address(0), OperationType.PAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]);
        Bytes32 idB = other.requestOperation(TestSigners.address(0), OperationType.PAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]);
        Assertions.assertNotEquals(idA, idB);
        Assertions.assertNotEquals(ledger.getOperationHash(idA), other.getOperationHash(idB));

        byte[] signedForA = TestSigners.sign(1, ledger.getOperationHash(idA));
        assertRejected(Rejection.SIGNATURE_NOT_FROM_CALLER,
                () -> other.submitSignature(TestSigners.address(1), idB, signedForA));
    }

    @Test
    void tokenAllowanceFlow() {
        enableRelayer();
        ledger.bridgeIn(RELAYER, USER, tokens("20"), CHAIN, Bytes32.keccakOf("funding"));
        Address spender = TestSigners.address(4);

        assertRejected(Rejection.INSUFFICIENT_ALLOWANCE, () -> ledger.transferFrom(spender, USER, spender, tokens("1")));
        ledger.approve(USER, spender, tokens("5"));
        ledger.transferFrom(spender, USER, spender, tokens("3"));

        Assertions.assertEquals(tokens("2"), ledger.allowance(USER, spender));
        Assertions.assertEquals(tokens("3"), ledger.balanceOf(spender));
        assertRejected(Rejection.INVALID_TRANSFER_ADDRESS, () -> ledger.transfer(USER, Address.ZERO, tokens("1")));
        Assertions.assertEquals(18, ledger.decimals());
    }

    private void enableRelayer() {
        TestSigners.approve(ledger, OperationType.SET_BRIDGE_IN_CALLER, RELAYER, BigInteger.ZERO, new byte[0]);
        Assertions.assertEquals(RELAYER, ledger.getBridgeInCaller());
    }

    private static BigInteger tokens(String amount) {
        return TokenUnits.parse(amount);
    }

    private static void assertRejected(Rejection expected, Executable call) {
        LedgerException rejected = Assertions.assertThrows(LedgerException.class, call);
        Assertions.assertEquals(expected, rejected.rejection());
    }
}
