package io.quorumbridge.runtime;

import io.quorumbridge.config.BridgeConfig;
import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.LifecycleState;
import io.quorumbridge.model.OperationType;
import io.quorumbridge.model.Rejection;
import io.quorumbridge.model.TokenUnits;
import io.quorumbridge.observability.EventJournal;
import io.quorumbridge.storage.LedgerStore;
import io.quorumbridge.testing.MutableClock;
import io.quorumbridge.testing.TestSigners;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class BridgeRuntimeTest {
    private static final Address RELAYER = TestSigners.address(5);
    private static final Address ALICE = TestSigners.address(6);

    @Test
    void approvedCallerSettlesAcrossRuntimeRestarts() throws Exception {
        Path root = Files.createTempDirectory("quorumbridge-test-runtime-flow-");
        try {
            MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
            BridgeRuntime first = openRuntime(root, clock);
            first.deploy(DeploymentConfig.burnAndMint("away", 137L, TestSigners.signers(), TestSigners.administrator()));
            Assertions.assertEquals(List.of("away"), first.deployments());

            approve(first, "away", OperationType.SET_BRIDGE_IN_CALLER, RELAYER);

            BridgeRuntime second = openRuntime(root, clock);
            Assertions.assertEquals(RELAYER, second.status("away").bridgeInCaller());
            second.bridgeIn("away", RELAYER, ALICE, TokenUnits.parse("40"), 137L, Bytes32.keccakOf("t1"), 1L);
            clock.advanceSeconds(60);

            BridgeRuntime third = openRuntime(root, clock);
            Assertions.assertEquals(TokenUnits.parse("40"), third.balance("away", ALICE).balance());
            Assertions.assertTrue(third.isTransferProcessed("away", Bytes32.keccakOf("t1")));
            third.bridgeOut("away", ALICE, TokenUnits.parse("15"), ALICE, 137L, 1L);

            BridgeRuntime.StatusView status = third.status("away");
            Assertions.assertEquals(TokenUnits.parse("25"), status.totalSupply());
            Assertions.assertEquals(1, status.replaySize());
            Assertions.assertEquals(1, status.operationCount());
            Assertions.assertEquals(LifecycleState.ACTIVE, status.lifecycle());

            List<LedgerStore.EventRow> outbound = third.events("away", "BridgedOut", 10);
            Assertions.assertEquals(1, outbound.size());
            Assertions.assertEquals(ALICE.value(), outbound.get(0).fields().get("targetAddress"));

            EventJournal.IntegrityOutcome journal = third.verifyJournal();
            Assertions.assertTrue(journal.ok());
            Assertions.assertEquals(third.events("away", null, 1000).size(), journal.totalRows());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectedCallLeavesStoreAndJournalUntouched() throws Exception {
        Path root = Files.createTempDirectory("quorumbridge-test-runtime-reject-");
        try {
            MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
            BridgeRuntime runtime = openRuntime(root, clock);
            runtime.deploy(DeploymentConfig.lockAndRelease("home", 1L, TestSigners.signers(), TestSigners.administrator()));
            runtime.seedOriginBalance("home", ALICE, TokenUnits.parse("100"));
            long version = runtime.status("home").version();
            int journalRows = runtime.verifyJournal().totalRows();

            LedgerException rejected = Assertions.assertThrows(LedgerException.class,
                    () -> runtime.bridgeOut("home", ALICE, TokenUnits.parse("10"), ALICE, 1L, 137L));
            Assertions.assertEquals(Rejection.INSUFFICIENT_ALLOWANCE, rejected.rejection());

            Assertions.assertEquals(version, runtime.status("home").version());
            Assertions.assertEquals(journalRows, runtime.verifyJournal().totalRows());
            Assertions.assertEquals(TokenUnits.parse("100"), runtime.balance("home", ALICE).balance());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void vaultLocksAndRelinquishesThroughRuntime() throws Exception {
        Path root = Files.createTempDirectory("quorumbridge-test-runtime-vault-");
        try {
            MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
            BridgeRuntime runtime = openRuntime(root, clock);
            BridgeRuntime.DeployOutcome deployed = runtime.deploy(
                    DeploymentConfig.lockAndRelease("home", 1L, TestSigners.signers(), TestSigners.administrator()));
            runtime.seedOriginBalance("home", ALICE, TokenUnits.parse("100"));
            runtime.approve("home", ALICE, deployed.ledgerAddress(), TokenUnits.parse("100"));
            runtime.bridgeOut("home", ALICE, TokenUnits.parse("60"), ALICE, 1L, 137L);
            Assertions.assertEquals(TokenUnits.parse("60"), runtime.status("home").vaultBalance());

            approve(runtime, "home", OperationType.RELINQUISH_TOKENS, Address.ZERO);

            BridgeRuntime.StatusView status = runtime.status("home");
            Assertions.assertEquals(LifecycleState.HALTED, status.lifecycle());
            Assertions.assertEquals(BigInteger.ZERO, status.vaultBalance());
            Assertions.assertEquals(TokenUnits.parse("60"), runtime.balance("home", deployed.originToken()).balance());
            Assertions.assertEquals(1, runtime.events("home", "VaultHalted", 10).size());

            LedgerException halted = Assertions.assertThrows(LedgerException.class,
                    () -> runtime.requestOperation("home", TestSigners.address(0), 1, Address.ZERO, BigInteger.ZERO, new byte[0]));
            Assertions.assertEquals(Rejection.HALTED, halted.rejection());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void operationViewReportsExpiry() throws Exception {
        Path root = Files.createTempDirectory("quorumbridge-test-runtime-expiry-");
        try {
            MutableClock clock = MutableClock.startingAt("2026-03-01T00:00:00Z");
            BridgeRuntime runtime = openRuntime(root, clock);
            runtime.deploy(DeploymentConfig.burnAndMint("away", 137L, TestSigners.signers(), TestSigners.administrator()));
            BridgeRuntime.RequestOutcome requested = runtime.requestOperation(
                    "away", TestSigners.administrator(), OperationType.PAUSE, Address.ZERO, BigInteger.ZERO, new byte[0]);
            Assertions.assertEquals(0, requested.typeCode());
            Assertions.assertEquals(requested.digest(), runtime.operationHash("away", requested.operationId()));
            Assertions.assertFalse(runtime.operation("away", requested.operationId()).expired());

            clock.advanceSeconds(3 * 24 * 3600 + 1);
            Assertions.assertTrue(runtime.operation("away", requested.operationId()).expired());
            LedgerException late = Assertions.assertThrows(LedgerException.class, () -> runtime.submitSignature(
                    "away", TestSigners.address(0), requested.operationId(),
                    TestSigners.sign(0, requested.digest())));
            Assertions.assertEquals(Rejection.DEADLINE_PASSED, late.rejection());

            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.status("missing"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.deploy(
                    DeploymentConfig.burnAndMint("away", 137L, TestSigners.signers(), TestSigners.administrator())));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void approve(BridgeRuntime runtime, String deployment, OperationType type, Address target) {
        BridgeRuntime.RequestOutcome requested = runtime.requestOperation(
                deployment, TestSigners.address(0), type, target, BigInteger.ZERO, new byte[0]);
        BridgeRuntime.SignatureOutcome last = null;
        for (int signer = 0; signer < 3; signer++) {
            last = runtime.submitSignature(deployment, TestSigners.address(signer), requested.operationId(),
                    TestSigners.sign(signer, requested.digest()));
        }
        Assertions.assertTrue(last.executedNow());
        Assertions.assertEquals(3, last.signatureCount());
    }

    private static BridgeRuntime openRuntime(Path root, MutableClock clock) {
        BridgeRuntime runtime = new BridgeRuntime(BridgeConfig.fromRoot(root.toString()), clock);
        runtime.init();
        return runtime;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
