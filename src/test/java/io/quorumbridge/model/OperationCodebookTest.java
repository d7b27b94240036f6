package io.quorumbridge.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class OperationCodebookTest {
    @Test
    void variantsNumberTheirOperationsDifferently() {
        OperationCodebook burnMint = OperationCodebook.burnAndMint();
        OperationCodebook vault = OperationCodebook.lockAndRelease();

        Assertions.assertEquals(OperationType.SET_BRIDGE_IN_ENABLED, burnMint.resolve(5).orElseThrow());
        Assertions.assertEquals(OperationType.RELINQUISH_TOKENS, vault.resolve(5).orElseThrow());
        Assertions.assertEquals(7, vault.codeOf(OperationType.SET_BRIDGE_IN_ENABLED));
        Assertions.assertEquals(OperationType.SET_BRIDGE_OUT_AMOUNT, burnMint.resolve(7).orElseThrow());
        Assertions.assertEquals(8, vault.codeOf(OperationType.SET_BRIDGE_OUT_AMOUNT));
        Assertions.assertTrue(burnMint.resolve(8).isEmpty());
        Assertions.assertFalse(burnMint.supports(OperationType.RELINQUISH_TOKENS));
        Assertions.assertThrows(IllegalArgumentException.class, () -> burnMint.codeOf(OperationType.RELINQUISH_TOKENS));
    }

    @Test
    void outboundVaultTableCoversOnlyTheOutboundSide() {
        OperationCodebook outbound = OperationCodebook.outboundVault();

        Assertions.assertEquals(OperationType.SET_BRIDGE_OUT_AMOUNT, outbound.resolve(0).orElseThrow());
        Assertions.assertEquals(OperationType.UPDATE_SIGNER, outbound.resolve(1).orElseThrow());
        Assertions.assertEquals(OperationType.SET_BRIDGE_OUT_ENABLED, outbound.resolve(2).orElseThrow());
        Assertions.assertEquals(OperationType.RELINQUISH_TOKENS, outbound.resolve(3).orElseThrow());
        Assertions.assertFalse(outbound.supports(OperationType.PAUSE));
        Assertions.assertEquals(outbound.asMap(),
                OperationCodebook.of(outbound.asMap(), LedgerVariant.LOCK_AND_RELEASE).asMap());
    }

    @Test
    void customCodebookIsValidated() {
        OperationCodebook custom = OperationCodebook.of(
                Map.of(10, OperationType.PAUSE, 11, OperationType.UNPAUSE), LedgerVariant.BURN_AND_MINT);
        Assertions.assertEquals(OperationType.UNPAUSE, custom.resolve(11).orElseThrow());

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> OperationCodebook.of(Map.of(), LedgerVariant.BURN_AND_MINT));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> OperationCodebook.of(Map.of(256, OperationType.PAUSE), LedgerVariant.BURN_AND_MINT));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> OperationCodebook.of(Map.of(1, OperationType.PAUSE, 2, OperationType.PAUSE),
                        LedgerVariant.LOCK_AND_RELEASE));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> OperationCodebook.of(Map.of(0, OperationType.RELINQUISH_TOKENS), LedgerVariant.BURN_AND_MINT));
    }
}
