package io.quorumbridge.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerVariant;
import io.quorumbridge.model.OperationCodebook;
import io.quorumbridge.model.OperationType;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parameters fixed when a ledger is deployed. Absent optional values take the {@link BridgeConfig}
 * defaults; ledger and origin token addresses default to values derived from the name and chain tag.
 */
public record DeploymentConfig(
        String name,
        LedgerVariant variant,
        long chainId,
        Address ledgerAddress,
        Address originToken,
        String tokenName,
        String tokenSymbol,
        List<Address> signers,
        Address administrator,
        BigInteger maxBridgeInAmount,
        Long bridgeInCooldownSeconds,
        Integer replayCapacity,
        Boolean pauseBlocksBridgeIn,
        Map<Integer, OperationType> operationCodes
) {
    public DeploymentConfig {
        if (variant == null) {
            throw new IllegalArgumentException("Ledger variant is required");
        }
        if (chainId <= 0) {
            throw new IllegalArgumentException("Chain tag must be positive");
        }
        name = BridgeConfig.sanitizeName(name, variant.label() + "-" + chainId);
        if (signers == null) {
            throw new IllegalArgumentException("Signers are required");
        }
        signers = List.copyOf(signers);
        if (administrator == null) {
            throw new IllegalArgumentException("Administrator is required");
        }
        if (ledgerAddress == null) {
            ledgerAddress = derivedAddress("ledger:" + name + ":" + chainId);
        }
        if (ledgerAddress.isZero()) {
            throw new IllegalArgumentException("Invalid ledger address");
        }
        if (variant == LedgerVariant.LOCK_AND_RELEASE) {
            if (originToken == null) {
                originToken = derivedAddress("origin:" + name + ":" + chainId);
            }
            if (originToken.isZero()) {
                throw new IllegalArgumentException("Invalid token address");
            }
            if (tokenName == null || tokenName.isBlank()) {
                tokenName = BridgeConfig.DEFAULT_ORIGIN_TOKEN_NAME;
            }
            if (tokenSymbol == null || tokenSymbol.isBlank()) {
                tokenSymbol = BridgeConfig.DEFAULT_ORIGIN_TOKEN_SYMBOL;
            }
        } else {
            originToken = null;
            if (tokenName == null || tokenName.isBlank()) {
                tokenName = BridgeConfig.DEFAULT_TOKEN_NAME;
            }
            if (tokenSymbol == null || tokenSymbol.isBlank()) {
                tokenSymbol = BridgeConfig.DEFAULT_TOKEN_SYMBOL;
            }
        }
        if (maxBridgeInAmount == null) {
            maxBridgeInAmount = BridgeConfig.DEFAULT_MAX_BRIDGE_IN_AMOUNT;
        }
        if (maxBridgeInAmount.signum() <= 0) {
            throw new IllegalArgumentException("Bridge-in limit must be positive");
        }
        if (bridgeInCooldownSeconds == null) {
            bridgeInCooldownSeconds = BridgeConfig.DEFAULT_BRIDGE_IN_COOLDOWN_SECONDS;
        }
        if (bridgeInCooldownSeconds < 0) {
            throw new IllegalArgumentException("Bridge-in cooldown must not be negative");
        }
        if (replayCapacity == null) {
            replayCapacity = BridgeConfig.DEFAULT_REPLAY_CAPACITY;
        }
        if (replayCapacity < 1 || replayCapacity > BridgeConfig.MAX_REPLAY_CAPACITY) {
            throw new IllegalArgumentException(
                    "Replay capacity must be between 1 and " + BridgeConfig.MAX_REPLAY_CAPACITY);
        }
        if (pauseBlocksBridgeIn == null) {
            pauseBlocksBridgeIn = variant == LedgerVariant.BURN_AND_MINT;
        }
        operationCodes = operationCodes == null
                ? OperationCodebook.defaultFor(variant).asMap()
                : OperationCodebook.of(operationCodes, variant).asMap();
    }

    public static DeploymentConfig burnAndMint(String name, long chainId, List<Address> signers, Address administrator) {
        return new DeploymentConfig(name, LedgerVariant.BURN_AND_MINT, chainId, null, null, null, null,
                signers, administrator, null, null, null, null, null);
    }

    public static DeploymentConfig lockAndRelease(String name, long chainId, List<Address> signers, Address administrator) {
        return new DeploymentConfig(name, LedgerVariant.LOCK_AND_RELEASE, chainId, null, null, null, null,
                signers, administrator, null, null, null, null, null);
    }

    public DeploymentConfig withLimits(BigInteger maxAmount, long cooldownSeconds) {
        return new DeploymentConfig(name, variant, chainId, ledgerAddress, originToken, tokenName, tokenSymbol,
                signers, administrator, maxAmount, cooldownSeconds, replayCapacity, pauseBlocksBridgeIn, operationCodes);
    }

    public DeploymentConfig withReplayCapacity(int capacity) {
        return new DeploymentConfig(name, variant, chainId, ledgerAddress, originToken, tokenName, tokenSymbol,
                signers, administrator, maxBridgeInAmount, bridgeInCooldownSeconds, capacity, pauseBlocksBridgeIn,
                operationCodes);
    }

    public DeploymentConfig withPauseBlocksBridgeIn(boolean blocks) {
        return new DeploymentConfig(name, variant, chainId, ledgerAddress, originToken, tokenName, tokenSymbol,
                signers, administrator, maxBridgeInAmount, bridgeInCooldownSeconds, replayCapacity, blocks,
                operationCodes);
    }

    public DeploymentConfig withOperationCodes(Map<Integer, OperationType> codes) {
        return new DeploymentConfig(name, variant, chainId, ledgerAddress, originToken, tokenName, tokenSymbol,
                signers, administrator, maxBridgeInAmount, bridgeInCooldownSeconds, replayCapacity,
                pauseBlocksBridgeIn, codes);
    }

    public DeploymentConfig withLedgerAddress(Address address) {
        return new DeploymentConfig(name, variant, chainId, address, originToken, tokenName, tokenSymbol,
                signers, administrator, maxBridgeInAmount, bridgeInCooldownSeconds, replayCapacity,
                pauseBlocksBridgeIn, operationCodes);
    }

    @JsonIgnore
    public OperationCodebook codebook() {
        return OperationCodebook.of(new TreeMap<>(operationCodes), variant);
    }

    private static Address derivedAddress(String seed) {
        byte[] hash = Bytes32.keccakOf(seed).bytes();
        return Address.of(Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32)));
    }
}
