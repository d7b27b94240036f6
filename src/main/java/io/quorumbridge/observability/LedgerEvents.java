package io.quorumbridge.observability;

import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.OperationType;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event records raised by the ledgers. Field maps keep declaration order so journal rows read the
 * same way the records do.
 */
public final class LedgerEvents {
    private LedgerEvents() {
    }

    public record OperationRequested(
            Bytes32 operationId,
            long sequence,
            int typeCode,
            OperationType type,
            Address target,
            BigInteger value,
            String data,
            Address requester,
            long deadline,
            long timestamp
    ) implements LedgerEvent {
        @Override
        public String name() {
            return "OperationRequested";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("operationId", operationId.toHex());
            out.put("sequence", sequence);
            out.put("typeCode", typeCode);
            out.put("type", type.name());
            out.put("target", target.value());
            out.put("value", value.toString());
            out.put("data", data);
            out.put("requester", requester.value());
            out.put("deadline", deadline);
            return out;
        }
    }

    public record SignatureSubmitted(Bytes32 operationId, Address signer, int signatureCount, long timestamp)
            implements LedgerEvent {
        @Override
        public String name() {
            return "SignatureSubmitted";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("operationId", operationId.toHex());
            out.put("signer", signer.value());
            out.put("signatureCount", signatureCount);
            return out;
        }
    }

    public record OperationExecuted(Bytes32 operationId, OperationType type, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "OperationExecuted";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("operationId", operationId.toHex());
            out.put("type", type.name());
            return out;
        }
    }

    public record SignerUpdated(Address oldSigner, Address newSigner, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "SignerUpdated";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("oldSigner", oldSigner.value());
            out.put("newSigner", newSigner.value());
            return out;
        }
    }

    public record BridgeInCallerUpdated(Address previousCaller, Address newCaller, long timestamp)
            implements LedgerEvent {
        @Override
        public String name() {
            return "BridgeInCallerUpdated";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("previousCaller", previousCaller.value());
            out.put("newCaller", newCaller.value());
            return out;
        }
    }

    public record BridgeInLimitsUpdated(BigInteger maxBridgeInAmount, long cooldownSeconds, long timestamp)
            implements LedgerEvent {
        @Override
        public String name() {
            return "BridgeInLimitsUpdated";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("maxBridgeInAmount", maxBridgeInAmount.toString());
            out.put("cooldownSeconds", cooldownSeconds);
            return out;
        }
    }

    public record BridgeOutLimitUpdated(BigInteger maxBridgeOutAmount, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "BridgeOutLimitUpdated";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("maxBridgeOutAmount", maxBridgeOutAmount.toString());
            return out;
        }
    }

    public record BridgeDirectionToggled(String direction, boolean enabled, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "in".equals(direction) ? "BridgeInEnabledUpdated" : "BridgeOutEnabledUpdated";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("enabled", enabled);
            return out;
        }
    }

    public record Paused(Address ledger, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "Paused";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("ledger", ledger.value());
            return out;
        }
    }

    public record Unpaused(Address ledger, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "Unpaused";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("ledger", ledger.value());
            return out;
        }
    }

    public record BridgedOut(
            Address from,
            BigInteger amount,
            Address targetAddress,
            long chainId,
            long destinationChainId,
            long timestamp
    ) implements LedgerEvent {
        @Override
        public String name() {
            return "BridgedOut";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("from", from.value());
            out.put("amount", amount.toString());
            out.put("targetAddress", targetAddress.value());
            out.put("chainId", chainId);
            out.put("destinationChainId", destinationChainId);
            return out;
        }
    }

    public record BridgedIn(
            Address to,
            BigInteger amount,
            long chainId,
            Bytes32 txId,
            long sourceChainId,
            long timestamp
    ) implements LedgerEvent {
        @Override
        public String name() {
            return "BridgedIn";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("to", to.value());
            out.put("amount", amount.toString());
            out.put("chainId", chainId);
            out.put("txId", txId.toHex());
            out.put("sourceChainId", sourceChainId);
            return out;
        }
    }

    public record Transfer(Address from, Address to, BigInteger value, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "Transfer";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("from", from.value());
            out.put("to", to.value());
            out.put("value", value.toString());
            return out;
        }
    }

    public record Approval(Address owner, Address spender, BigInteger value, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "Approval";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("owner", owner.value());
            out.put("spender", spender.value());
            out.put("value", value.toString());
            return out;
        }
    }

    public record TokensRelinquished(BigInteger amount, Address destination, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "TokensRelinquished";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("amount", amount.toString());
            out.put("destination", destination.value());
            return out;
        }
    }

    public record VaultHalted(Address ledger, long timestamp) implements LedgerEvent {
        @Override
        public String name() {
            return "VaultHalted";
        }

        @Override
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("ledger", ledger.value());
            return out;
        }
    }
}
