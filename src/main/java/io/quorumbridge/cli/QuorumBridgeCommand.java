package io.quorumbridge.cli;

import io.quorumbridge.auth.OperationSigner;
import io.quorumbridge.config.BridgeConfig;
import io.quorumbridge.config.DeploymentConfig;
import io.quorumbridge.model.AbiWords;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.LedgerVariant;
import io.quorumbridge.model.OperationType;
import io.quorumbridge.model.TokenUnits;
import io.quorumbridge.observability.EventJournal;
import io.quorumbridge.runtime.BridgeRuntime;
import io.quorumbridge.util.Jsons;
import org.web3j.crypto.ECKeyPair;
import org.web3j.utils.Numeric;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "quorum-bridge",
        mixinStandardHelpOptions = true,
        description = "Multi-signature bridge ledger CLI",
        subcommands = {
                QuorumBridgeCommand.InitCommand.class,
                QuorumBridgeCommand.DeployCommand.class,
                QuorumBridgeCommand.DeploymentsCommand.class,
                QuorumBridgeCommand.RequestCommand.class,
                QuorumBridgeCommand.OperationCommand.class,
                QuorumBridgeCommand.OperationsCommand.class,
                QuorumBridgeCommand.OperationHashCommand.class,
                QuorumBridgeCommand.SignCommand.class,
                QuorumBridgeCommand.SubmitSignatureCommand.class,
                QuorumBridgeCommand.BridgeOutCommand.class,
                QuorumBridgeCommand.BridgeInCommand.class,
                QuorumBridgeCommand.TransferCommand.class,
                QuorumBridgeCommand.ApproveCommand.class,
                QuorumBridgeCommand.SeedBalanceCommand.class,
                QuorumBridgeCommand.BalanceCommand.class,
                QuorumBridgeCommand.StatusCommand.class,
                QuorumBridgeCommand.EventsCommand.class,
                QuorumBridgeCommand.JournalVerifyCommand.class
        }
)
public final class QuorumBridgeCommand implements Runnable {
    static final int EXIT_REJECTED = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (isolated set of deployments)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | deploy | deployments | request | operation | operations | operation-hash | sign | submit-signature | bridge-out | bridge-in | transfer | approve | seed-balance | balance | status | events | journal-verify");
    }

    /**
     * Command line with the rejection handler installed: a refused ledger call prints a JSON rejection and
     * exits with {@value #EXIT_REJECTED}.
     */
    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new QuorumBridgeCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof LedgerException) {
                LedgerException rejected = (LedgerException) ex;
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("rejected", rejected.rejection().name());
                out.put("category", rejected.rejection().category().name());
                out.put("reason", rejected.rejection().reason());
                System.out.println(Jsons.toJson(out));
                return EXIT_REJECTED;
            }
            if (ex instanceof IllegalArgumentException) {
                System.err.println("Error: " + ex.getMessage());
                return 1;
            }
            throw ex;
        });
        return cli;
    }

    BridgeRuntime runtime() {
        BridgeRuntime runtime = new BridgeRuntime(BridgeConfig.fromRoot(root, namespace));
        runtime.init();
        return runtime;
    }

    static BigInteger amount(String raw, boolean baseUnits) {
        if (baseUnits) {
            try {
                return new BigInteger(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid amount: " + raw, e);
            }
        }
        return TokenUnits.parse(raw);
    }

    /**
     * 0x-prefixed 64-hex values are taken as-is; anything else is hashed, so relayers can pass a readable
     * label.
     */
    static Bytes32 transferId(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("0x") && trimmed.length() == 66) {
            return Bytes32.fromHex(trimmed);
        }
        return Bytes32.keccakOf(trimmed);
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and journal key")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Override
        public Integer call() {
            BridgeRuntime runtime = parent.runtime();
            System.out.println("Initialized quorum-bridge at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "deploy", description = "Create a deployment from a JSON file or options")
    static final class DeployCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--file"}, description = "Deployment JSON file; options below are ignored when set")
        String file;

        @Option(names = {"--name"}, description = "Deployment name")
        String name;

        @Option(names = {"--variant"}, defaultValue = "burn-mint", description = "burn-mint | lock-release")
        String variant;

        @Option(names = {"--chain-id"}, description = "Chain tag of this ledger")
        Long chainId;

        @Option(names = {"--signer"}, description = "Signer address (repeat four times)")
        List<String> signers = new ArrayList<>();

        @Option(names = {"--admin"}, description = "Administrator address")
        String admin;

        @Option(names = {"--ledger-address"}, description = "Ledger address; derived from name and chain when absent")
        String ledgerAddress;

        @Option(names = {"--origin-token"}, description = "Origin token address (lock-release)")
        String originToken;

        @Option(names = {"--max-bridge-in"}, description = "Per-transfer cap in tokens")
        String maxBridgeIn;

        @Option(names = {"--cooldown"}, description = "Bridge-in cooldown in seconds")
        Long cooldown;

        @Option(names = {"--replay-capacity"}, description = "Remembered inbound transfer ids")
        Integer replayCapacity;

        @Option(names = {"--pause-blocks-bridge-in"}, arity = "1", description = "Whether pausing also blocks bridge-in")
        Boolean pauseBlocksBridgeIn;

        @Override
        public Integer call() throws Exception {
            DeploymentConfig deployment;
            if (file != null && !file.isBlank()) {
                deployment = Jsons.mapper().readValue(Path.of(file).toFile(), DeploymentConfig.class);
            } else {
                if (chainId == null || admin == null) {
                    throw new IllegalArgumentException("--chain-id and --admin are required without --file");
                }
                List<Address> signerAddresses = new ArrayList<>();
                for (String signer : signers) {
                    signerAddresses.add(Address.of(signer));
                }
                deployment = new DeploymentConfig(
                        name,
                        LedgerVariant.fromString(variant),
                        chainId,
                        ledgerAddress == null ? null : Address.of(ledgerAddress),
                        originToken == null ? null : Address.of(originToken),
                        null,
                        null,
                        signerAddresses,
                        Address.of(admin),
                        maxBridgeIn == null ? null : TokenUnits.parse(maxBridgeIn),
                        cooldown,
                        replayCapacity,
                        pauseBlocksBridgeIn,
                        null
                );
            }
            BridgeRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.deploy(deployment)));
            return 0;
        }
    }

    @Command(name = "deployments", description = "List deployment names in the namespace")
    static final class DeploymentsCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().deployments()));
            return 0;
        }
    }

    @Command(name = "request", description = "Request a privileged operation")
    static final class RequestCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--caller"}, required = true, description = "Requesting signer or administrator")
        String caller;

        @Option(names = {"--type"}, required = true, description = "Operation type name or numeric code")
        String type;

        @Option(names = {"--target"}, description = "Target address")
        String target;

        @Option(names = {"--value"}, defaultValue = "0", description = "Numeric value in base units")
        String value;

        @Option(names = {"--new-signer"}, description = "Replacement signer; encoded into the value")
        String newSigner;

        @Option(names = {"--max-amount"}, description = "Bridge-in cap in tokens; encoded into the value")
        String maxAmount;

        @Option(names = {"--payload"}, description = "Raw payload hex")
        String payload;

        @Option(names = {"--cooldown"}, description = "Cooldown seconds; encoded as a uint256 payload")
        Long cooldown;

        @Option(names = {"--enabled"}, arity = "1", description = "Flag; encoded as a bool payload")
        Boolean enabled;

        @Override
        public Integer call() {
            BigInteger numeric = amount(value, true);
            if (newSigner != null) {
                numeric = Address.of(newSigner).toWord();
            } else if (maxAmount != null) {
                numeric = TokenUnits.parse(maxAmount);
            }
            byte[] data = new byte[0];
            if (payload != null) {
                data = Numeric.hexStringToByteArray(payload);
            } else if (cooldown != null) {
                data = AbiWords.uint256(cooldown);
            } else if (enabled != null) {
                data = AbiWords.bool(enabled);
            }
            Address targetAddress = target == null ? Address.ZERO : Address.of(target);
            BridgeRuntime runtime = parent.runtime();
            BridgeRuntime.RequestOutcome outcome;
            String trimmed = type.trim();
            if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
                outcome = runtime.requestOperation(
                        deployment, Address.of(caller), Integer.parseInt(trimmed), targetAddress, numeric, data);
            } else {
                outcome = runtime.requestOperation(
                        deployment, Address.of(caller), OperationType.fromString(trimmed), targetAddress, numeric, data);
            }
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "operation", description = "Show an operation")
    static final class OperationCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--id"}, required = true, description = "Operation id")
        String id;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().operation(deployment, Bytes32.fromHex(id))));
            return 0;
        }
    }

    @Command(name = "operations", description = "List all operations of a deployment")
    static final class OperationsCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().operations(deployment)));
            return 0;
        }
    }

    @Command(name = "operation-hash", description = "Digest signers sign for an operation")
    static final class OperationHashCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--id"}, required = true, description = "Operation id")
        String id;

        @Override
        public Integer call() {
            Bytes32 digest = parent.runtime().operationHash(deployment, Bytes32.fromHex(id));
            System.out.println(Jsons.toJson(Map.of("operationId", id, "digest", digest.toHex())));
            return 0;
        }
    }

    @Command(name = "sign", description = "Sign an operation digest with a private key")
    static final class SignCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--key"}, required = true, description = "Signer private key hex")
        String key;

        @Option(names = {"--digest"}, description = "Digest hex; computed from --deployment/--id when absent")
        String digest;

        @Option(names = {"--deployment"}, description = "Deployment name")
        String deployment;

        @Option(names = {"--id"}, description = "Operation id")
        String id;

        @Override
        public Integer call() {
            Bytes32 toSign;
            if (digest != null) {
                toSign = Bytes32.fromHex(digest);
            } else {
                if (deployment == null || id == null) {
                    throw new IllegalArgumentException("Either --digest or --deployment with --id is required");
                }
                toSign = parent.runtime().operationHash(deployment, Bytes32.fromHex(id));
            }
            ECKeyPair keyPair = OperationSigner.keyPair(key);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("signer", OperationSigner.addressOf(keyPair).value());
            out.put("digest", toSign.toHex());
            out.put("signature", Numeric.toHexString(OperationSigner.sign(keyPair, toSign)));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "submit-signature", description = "Submit a signer's approval")
    static final class SubmitSignatureCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--caller"}, required = true, description = "Submitting signer")
        String caller;

        @Option(names = {"--id"}, required = true, description = "Operation id")
        String id;

        @Option(names = {"--signature"}, required = true, description = "65-byte signature hex")
        String signature;

        @Override
        public Integer call() {
            BridgeRuntime.SignatureOutcome outcome = parent.runtime().submitSignature(
                    deployment, Address.of(caller), Bytes32.fromHex(id), Numeric.hexStringToByteArray(signature));
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "bridge-out", description = "Send tokens to another chain")
    static final class BridgeOutCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--caller"}, required = true, description = "Token holder")
        String caller;

        @Option(names = {"--amount"}, required = true, description = "Amount in tokens")
        String amount;

        @Option(names = {"--base-units"}, defaultValue = "false", description = "Treat --amount as base units")
        boolean baseUnits;

        @Option(names = {"--target"}, required = true, description = "Recipient on the destination chain")
        String target;

        @Option(names = {"--chain-id"}, required = true, description = "Chain tag of this ledger")
        long chainId;

        @Option(names = {"--destination-chain-id"}, defaultValue = "0", description = "Destination chain; 0 = unspecified")
        long destinationChainId;

        @Override
        public Integer call() {
            BridgeRuntime.BridgeOutOutcome outcome = parent.runtime().bridgeOut(
                    deployment,
                    Address.of(caller),
                    amount(amount, baseUnits),
                    Address.of(target),
                    chainId,
                    destinationChainId
            );
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "bridge-in", description = "Settle a transfer committed on another chain")
    static final class BridgeInCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--caller"}, required = true, description = "Authorized bridge-in caller")
        String caller;

        @Option(names = {"--recipient"}, required = true, description = "Recipient address")
        String recipient;

        @Option(names = {"--amount"}, required = true, description = "Amount in tokens")
        String amount;

        @Option(names = {"--base-units"}, defaultValue = "false", description = "Treat --amount as base units")
        boolean baseUnits;

        @Option(names = {"--chain-id"}, required = true, description = "Chain tag of this ledger")
        long chainId;

        @Option(names = {"--transfer-id"}, required = true, description = "32-byte hex id, or a label to hash")
        String transferId;

        @Option(names = {"--source-chain-id"}, defaultValue = "0", description = "Source chain; 0 = unspecified")
        long sourceChainId;

        @Override
        public Integer call() {
            BridgeRuntime.BridgeInOutcome outcome = parent.runtime().bridgeIn(
                    deployment,
                    Address.of(caller),
                    Address.of(recipient),
                    amount(amount, baseUnits),
                    chainId,
                    transferId(transferId),
                    sourceChainId
            );
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "transfer", description = "Transfer the deployment's working token")
    static final class TransferCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--caller"}, required = true, description = "Sender")
        String caller;

        @Option(names = {"--to"}, required = true, description = "Recipient")
        String to;

        @Option(names = {"--amount"}, required = true, description = "Amount in tokens")
        String amount;

        @Option(names = {"--base-units"}, defaultValue = "false", description = "Treat --amount as base units")
        boolean baseUnits;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().transfer(
                    deployment, Address.of(caller), Address.of(to), amount(amount, baseUnits))));
            return 0;
        }
    }

    @Command(name = "approve", description = "Set an allowance on the deployment's working token")
    static final class ApproveCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--caller"}, required = true, description = "Token owner")
        String caller;

        @Option(names = {"--spender"}, description = "Spender; defaults to the ledger address")
        String spender;

        @Option(names = {"--amount"}, required = true, description = "Amount in tokens")
        String amount;

        @Option(names = {"--base-units"}, defaultValue = "false", description = "Treat --amount as base units")
        boolean baseUnits;

        @Override
        public Integer call() {
            BridgeRuntime runtime = parent.runtime();
            Address spenderAddress = spender == null
                    ? runtime.status(deployment).ledgerAddress()
                    : Address.of(spender);
            System.out.println(Jsons.toJson(runtime.approve(
                    deployment, Address.of(caller), spenderAddress, amount(amount, baseUnits))));
            return 0;
        }
    }

    @Command(name = "seed-balance", description = "Credit origin tokens to an account (lock-release only)")
    static final class SeedBalanceCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--account"}, required = true, description = "Account to credit")
        String account;

        @Option(names = {"--amount"}, required = true, description = "Amount in tokens")
        String amount;

        @Option(names = {"--base-units"}, defaultValue = "false", description = "Treat --amount as base units")
        boolean baseUnits;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().seedOriginBalance(
                    deployment, Address.of(account), amount(amount, baseUnits))));
            return 0;
        }
    }

    @Command(name = "balance", description = "Working-token balance of an account")
    static final class BalanceCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--account"}, required = true, description = "Account")
        String account;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().balance(deployment, Address.of(account))));
            return 0;
        }
    }

    @Command(name = "status", description = "Show deployment state")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().status(deployment)));
            return 0;
        }
    }

    @Command(name = "events", description = "List stored ledger events, oldest first")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Option(names = {"--deployment"}, required = true, description = "Deployment name")
        String deployment;

        @Option(names = {"--event"}, description = "Optional event name filter")
        String event;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Most recent rows to return")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().events(deployment, event, limit)));
            return 0;
        }
    }

    @Command(name = "journal-verify", description = "Verify the hash chain and signatures of the event journal")
    static final class JournalVerifyCommand implements Callable<Integer> {
        @ParentCommand
        QuorumBridgeCommand parent;

        @Override
        public Integer call() {
            EventJournal.IntegrityOutcome out = parent.runtime().verifyJournal();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }
}
