package io.quorumbridge.model;

/**
 * Every way a ledger call can be refused. The reason strings are stable and meant to be matched by
 * callers.
 */
public enum Rejection {
    NOT_SIGNER_OR_OWNER(Category.AUTHORIZATION, "Only signers or owner can request operations"),
    NOT_SIGNER(Category.AUTHORIZATION, "Only signers can submit signatures"),
    INVALID_SIGNATURE(Category.AUTHORIZATION, "Invalid signature"),
    SIGNATURE_NOT_FROM_CALLER(Category.AUTHORIZATION, "Signature must be from caller"),
    REPLACED_SIGNER_CANNOT_APPROVE(Category.AUTHORIZATION, "Signer being replaced cannot approve"),
    CANNOT_REQUEST_OWN_REMOVAL(Category.AUTHORIZATION, "Cannot request own removal"),
    NOT_BRIDGE_IN_CALLER(Category.AUTHORIZATION, "Not authorized to bridge in"),

    OPERATION_NOT_FOUND(Category.STATE_MACHINE, "Operation does not exist"),
    ALREADY_EXECUTED(Category.STATE_MACHINE, "Operation already executed"),
    DUPLICATE_SIGNATURE(Category.STATE_MACHINE, "Signature already submitted"),
    DEADLINE_PASSED(Category.STATE_MACHINE, "Operation deadline passed"),
    INVALID_OPERATION_TYPE(Category.STATE_MACHINE, "Invalid operation type"),
    UNKNOWN_OPERATION_TYPE(Category.STATE_MACHINE, "Unknown operation type"),
    INVALID_OLD_SIGNER(Category.STATE_MACHINE, "Invalid old signer"),
    INVALID_NEW_SIGNER(Category.STATE_MACHINE, "Invalid new signer"),
    REENTRANT_CALL(Category.STATE_MACHINE, "Reentrant call"),

    INVALID_AMOUNT(Category.LEDGER_POLICY, "Invalid amount"),
    ZERO_BRIDGE_OUT(Category.LEDGER_POLICY, "Cannot bridge out zero tokens"),
    ZERO_BRIDGE_IN(Category.LEDGER_POLICY, "Cannot bridge in zero tokens"),
    INVALID_TARGET(Category.LEDGER_POLICY, "Invalid target address"),
    INVALID_RECIPIENT(Category.LEDGER_POLICY, "Invalid recipient address"),
    AMOUNT_OVER_CAP(Category.LEDGER_POLICY, "Amount exceeds bridge-in limit"),
    AMOUNT_OVER_BRIDGE_OUT_CAP(Category.LEDGER_POLICY, "Amount exceeds bridge-out limit"),
    INVALID_CHAIN(Category.LEDGER_POLICY, "Invalid chain ID"),
    SAME_DESTINATION_CHAIN(Category.LEDGER_POLICY, "Destination chain must differ from source chain"),
    BRIDGE_OUT_DISABLED(Category.LEDGER_POLICY, "Bridge out is disabled"),
    BRIDGE_IN_DISABLED(Category.LEDGER_POLICY, "Bridge in is disabled"),
    COOLDOWN_NOT_MET(Category.LEDGER_POLICY, "Bridge-in cooldown not met"),
    TRANSFER_ALREADY_PROCESSED(Category.LEDGER_POLICY, "Transaction already processed"),
    INSUFFICIENT_BALANCE(Category.LEDGER_POLICY, "Insufficient balance"),
    INSUFFICIENT_ALLOWANCE(Category.LEDGER_POLICY, "Insufficient allowance"),
    INSUFFICIENT_VAULT_BALANCE(Category.LEDGER_POLICY, "Insufficient vault balance"),
    INVALID_TRANSFER_ADDRESS(Category.LEDGER_POLICY, "Invalid transfer address"),
    NOTHING_TO_RELINQUISH(Category.LEDGER_POLICY, "No tokens to relinquish"),
    INVALID_LIMIT(Category.LEDGER_POLICY, "Invalid bridge-in limit"),
    INVALID_BRIDGE_OUT_LIMIT(Category.LEDGER_POLICY, "Invalid bridge-out limit"),
    INVALID_LIMITS_PAYLOAD(Category.LEDGER_POLICY, "Invalid limits payload"),
    INVALID_FLAG_PAYLOAD(Category.LEDGER_POLICY, "Invalid flag payload"),
    INVALID_BRIDGE_IN_CALLER(Category.LEDGER_POLICY, "Invalid bridge-in caller"),

    PAUSED(Category.LIFECYCLE, "Contract is paused"),
    ALREADY_PAUSED(Category.LIFECYCLE, "Already paused"),
    NOT_PAUSED(Category.LIFECYCLE, "Not paused"),
    TRANSFERS_PAUSED(Category.LIFECYCLE, "Token transfers are paused"),
    HALTED(Category.LIFECYCLE, "Contract is halted");

    public enum Category {
        AUTHORIZATION,
        STATE_MACHINE,
        LEDGER_POLICY,
        LIFECYCLE
    }

    private final Category category;
    private final String reason;

    Rejection(Category category, String reason) {
        this.category = category;
        this.reason = reason;
    }

    public Category category() {
        return category;
    }

    public String reason() {
        return reason;
    }
}
