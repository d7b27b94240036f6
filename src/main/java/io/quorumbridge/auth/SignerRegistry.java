package io.quorumbridge.auth;

import io.quorumbridge.model.Address;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.Rejection;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fixed set of four approvers plus an administrator who may request operations but only co-signs
 * signer replacement.
 */
public final class SignerRegistry {
    public static final int SIGNER_COUNT = 4;

    private final Address[] signers = new Address[SIGNER_COUNT];
    private final Address administrator;

    public SignerRegistry(List<Address> signers, Address administrator) {
        Objects.requireNonNull(signers, "signers");
        if (signers.size() != SIGNER_COUNT) {
            throw new IllegalArgumentException("Exactly " + SIGNER_COUNT + " signers are required, got " + signers.size());
        }
        if (administrator == null || administrator.isZero()) {
            throw new IllegalArgumentException("Invalid administrator address");
        }
        for (int i = 0; i < SIGNER_COUNT; i++) {
            Address signer = signers.get(i);
            if (signer == null || signer.isZero()) {
                throw new IllegalArgumentException("Invalid signer address at slot " + i);
            }
            for (int j = 0; j < i; j++) {
                if (this.signers[j].equals(signer)) {
                    throw new IllegalArgumentException("Duplicate signer: " + signer);
                }
            }
            this.signers[i] = signer;
        }
        this.administrator = administrator;
    }

    public boolean isSigner(Address identity) {
        if (identity == null) {
            return false;
        }
        for (Address signer : signers) {
            if (signer.equals(identity)) {
                return true;
            }
        }
        return false;
    }

    public boolean isAdministrator(Address identity) {
        return administrator.equals(identity);
    }

    public Address administrator() {
        return administrator;
    }

    public List<Address> signers() {
        return List.of(Arrays.copyOf(signers, SIGNER_COUNT));
    }

    /**
     * Swaps {@code oldSigner} for {@code newSigner} in the same slot.
     */
    public void replace(Address oldSigner, Address newSigner) {
        int slot = -1;
        for (int i = 0; i < SIGNER_COUNT; i++) {
            if (signers[i].equals(oldSigner)) {
                slot = i;
                break;
            }
        }
        LedgerException.require(slot >= 0, Rejection.INVALID_OLD_SIGNER);
        LedgerException.require(newSigner != null && !newSigner.isZero() && !isSigner(newSigner),
                Rejection.INVALID_NEW_SIGNER);
        signers[slot] = newSigner;
    }

    void restore(List<Address> slots) {
        if (slots.size() != SIGNER_COUNT) {
            throw new IllegalArgumentException("Signer snapshot must hold " + SIGNER_COUNT + " slots");
        }
        for (int i = 0; i < SIGNER_COUNT; i++) {
            signers[i] = slots.get(i);
        }
    }
}
