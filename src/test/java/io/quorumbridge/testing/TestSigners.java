package io.quorumbridge.testing;

import io.quorumbridge.auth.OperationSigner;
import io.quorumbridge.ledger.BridgeLedger;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.OperationType;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic secp256k1 identities (the well-known local development keys) and a helper that drives an
 * operation through request and three signatures.
 */
public final class TestSigners {
    public static final List<String> PRIVATE_KEYS = List.of(
            "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80",
            "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d",
            "0x5de4111afa1a4b94908f83103eb1f1706367c2e68ca870fc3fb9a804cdab365a",
            "0x7c852118294e51e653712a81e05800f419141751be58f605c371e15141b007a6",
            "0x47e179ec197488593b187f80a00eb0da91f1b9d0b13f8733639f19c30a34926a",
            "0x8b3a350cf5c34c9194ca85829a2df0ec3153be0318b5e2d3348e872092edffba",
            "0x92db14e403b83dfe3df233f83dfa3a0d7096f21ca9b0d6d6b8d88b2b4ec1564e"
    );

    private static final List<ECKeyPair> KEYS = new ArrayList<>();

    static {
        for (String key : PRIVATE_KEYS) {
            KEYS.add(OperationSigner.keyPair(key));
        }
    }

    private TestSigners() {
    }

    public static ECKeyPair key(int index) {
        return KEYS.get(index);
    }

    public static Address address(int index) {
        return OperationSigner.addressOf(KEYS.get(index));
    }

    /**
     * Addresses of keys 0..3, the default signer set.
     */
    public static List<Address> signers() {
        return List.of(address(0), address(1), address(2), address(3));
    }

    /**
     * Key 4 doubles as the administrator.
     */
    public static Address administrator() {
        return address(4);
    }

    public static byte[] sign(int index, Bytes32 digest) {
        return OperationSigner.sign(KEYS.get(index), digest);
    }

    public static Bytes32 approve(BridgeLedger ledger, OperationType type, Address target, BigInteger value, byte[] payload) {
        return approve(ledger, 0, new int[]{0, 1, 2}, type, target, value, payload);
    }

    public static Bytes32 approve(
            BridgeLedger ledger,
            int requester,
            int[] approvers,
            OperationType type,
            Address target,
            BigInteger value,
            byte[] payload
    ) {
        Bytes32 id = ledger.requestOperation(address(requester), type, target, value, payload);
        Bytes32 digest = ledger.getOperationHash(id);
        for (int approver : approvers) {
            ledger.submitSignature(address(approver), id, sign(approver, digest));
        }
        return id;
    }
}
