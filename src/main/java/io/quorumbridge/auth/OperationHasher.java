package io.quorumbridge.auth;

import io.quorumbridge.model.AbiWords;
import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import org.web3j.crypto.Hash;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Packed keccak-256 encodings for operation ids and signing digests. Both include the chain tag, so
 * the same request on two ledgers never yields the same digest.
 */
public final class OperationHasher {
    private OperationHasher() {
    }

    public static Bytes32 operationId(
            long sequence,
            int typeCode,
            Address target,
            BigInteger value,
            byte[] payload,
            long chainId
    ) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(AbiWords.uint256(sequence));
        writeBody(out, typeCode, target, value, payload, chainId);
        return Bytes32.wrap(Hash.sha3(out.toByteArray()));
    }

    public static Bytes32 digest(
            Bytes32 operationId,
            int typeCode,
            Address target,
            BigInteger value,
            byte[] payload,
            long chainId
    ) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(operationId.bytes());
        writeBody(out, typeCode, target, value, payload, chainId);
        return Bytes32.wrap(Hash.sha3(out.toByteArray()));
    }

    private static void writeBody(
            ByteArrayOutputStream out,
            int typeCode,
            Address target,
            BigInteger value,
            byte[] payload,
            long chainId
    ) {
        if (typeCode < 0 || typeCode > 255) {
            throw new IllegalArgumentException("Operation type code must fit in uint8: " + typeCode);
        }
        out.write(typeCode);
        out.writeBytes(target.bytes());
        out.writeBytes(AbiWords.uint256(value));
        out.writeBytes(payload == null ? new byte[0] : payload);
        out.writeBytes(AbiWords.uint256(chainId));
    }
}
