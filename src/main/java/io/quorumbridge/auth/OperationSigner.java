package io.quorumbridge.auth;

import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Off-ledger half of approval: a signer signs the operation digest with the personal-message prefix and
 * submits the 65-byte result.
 */
public final class OperationSigner {
    private OperationSigner() {
    }

    public static ECKeyPair keyPair(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            throw new IllegalArgumentException("Private key is required");
        }
        BigInteger key = Numeric.toBigInt(privateKeyHex.trim());
        if (key.signum() <= 0) {
            throw new IllegalArgumentException("Private key must be positive");
        }
        return ECKeyPair.create(key);
    }

    public static Address addressOf(ECKeyPair keyPair) {
        return Address.of(Keys.getAddress(keyPair));
    }

    public static byte[] sign(ECKeyPair keyPair, Bytes32 digest) {
        Sign.SignatureData data = Sign.signPrefixedMessage(digest.bytes(), keyPair);
        byte[] out = new byte[SignatureVerifier.SIGNATURE_LENGTH];
        System.arraycopy(data.getR(), 0, out, 0, 32);
        System.arraycopy(data.getS(), 0, out, 32, 32);
        out[64] = data.getV()[0];
        return out;
    }

    public static byte[] sign(String privateKeyHex, Bytes32 digest) {
        return sign(keyPair(privateKeyHex), digest);
    }
}
