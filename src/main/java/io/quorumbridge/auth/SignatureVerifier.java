package io.quorumbridge.auth;

import io.quorumbridge.model.Address;
import io.quorumbridge.model.Bytes32;
import io.quorumbridge.model.LedgerException;
import io.quorumbridge.model.Rejection;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Recovers the signer of an EIP-191 personal-message signature over a 32-byte digest.
 */
public final class SignatureVerifier {
    public static final int SIGNATURE_LENGTH = 65;
    private static final BigInteger HALF_CURVE_ORDER = Sign.CURVE_PARAMS.getN().shiftRight(1);

    private SignatureVerifier() {
    }

    public static Address recover(Bytes32 digest, byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new LedgerException(Rejection.INVALID_SIGNATURE);
        }
        int v = signature[64] & 0xff;
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new LedgerException(Rejection.INVALID_SIGNATURE);
        }
        byte[] r = Arrays.copyOfRange(signature, 0, 32);
        byte[] s = Arrays.copyOfRange(signature, 32, 64);
        // upper-half s values are the malleable twin of a valid signature
        BigInteger sValue = new BigInteger(1, s);
        if (new BigInteger(1, r).signum() == 0 || sValue.signum() == 0 || sValue.compareTo(HALF_CURVE_ORDER) > 0) {
            throw new LedgerException(Rejection.INVALID_SIGNATURE);
        }
        Sign.SignatureData data = new Sign.SignatureData((byte) v, r, s);
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest.bytes(), data);
            return Address.of(Keys.getAddress(publicKey));
        } catch (SignatureException | RuntimeException e) {
            throw new LedgerException(Rejection.INVALID_SIGNATURE);
        }
    }
}
