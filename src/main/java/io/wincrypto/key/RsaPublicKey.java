package io.wincrypto.key;

import io.wincrypto.exception.KeyBlobException;
import io.wincrypto.utils.IntegerCodec;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.math.BigInteger;

import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_KEY_MATERIAL;

/**
 * RSA public key as the blob encoder consumes it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RsaPublicKey {

    BigInteger modulus;
    BigInteger publicExponent;

    public static RsaPublicKey of(@NonNull BigInteger modulus, @NonNull BigInteger publicExponent) throws KeyBlobException {
        if (modulus.signum() <= 0) {
            throw new KeyBlobException(INVALID_KEY_MATERIAL, "RSA modulus must be positive");
        }
        if (publicExponent.signum() <= 0) {
            throw new KeyBlobException(INVALID_KEY_MATERIAL, "RSA public exponent must be positive");
        }

        return new RsaPublicKey(modulus, publicExponent);
    }

    public static RsaPublicKey from(@NonNull java.security.interfaces.RSAPublicKey key) throws KeyBlobException {
        return of(key.getModulus(), key.getPublicExponent());
    }

    /**
     * Size of the modulus in bytes. Every integer field width of a blob is derived from it.
     */
    public int getSize() {
        return IntegerCodec.byteLength(modulus);
    }
}
