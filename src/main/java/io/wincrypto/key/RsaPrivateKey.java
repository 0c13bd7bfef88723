package io.wincrypto.key;

import io.wincrypto.exception.KeyBlobException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.math.BigInteger;
import java.security.interfaces.RSAPrivateCrtKey;

import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_KEY_MATERIAL;

/**
 * RSA private key as the blob encoder consumes it. CRT values are not kept
 * here, they are derived from D, P and Q on export.
 */
@Value
@ToString(onlyExplicitlyIncluded = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RsaPrivateKey {

    @ToString.Include
    RsaPublicKey publicKey;
    BigInteger privateExponent;
    BigInteger prime1;
    BigInteger prime2;

    public static RsaPrivateKey of(
            @NonNull BigInteger modulus,
            @NonNull BigInteger publicExponent,
            @NonNull BigInteger privateExponent,
            @NonNull BigInteger prime1,
            @NonNull BigInteger prime2
    ) throws KeyBlobException {
        var publicKey = RsaPublicKey.of(modulus, publicExponent);
        if (privateExponent.signum() <= 0) {
            throw new KeyBlobException(INVALID_KEY_MATERIAL, "RSA private exponent must be positive");
        }
        if (prime1.signum() <= 0 || prime2.signum() <= 0) {
            throw new KeyBlobException(INVALID_KEY_MATERIAL, "RSA primes must be positive");
        }

        return new RsaPrivateKey(publicKey, privateExponent, prime1, prime2);
    }

    public static RsaPrivateKey from(@NonNull RSAPrivateCrtKey key) throws KeyBlobException {
        return of(key.getModulus(), key.getPublicExponent(), key.getPrivateExponent(), key.getPrimeP(), key.getPrimeQ());
    }

    public BigInteger getModulus() {
        return publicKey.getModulus();
    }

    public BigInteger getPublicExponent() {
        return publicKey.getPublicExponent();
    }

    public int getSize() {
        return publicKey.getSize();
    }

    public CrtParameters crtParameters() throws KeyBlobException {
        return CrtParameters.derive(privateExponent, prime1, prime2);
    }
}
