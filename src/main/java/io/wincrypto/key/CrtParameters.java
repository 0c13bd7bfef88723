package io.wincrypto.key;

import io.wincrypto.exception.KeyBlobException;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.math.BigInteger;

import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_KEY_MATERIAL;
import static java.math.BigInteger.ONE;

/**
 * Chinese Remainder Theorem values of an RSA private key.
 * <ul>
 *     <li>exponent1 = d mod (p - 1)</li>
 *     <li>exponent2 = d mod (q - 1)</li>
 *     <li>coefficient = q<sup>-1</sup> mod p</li>
 * </ul>
 */
@Value
@ToString(of = {})
public class CrtParameters {

    BigInteger exponent1;
    BigInteger exponent2;
    BigInteger coefficient;

    public static CrtParameters derive(
            @NonNull BigInteger privateExponent,
            @NonNull BigInteger prime1,
            @NonNull BigInteger prime2
    ) throws KeyBlobException {
        // p - 1 and q - 1 are used as moduli and must stay positive
        if (prime1.compareTo(ONE) <= 0 || prime2.compareTo(ONE) <= 0) {
            throw new KeyBlobException(INVALID_KEY_MATERIAL, "RSA primes must be greater than one");
        }

        var exponent1 = privateExponent.mod(prime1.subtract(ONE));
        var exponent2 = privateExponent.mod(prime2.subtract(ONE));
        try {
            var coefficient = prime2.modInverse(prime1);

            return new CrtParameters(exponent1, exponent2, coefficient);
        } catch (ArithmeticException e) {
            throw new KeyBlobException(INVALID_KEY_MATERIAL, "Prime q has no inverse modulo p", e);
        }
    }
}
