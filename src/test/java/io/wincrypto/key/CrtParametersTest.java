package io.wincrypto.key;

import io.wincrypto.exception.KeyBlobException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.security.interfaces.RSAPrivateCrtKey;

import static io.wincrypto.TestKeys.TOY_D;
import static io.wincrypto.TestKeys.TOY_P;
import static io.wincrypto.TestKeys.TOY_Q;
import static io.wincrypto.TestKeys.rsaKeyPair;
import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_KEY_MATERIAL;
import static java.math.BigInteger.ONE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CrtParametersTest {

    @Test
    void deriveToyKey() throws KeyBlobException {
        var crt = CrtParameters.derive(TOY_D, TOY_P, TOY_Q);

        assertEquals(BigInteger.valueOf(53), crt.getExponent1());
        assertEquals(BigInteger.valueOf(49), crt.getExponent2());
        assertEquals(BigInteger.valueOf(38), crt.getCoefficient());
    }

    @Test
    void deriveMatchesGeneratedKey() throws KeyBlobException {
        var key = (RSAPrivateCrtKey) rsaKeyPair(1024).getPrivate();

        var crt = CrtParameters.derive(key.getPrivateExponent(), key.getPrimeP(), key.getPrimeQ());

        assertEquals(key.getPrimeExponentP(), crt.getExponent1());
        assertEquals(key.getPrimeExponentQ(), crt.getExponent2());
        assertEquals(key.getCrtCoefficient(), crt.getCoefficient());
        assertEquals(ONE, key.getPrimeQ().multiply(crt.getCoefficient()).mod(key.getPrimeP()));
    }

    @Test
    void primesNotCoprime() {
        var e = assertThrows(
                KeyBlobException.class,
                () -> CrtParameters.derive(BigInteger.valueOf(7), BigInteger.valueOf(6), BigInteger.valueOf(9))
        );

        assertEquals(INVALID_KEY_MATERIAL, e.getType());
    }

    @Test
    void primeOfOne() {
        var e = assertThrows(KeyBlobException.class, () -> CrtParameters.derive(TOY_D, ONE, TOY_Q));

        assertEquals(INVALID_KEY_MATERIAL, e.getType());
    }
}
