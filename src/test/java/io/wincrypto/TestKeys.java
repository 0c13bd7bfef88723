package io.wincrypto;

import lombok.NoArgsConstructor;
import lombok.SneakyThrows;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;

import java.io.StringWriter;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static lombok.AccessLevel.PRIVATE;

/**
 * Key material for tests.
 */
@NoArgsConstructor(access = PRIVATE)
public final class TestKeys {

    /**
     * Textbook key: p = 61, q = 53, n = 3233, e = 17, d = 2753.
     */
    public static final BigInteger TOY_P = BigInteger.valueOf(61);
    public static final BigInteger TOY_Q = BigInteger.valueOf(53);
    public static final BigInteger TOY_N = BigInteger.valueOf(3233);
    public static final BigInteger TOY_E = BigInteger.valueOf(17);
    public static final BigInteger TOY_D = BigInteger.valueOf(2753);

    @SneakyThrows
    public static KeyPair rsaKeyPair(int bits) {
        var generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(bits);

        return generator.generateKeyPair();
    }

    @SneakyThrows
    public static KeyPair ecKeyPair() {
        var generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(256);

        return generator.generateKeyPair();
    }

    /**
     * X.509 SubjectPublicKeyInfo DER
     */
    public static byte[] pkixPublicKey(KeyPair keyPair) {
        return keyPair.getPublic().getEncoded();
    }

    /**
     * PKCS#8 PrivateKeyInfo DER
     */
    public static byte[] pkcs8PrivateKey(KeyPair keyPair) {
        return keyPair.getPrivate().getEncoded();
    }

    @SneakyThrows
    public static byte[] pkcs1PublicKey(KeyPair keyPair) {
        return SubjectPublicKeyInfo.getInstance(pkixPublicKey(keyPair)).parsePublicKey().getEncoded();
    }

    @SneakyThrows
    public static byte[] pkcs1PrivateKey(KeyPair keyPair) {
        return PrivateKeyInfo.getInstance(pkcs8PrivateKey(keyPair)).parsePrivateKey().toASN1Primitive().getEncoded();
    }

    @SneakyThrows
    public static byte[] pem(String type, byte[] der) {
        var sw = new StringWriter();
        try (var writer = new PemWriter(sw)) {
            writer.writeObject(new PemObject(type, der));
        }

        return sw.toString().getBytes(US_ASCII);
    }
}
