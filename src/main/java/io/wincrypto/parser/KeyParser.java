package io.wincrypto.parser;

import io.wincrypto.exception.KeyBlobException;
import io.wincrypto.key.RsaPrivateKey;
import io.wincrypto.key.RsaPublicKey;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigInteger;
import java.util.Optional;

import static io.wincrypto.exception.KeyBlobExceptionType.DECODE_ERROR;
import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_KEY_MATERIAL;
import static io.wincrypto.exception.KeyBlobExceptionType.KEY_TYPE_MISMATCH;
import static io.wincrypto.exception.KeyBlobExceptionType.PEM_DECODE_ERROR;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.isNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * Loads RSA keys from ASN.1 DER or PEM data.
 * <p>
 * The raw PKCS#1 structure is tried first, then the wrapped form
 * (SubjectPublicKeyInfo for public keys, PKCS#8 PrivateKeyInfo for private keys),
 * which must carry the rsaEncryption algorithm.
 * <p>
 * BouncyCastle ASN.1 factories report a structure mismatch with assorted unchecked
 * exceptions, so every attempt treats any RuntimeException as "form did not match".
 */
@Slf4j
@NoArgsConstructor(access = PRIVATE)
public final class KeyParser {

    /**
     * Load an RSA public key from the first PEM block of data.
     *
     * @param data PEM text
     * @return public key
     * @throws KeyBlobException PEM_DECODE_ERROR when no PEM block is found, otherwise as {@link #parsePublicKey(byte[])}
     */
    public static RsaPublicKey parsePublicKeyPem(@NonNull byte[] data) throws KeyBlobException {
        return parsePublicKey(decodePem(data));
    }

    /**
     * Load an RSA private key from the first PEM block of data.
     *
     * @param data PEM text
     * @return private key
     * @throws KeyBlobException PEM_DECODE_ERROR when no PEM block is found, otherwise as {@link #parsePrivateKey(byte[])}
     */
    public static RsaPrivateKey parsePrivateKeyPem(@NonNull byte[] data) throws KeyBlobException {
        return parsePrivateKey(decodePem(data));
    }

    /**
     * Load an RSA public key from PKCS#1 RSAPublicKey or X.509 SubjectPublicKeyInfo DER.
     *
     * @param der DER bytes
     * @return public key
     * @throws KeyBlobException DECODE_ERROR when neither form matches, KEY_TYPE_MISMATCH when the wrapped key is not RSA
     */
    public static RsaPublicKey parsePublicKey(@NonNull byte[] der) throws KeyBlobException {
        var pkcs1 = tryPkcs1PublicKey(der);
        if (pkcs1.isPresent()) {
            return pkcs1.get();
        }

        SubjectPublicKeyInfo info;
        try {
            info = SubjectPublicKeyInfo.getInstance(toPrimitive(der));
        } catch (IOException | RuntimeException e) {
            throw new KeyBlobException(DECODE_ERROR, "Data is neither PKCS#1 nor PKIX public key: " + e.getMessage(), e);
        }

        var algorithm = info.getAlgorithm().getAlgorithm();
        if (!PKCSObjectIdentifiers.rsaEncryption.equals(algorithm)) {
            throw new KeyBlobException(KEY_TYPE_MISMATCH, "Invalid public key type " + algorithm.getId());
        }

        try {
            return toPublicKey(info.parsePublicKey());
        } catch (IOException | RuntimeException e) {
            throw new KeyBlobException(DECODE_ERROR, "Malformed RSA public key in PKIX structure: " + e.getMessage(), e);
        }
    }

    /**
     * Load an RSA private key from PKCS#1 RSAPrivateKey or PKCS#8 PrivateKeyInfo DER.
     *
     * @param der DER bytes
     * @return private key
     * @throws KeyBlobException DECODE_ERROR when neither form matches, KEY_TYPE_MISMATCH when the wrapped key is not RSA,
     *                          INVALID_KEY_MATERIAL for multi-prime keys
     */
    public static RsaPrivateKey parsePrivateKey(@NonNull byte[] der) throws KeyBlobException {
        var pkcs1 = tryPkcs1PrivateKey(der);
        if (pkcs1.isPresent()) {
            return toPrivateKey(pkcs1.get());
        }

        PrivateKeyInfo info;
        try {
            info = PrivateKeyInfo.getInstance(toPrimitive(der));
        } catch (IOException | RuntimeException e) {
            throw new KeyBlobException(DECODE_ERROR, "Data is neither PKCS#1 nor PKCS#8 private key: " + e.getMessage(), e);
        }

        var algorithm = info.getPrivateKeyAlgorithm().getAlgorithm();
        if (!PKCSObjectIdentifiers.rsaEncryption.equals(algorithm)) {
            throw new KeyBlobException(KEY_TYPE_MISMATCH, "Invalid private key type " + algorithm.getId());
        }

        try {
            return toPrivateKey(org.bouncycastle.asn1.pkcs.RSAPrivateKey.getInstance(info.parsePrivateKey()));
        } catch (IOException | RuntimeException e) {
            throw new KeyBlobException(DECODE_ERROR, "Malformed RSA private key in PKCS#8 structure: " + e.getMessage(), e);
        }
    }

    private static Optional<RsaPublicKey> tryPkcs1PublicKey(byte[] der) throws KeyBlobException {
        try {
            return Optional.of(toPublicKey(toPrimitive(der)));
        } catch (IOException | RuntimeException e) {
            log.debug("Not a PKCS#1 public key, trying PKIX. {}", e.getMessage());

            return Optional.empty();
        }
    }

    private static Optional<org.bouncycastle.asn1.pkcs.RSAPrivateKey> tryPkcs1PrivateKey(byte[] der) {
        try {
            return Optional.of(org.bouncycastle.asn1.pkcs.RSAPrivateKey.getInstance(toPrimitive(der)));
        } catch (IOException | RuntimeException e) {
            log.debug("Not a PKCS#1 private key, trying PKCS#8. {}", e.getMessage());

            return Optional.empty();
        }
    }

    /**
     * Reads a PKCS#1 RSAPublicKey keeping the sign of both INTEGERs. BouncyCastle's
     * {@code RSAPublicKey} reads them as unsigned, which would turn a negative modulus
     * into a different positive one.
     */
    private static RsaPublicKey toPublicKey(ASN1Encodable encodable) throws KeyBlobException {
        var seq = ASN1Sequence.getInstance(encodable);
        if (seq.size() != 2) {
            throw new IllegalArgumentException("Bad sequence size: " + seq.size());
        }
        var modulus = ASN1Integer.getInstance(seq.getObjectAt(0)).getValue();
        var publicExponent = ASN1Integer.getInstance(seq.getObjectAt(1)).getValue();
        if (modulus.signum() <= 0 || publicExponent.signum() <= 0) {
            throw new IllegalArgumentException("RSA modulus and public exponent must be positive");
        }

        return RsaPublicKey.of(modulus, publicExponent);
    }

    private static RsaPrivateKey toPrivateKey(org.bouncycastle.asn1.pkcs.RSAPrivateKey rsa) throws KeyBlobException {
        // version 1 means otherPrimeInfos follow, the blob only has room for two primes
        if (!BigInteger.ZERO.equals(rsa.getVersion())) {
            throw new KeyBlobException(INVALID_KEY_MATERIAL, "Multi-prime RSA keys are not supported");
        }

        return RsaPrivateKey.of(
                rsa.getModulus(),
                rsa.getPublicExponent(),
                rsa.getPrivateExponent(),
                rsa.getPrime1(),
                rsa.getPrime2()
        );
    }

    /**
     * Whole input must be a single DER structure, trailing bytes are rejected.
     */
    private static ASN1Primitive toPrimitive(byte[] der) throws IOException {
        var primitive = ASN1Primitive.fromByteArray(der);
        if (isNull(primitive)) {
            throw new IOException("Empty DER data");
        }

        return primitive;
    }

    private static byte[] decodePem(byte[] data) throws KeyBlobException {
        PemObject pemObject;
        try (var reader = new PemReader(new InputStreamReader(new ByteArrayInputStream(data), US_ASCII))) {
            pemObject = reader.readPemObject();
        } catch (IOException | IllegalStateException e) {
            throw new KeyBlobException(PEM_DECODE_ERROR, "Failed to decode PEM data: " + e.getMessage(), e);
        }
        if (isNull(pemObject)) {
            throw new KeyBlobException(PEM_DECODE_ERROR, "Failed to decode PEM data");
        }
        log.debug("PEM block of type {} decoded", pemObject.getType());

        return pemObject.getContent();
    }
}
