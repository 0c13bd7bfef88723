package io.wincrypto.blob;

import io.wincrypto.blob.data.BlobHeader;
import io.wincrypto.blob.data.KeyBlobConverter;
import io.wincrypto.blob.data.PrivateKeyBlob;
import io.wincrypto.blob.data.PublicKeyBlob;
import io.wincrypto.blob.data.RsaPubKey;
import io.wincrypto.exception.KeyBlobException;
import io.wincrypto.key.KeyUsage;
import io.wincrypto.key.RsaPrivateKey;
import io.wincrypto.key.RsaPublicKey;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

import static io.wincrypto.constant.BlobConstant.MAX_PUBLIC_EXPONENT;
import static io.wincrypto.exception.KeyBlobExceptionType.ENCODING_OVERFLOW;
import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_USAGE;
import static io.wincrypto.utils.IntegerCodec.encode;
import static java.util.Objects.isNull;
import static lombok.AccessLevel.PRIVATE;

/**
 * Exports RSA keys as CryptoAPI PUBLICKEYBLOB / PRIVATEKEYBLOB structures.
 * <p>
 * Every integer is written little-endian into a field whose width derives from
 * the modulus size L: the modulus and the private exponent take L bytes, the
 * primes and the CRT values take L/2 bytes.
 */
@Slf4j
@NoArgsConstructor(access = PRIVATE)
public final class KeyBlobEncoder {

    /**
     * Export an RSA public key as PUBLICKEYBLOB.
     *
     * @param key   public key
     * @param usage {@link KeyUsage#SIGN} or {@link KeyUsage#KEYX}
     * @return blob bytes, {@code 20 + L} long
     * @throws KeyBlobException INVALID_USAGE if usage is missing, ENCODING_OVERFLOW if the exponent exceeds 32 bits
     */
    public static byte[] exportPublicKeyBlob(@NonNull RsaPublicKey key, KeyUsage usage) throws KeyBlobException {
        return KeyBlobConverter.toBytes(publicKeyBlob(key, usage));
    }

    public static byte[] exportPublicKeyBlob(@NonNull RsaPublicKey key, int usage) throws KeyBlobException {
        return exportPublicKeyBlob(key, KeyUsage.fromCode(usage));
    }

    /**
     * Export an RSA private key as PRIVATEKEYBLOB. CRT values are recomputed from D, P and Q.
     *
     * @param key   private key
     * @param usage {@link KeyUsage#SIGN} or {@link KeyUsage#KEYX}
     * @return blob bytes, {@code 20 + 2L + 5L/2} long
     * @throws KeyBlobException INVALID_USAGE, ENCODING_OVERFLOW when L is odd or a value
     *                          does not fit its field, INVALID_KEY_MATERIAL when CRT values can not be derived
     */
    public static byte[] exportPrivateKeyBlob(@NonNull RsaPrivateKey key, KeyUsage usage) throws KeyBlobException {
        return KeyBlobConverter.toBytes(privateKeyBlob(key, usage));
    }

    public static byte[] exportPrivateKeyBlob(@NonNull RsaPrivateKey key, int usage) throws KeyBlobException {
        return exportPrivateKeyBlob(key, KeyUsage.fromCode(usage));
    }

    public static PublicKeyBlob publicKeyBlob(@NonNull RsaPublicKey key, KeyUsage usage) throws KeyBlobException {
        checkUsage(usage);
        var keyLen = key.getSize();

        var blob = PublicKeyBlob.builder()
                .header(BlobHeader.of(BlobType.PUBLIC_KEY, usage))
                .rsaPubKey(rsaPubKey(BlobType.PUBLIC_KEY, key))
                .modulus(encode(key.getModulus(), keyLen))
                .build();

        log.debug("PUBLICKEYBLOB for {} bit key built, usage {}", keyLen * 8, usage);

        return blob;
    }

    public static PrivateKeyBlob privateKeyBlob(@NonNull RsaPrivateKey key, KeyUsage usage) throws KeyBlobException {
        checkUsage(usage);
        var keyLen = key.getSize();
        if (keyLen % 2 != 0) {
            throw new KeyBlobException(
                    ENCODING_OVERFLOW,
                    String.format("Modulus length of %d bytes can not be split between two primes", keyLen)
            );
        }
        var halfLen = keyLen / 2;
        var crt = key.crtParameters();

        var blob = PrivateKeyBlob.builder()
                .header(BlobHeader.of(BlobType.PRIVATE_KEY, usage))
                .rsaPubKey(rsaPubKey(BlobType.PRIVATE_KEY, key.getPublicKey()))
                .modulus(encode(key.getModulus(), keyLen))
                .prime1(encode(key.getPrime1(), halfLen))
                .prime2(encode(key.getPrime2(), halfLen))
                .exponent1(encode(crt.getExponent1(), halfLen))
                .exponent2(encode(crt.getExponent2(), halfLen))
                .coefficient(encode(crt.getCoefficient(), halfLen))
                .privateExponent(encode(key.getPrivateExponent(), keyLen))
                .build();

        log.debug("PRIVATEKEYBLOB for {} bit key built, usage {}", keyLen * 8, usage);

        return blob;
    }

    private static RsaPubKey rsaPubKey(BlobType blobType, RsaPublicKey key) throws KeyBlobException {
        return new RsaPubKey(blobType.getMagic(), key.getSize() * 8, publicExponent(key.getPublicExponent()));
    }

    private static int publicExponent(BigInteger exponent) throws KeyBlobException {
        if (exponent.compareTo(BigInteger.valueOf(MAX_PUBLIC_EXPONENT)) > 0) {
            throw new KeyBlobException(ENCODING_OVERFLOW, "Public exponent does not fit into 32 bits");
        }

        // unsigned 32 bit value carried in a signed int
        return (int) exponent.longValue();
    }

    private static void checkUsage(KeyUsage usage) throws KeyBlobException {
        if (isNull(usage)) {
            throw new KeyBlobException(INVALID_USAGE, "Invalid rsa key usage null");
        }
    }
}
