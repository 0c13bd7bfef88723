package io.wincrypto.utils;

import io.wincrypto.exception.KeyBlobException;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import org.apache.commons.lang3.ArrayUtils;

import java.math.BigInteger;

import static io.wincrypto.exception.KeyBlobExceptionType.ENCODING_OVERFLOW;
import static lombok.AccessLevel.PRIVATE;

/**
 * Fixed-width little-endian encoding of non-negative integers, as every
 * integer field of a key blob is stored.
 */
@NoArgsConstructor(access = PRIVATE)
public final class IntegerCodec {

    /**
     * Encodes value into exactly {@code width} bytes, least significant byte first.
     *
     * @param value non-negative integer
     * @param width field width in bytes
     * @return little-endian field content
     * @throws KeyBlobException ENCODING_OVERFLOW if the magnitude needs more than {@code width} bytes
     */
    public static byte[] encode(@NonNull BigInteger value, int width) throws KeyBlobException {
        if (value.signum() < 0) {
            throw new KeyBlobException(ENCODING_OVERFLOW, "Negative value can not be encoded");
        }
        if (width < 0) {
            throw new IllegalArgumentException("Negative field width " + width);
        }
        var size = byteLength(value);
        if (size > width) {
            throw new KeyBlobException(
                    ENCODING_OVERFLOW,
                    String.format("Value of %d bytes does not fit into a %d byte field", size, width)
            );
        }

        var magnitude = value.toByteArray();
        var result = new byte[width];
        // toByteArray may carry a leading sign byte, copy only the magnitude
        System.arraycopy(magnitude, magnitude.length - size, result, width - size, size);
        ArrayUtils.reverse(result);

        return result;
    }

    /**
     * Reads back a field produced by {@link #encode(BigInteger, int)}.
     */
    public static BigInteger decode(@NonNull byte[] field) {
        var bigEndian = ArrayUtils.clone(field);
        ArrayUtils.reverse(bigEndian);

        return new BigInteger(1, bigEndian);
    }

    /**
     * Number of bytes of the unsigned magnitude, {@code ceil(bitLength / 8)}.
     */
    public static int byteLength(@NonNull BigInteger value) {
        return (value.bitLength() + 7) / 8;
    }
}
