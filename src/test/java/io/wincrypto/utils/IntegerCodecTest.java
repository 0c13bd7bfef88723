package io.wincrypto.utils;

import io.wincrypto.exception.KeyBlobException;
import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static io.wincrypto.exception.KeyBlobExceptionType.ENCODING_OVERFLOW;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IntegerCodecTest {

    @ParameterizedTest
    @CsvSource({
            "3233, 2, a10c",
            "3233, 4, a10c0000",
            "0, 3, 000000",
            "255, 1, ff",
            "128, 2, 8000",
            "65537, 3, 010001",
    })
    void encode(long value, int width, String expectedHex) throws KeyBlobException {
        var actual = IntegerCodec.encode(BigInteger.valueOf(value), width);

        assertEquals(expectedHex, Hex.encodeHexString(actual));
    }

    @Test
    void encodeHighBitValueDropsSignByte() throws KeyBlobException {
        // toByteArray of 0xFF00 is 00 FF 00, the sign byte must not count
        var actual = IntegerCodec.encode(new BigInteger("FF00", 16), 2);

        assertArrayEquals(new byte[]{0x00, (byte) 0xFF}, actual);
    }

    @Test
    void encodeOverflow() {
        var e = assertThrows(KeyBlobException.class, () -> IntegerCodec.encode(BigInteger.valueOf(3233), 1));

        assertEquals(ENCODING_OVERFLOW, e.getType());
    }

    @Test
    void encodeNegative() {
        var e = assertThrows(KeyBlobException.class, () -> IntegerCodec.encode(BigInteger.valueOf(-1), 4));

        assertEquals(ENCODING_OVERFLOW, e.getType());
    }

    @Test
    void decodeRecoversValue() throws KeyBlobException {
        var value = new BigInteger("c4b1a7f3e29d0a5566778899aabbccdd", 16);

        assertEquals(value, IntegerCodec.decode(IntegerCodec.encode(value, 32)));
    }

    @Test
    void byteLength() {
        assertEquals(0, IntegerCodec.byteLength(BigInteger.ZERO));
        assertEquals(2, IntegerCodec.byteLength(BigInteger.valueOf(3233)));
        assertEquals(128, IntegerCodec.byteLength(BigInteger.ONE.shiftLeft(1023)));
        assertEquals(129, IntegerCodec.byteLength(BigInteger.ONE.shiftLeft(1024)));
    }
}
