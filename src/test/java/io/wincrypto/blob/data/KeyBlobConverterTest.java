package io.wincrypto.blob.data;

import com.igormaznitsa.jbbp.utils.JBBPUtils;
import io.wincrypto.blob.BlobType;
import io.wincrypto.key.KeyUsage;
import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyBlobConverterTest {

    @Test
    void publicKeyBlobToBytes() {
        var blob = PublicKeyBlob.builder()
                .header(BlobHeader.of(BlobType.PUBLIC_KEY, KeyUsage.KEYX))
                .rsaPubKey(new RsaPubKey(BlobType.PUBLIC_KEY.getMagic(), 16, 65537))
                .modulus(new byte[]{(byte) 0xA1, 0x0C})
                .build();

        var bytes = KeyBlobConverter.toBytes(blob);

        assertEquals(
                "06020000" + "00a40000" + "52534131" + "10000000" + "01000100" + "a10c",
                Hex.encodeHexString(bytes)
        );
    }

    @Test
    void headerBits() {
        var blob = PrivateKeyBlob.builder()
                .header(BlobHeader.of(BlobType.PRIVATE_KEY, KeyUsage.SIGN))
                .rsaPubKey(new RsaPubKey(BlobType.PRIVATE_KEY.getMagic(), 16, 17))
                .modulus(new byte[2])
                .prime1(new byte[1])
                .prime2(new byte[1])
                .exponent1(new byte[1])
                .exponent2(new byte[1])
                .coefficient(new byte[1])
                .privateExponent(new byte[2])
                .build();

        var bytes = KeyBlobConverter.toBytes(blob);
        var bitString = JBBPUtils.bin2str(bytes, true);

        assertEquals(29, bytes.length);
        assertTrue(bitString.startsWith("00000111 00000010"));
    }

    @Test
    void missingField() {
        assertThrows(NullPointerException.class, () -> PublicKeyBlob.builder()
                .header(BlobHeader.of(BlobType.PUBLIC_KEY, KeyUsage.SIGN))
                .modulus(new byte[2])
                .build());
    }
}
