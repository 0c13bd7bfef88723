package io.wincrypto.key;

import io.wincrypto.exception.KeyBlobException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_USAGE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class KeyUsageTest {

    @Test
    void fromCode() throws KeyBlobException {
        assertEquals(KeyUsage.SIGN, KeyUsage.fromCode(1));
        assertEquals(KeyUsage.KEYX, KeyUsage.fromCode(2));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 3, -1, 0x2400, Integer.MAX_VALUE})
    void fromInvalidCode(int code) {
        var e = assertThrows(KeyBlobException.class, () -> KeyUsage.fromCode(code));

        assertEquals(INVALID_USAGE, e.getType());
    }

    @Test
    void algorithmIds() {
        assertEquals(0x00002400, KeyUsage.SIGN.getAlgorithmId());
        assertEquals(0x0000A400, KeyUsage.KEYX.getAlgorithmId());
    }
}
