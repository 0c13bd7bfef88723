package io.wincrypto.key;

import io.wincrypto.exception.KeyBlobException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

import static io.wincrypto.constant.BlobConstant.CALG_RSA_KEYX;
import static io.wincrypto.constant.BlobConstant.CALG_RSA_SIGN;
import static io.wincrypto.exception.KeyBlobExceptionType.INVALID_USAGE;

/**
 * What the key is meant for once imported. Not derivable from the key itself.
 */
@Getter
@RequiredArgsConstructor
public enum KeyUsage {
    /**
     * Signature key, CALG_RSA_SIGN
     */
    SIGN(1, CALG_RSA_SIGN),
    /**
     * Key exchange key, CALG_RSA_KEYX
     */
    KEYX(2, CALG_RSA_KEYX),
    ;

    private final int code;
    private final int algorithmId;

    public static KeyUsage fromCode(final int code) throws KeyBlobException {
        return Arrays.stream(values())
                .filter(usage -> usage.getCode() == code)
                .findFirst()
                .orElseThrow(() -> new KeyBlobException(INVALID_USAGE, "Invalid rsa key usage " + code));
    }
}
