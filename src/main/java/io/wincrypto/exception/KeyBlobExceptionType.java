package io.wincrypto.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum KeyBlobExceptionType {
    /**
     * No PEM block found in the input
     */
    PEM_DECODE_ERROR(0),
    /**
     * No known DER structure matched
     */
    DECODE_ERROR(1),
    /**
     * Wrapped key decoded but does not hold an RSA key
     */
    KEY_TYPE_MISMATCH(2),
    INVALID_USAGE(3),
    /**
     * A value does not fit its fixed-width field
     */
    ENCODING_OVERFLOW(4),
    INVALID_KEY_MATERIAL(5),
    ;

    private final int code;
}
