package io.wincrypto.exception;

import lombok.Getter;

@Getter
public class KeyBlobException extends Exception {

    private final KeyBlobExceptionType type;

    public KeyBlobException(KeyBlobExceptionType type, String errorMessage) {
        super(errorMessage);
        this.type = type;
    }

    public KeyBlobException(KeyBlobExceptionType type, String errorMessage, Throwable cause) {
        super(errorMessage, cause);
        this.type = type;
    }
}
