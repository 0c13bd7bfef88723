package io.wincrypto.export;

public enum KeyType {
    PUBLIC,
    PRIVATE
}
