package io.wincrypto.blob;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import static io.wincrypto.constant.BlobConstant.MAGIC_RSA1;
import static io.wincrypto.constant.BlobConstant.MAGIC_RSA2;
import static io.wincrypto.constant.BlobConstant.PRIVATEKEYBLOB;
import static io.wincrypto.constant.BlobConstant.PUBLICKEYBLOB;

@Getter
@RequiredArgsConstructor
public enum BlobType {
    /**
     * Public key blob, RSAPUBKEY magic "RSA1"
     */
    PUBLIC_KEY(PUBLICKEYBLOB, MAGIC_RSA1),
    /**
     * Private key blob, RSAPUBKEY magic "RSA2"
     */
    PRIVATE_KEY(PRIVATEKEYBLOB, MAGIC_RSA2),
    ;

    private final byte value;
    private final int magic;
}
