package io.wincrypto.constant;

/**
 * Constants of the CryptoAPI key blob format.
 * <p>
 * See <a href="https://learn.microsoft.com/en-us/windows/win32/seccrypto/rsa-schannel-key-blobs">RSA/Schannel Key BLOBs</a>
 * and <a href="https://learn.microsoft.com/en-us/windows/win32/seccrypto/alg-id">ALG_ID</a>.
 */
public class BlobConstant {

    public static final byte CUR_BLOB_VERSION = 0x02;

    public static final byte PUBLICKEYBLOB = 0x06;
    public static final byte PRIVATEKEYBLOB = 0x07;

    public static final int CALG_RSA_SIGN = 0x00002400;
    public static final int CALG_RSA_KEYX = 0x0000A400;

    /**
     * "RSA1" read as a little-endian integer
     */
    public static final int MAGIC_RSA1 = 0x31415352;
    /**
     * "RSA2" read as a little-endian integer
     */
    public static final int MAGIC_RSA2 = 0x32415352;

    /**
     * Size of BLOBHEADER (8) and RSAPUBKEY (12), the fixed part preceding the integer fields.
     */
    public static final int BLOB_PREFIX_SIZE = 20;     // In bytes

    /**
     * Largest public exponent the 4 byte pubexp field can hold.
     */
    public static final long MAX_PUBLIC_EXPONENT = 0xFFFFFFFFL;
}
