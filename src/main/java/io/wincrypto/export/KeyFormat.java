package io.wincrypto.export;

public enum KeyFormat {
    /**
     * Text with a -----BEGIN ...----- block
     */
    PEM,
    /**
     * Raw ASN.1 DER
     */
    DER
}
