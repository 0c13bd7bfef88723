package io.wincrypto.blob.data;

import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import com.igormaznitsa.jbbp.io.JBBPByteOrder;
import com.igormaznitsa.jbbp.mapper.Bin;
import com.igormaznitsa.jbbp.mapper.BinType;
import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.io.IOException;

/**
 * PRIVATEKEYBLOB. Field order and widths are fixed by the format:
 * <pre>
 * {@code
 * BLOBHEADER blobheader;
 * RSAPUBKEY  rsapubkey;
 * BYTE modulus[rsapubkey.bitlen/8];
 * BYTE prime1[rsapubkey.bitlen/16];
 * BYTE prime2[rsapubkey.bitlen/16];
 * BYTE exponent1[rsapubkey.bitlen/16];
 * BYTE exponent2[rsapubkey.bitlen/16];
 * BYTE coefficient[rsapubkey.bitlen/16];
 * BYTE privateExponent[rsapubkey.bitlen/8];
 * }
 * </pre>
 */
@Value
@Builder
@ToString(of = {"header", "rsaPubKey"})
public class PrivateKeyBlob {

    @NonNull
    @Bin(name = "blobheader", order = 0)
    BlobHeader header;

    @NonNull
    @Bin(name = "rsapubkey", order = 1)
    RsaPubKey rsaPubKey;

    @NonNull
    @Bin(name = "modulus", type = BinType.BYTE_ARRAY, order = 2)
    byte[] modulus;

    @NonNull
    @Bin(name = "prime1", type = BinType.BYTE_ARRAY, order = 3)
    byte[] prime1;

    @NonNull
    @Bin(name = "prime2", type = BinType.BYTE_ARRAY, order = 4)
    byte[] prime2;

    @NonNull
    @Bin(name = "exponent1", type = BinType.BYTE_ARRAY, order = 5)
    byte[] exponent1;

    @NonNull
    @Bin(name = "exponent2", type = BinType.BYTE_ARRAY, order = 6)
    byte[] exponent2;

    @NonNull
    @Bin(name = "coefficient", type = BinType.BYTE_ARRAY, order = 7)
    byte[] coefficient;

    @NonNull
    @Bin(name = "privateExponent", type = BinType.BYTE_ARRAY, order = 8)
    byte[] privateExponent;

    public PrivateKeyBlob write(final JBBPBitOutputStream Out) throws IOException {
        header.write(Out);
        rsaPubKey.write(Out);
        for (byte[] field : new byte[][]{modulus, prime1, prime2, exponent1, exponent2, coefficient, privateExponent}) {
            Out.writeBytes(field, field.length, JBBPByteOrder.BIG_ENDIAN);
        }

        return this;
    }
}
