package io.wincrypto.blob.data;

import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import com.igormaznitsa.jbbp.io.JBBPByteOrder;
import com.igormaznitsa.jbbp.mapper.Bin;
import com.igormaznitsa.jbbp.mapper.BinType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.io.IOException;

/**
 * PUBLICKEYBLOB: header, RSAPUBKEY and the modulus. Integer fields hold
 * already little-endian encoded content and are written as is.
 */
@Value
@Builder
public class PublicKeyBlob {

    @NonNull
    @Bin(name = "blobheader", order = 0)
    BlobHeader header;

    @NonNull
    @Bin(name = "rsapubkey", order = 1)
    RsaPubKey rsaPubKey;

    @NonNull
    @Bin(name = "modulus", type = BinType.BYTE_ARRAY, order = 2)
    byte[] modulus;

    public PublicKeyBlob write(final JBBPBitOutputStream Out) throws IOException {
        header.write(Out);
        rsaPubKey.write(Out);
        Out.writeBytes(this.modulus, this.modulus.length, JBBPByteOrder.BIG_ENDIAN);

        return this;
    }
}
