package io.wincrypto.blob.data;

import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import com.igormaznitsa.jbbp.io.JBBPByteOrder;
import com.igormaznitsa.jbbp.mapper.Bin;
import com.igormaznitsa.jbbp.mapper.BinType;
import lombok.Value;

import java.io.IOException;

/**
 * RSAPUBKEY, 12 bytes following the header: magic, bit length, public exponent.
 * All three are little-endian; the exponent is an unsigned 32 bit value.
 */
@Value
public class RsaPubKey {

    @Bin(name = "magic", type = BinType.INT, byteOrder = JBBPByteOrder.LITTLE_ENDIAN, order = 0)
    int magic;

    @Bin(name = "bitlen", type = BinType.INT, byteOrder = JBBPByteOrder.LITTLE_ENDIAN, order = 1)
    int bitLength;

    @Bin(name = "pubexp", type = BinType.INT, byteOrder = JBBPByteOrder.LITTLE_ENDIAN, order = 2)
    int publicExponent;

    public RsaPubKey write(final JBBPBitOutputStream Out) throws IOException {
        Out.writeInt(this.magic, JBBPByteOrder.LITTLE_ENDIAN);
        Out.writeInt(this.bitLength, JBBPByteOrder.LITTLE_ENDIAN);
        Out.writeInt(this.publicExponent, JBBPByteOrder.LITTLE_ENDIAN);

        return this;
    }
}
