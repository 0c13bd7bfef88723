package io.wincrypto.blob.data;

import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import com.igormaznitsa.jbbp.io.JBBPByteOrder;
import com.igormaznitsa.jbbp.mapper.Bin;
import com.igormaznitsa.jbbp.mapper.BinType;
import io.wincrypto.blob.BlobType;
import io.wincrypto.key.KeyUsage;
import lombok.Value;

import java.io.IOException;

import static io.wincrypto.constant.BlobConstant.CUR_BLOB_VERSION;

/**
 * BLOBHEADER, 8 bytes.
 * <pre>
 * {@code
 * +------+---------+----------+------------------+
 * | type | version | reserved | aiKeyAlg (LE)    |
 * |  1   |    1    |    2     |        4         |
 * +------+---------+----------+------------------+
 * }
 * </pre>
 */
@Value
public class BlobHeader {

    @Bin(name = "bType", type = BinType.BYTE, order = 0)
    byte type;

    @Bin(name = "bVersion", type = BinType.BYTE, order = 1)
    byte version;

    @Bin(name = "reserved", type = BinType.SHORT, byteOrder = JBBPByteOrder.LITTLE_ENDIAN, order = 2)
    short reserved;

    @Bin(name = "aiKeyAlg", type = BinType.INT, byteOrder = JBBPByteOrder.LITTLE_ENDIAN, order = 3)
    int algorithmId;

    public static BlobHeader of(BlobType blobType, KeyUsage usage) {
        return new BlobHeader(blobType.getValue(), CUR_BLOB_VERSION, (short) 0, usage.getAlgorithmId());
    }

    public BlobHeader write(final JBBPBitOutputStream Out) throws IOException {
        Out.write(this.type);
        Out.write(this.version);
        Out.writeShort(this.reserved, JBBPByteOrder.LITTLE_ENDIAN);
        Out.writeInt(this.algorithmId, JBBPByteOrder.LITTLE_ENDIAN);

        return this;
    }
}
