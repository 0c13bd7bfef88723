package io.wincrypto.blob.data;

import com.igormaznitsa.jbbp.io.JBBPBitOutputStream;
import lombok.NonNull;
import lombok.SneakyThrows;

import java.io.ByteArrayOutputStream;

public class KeyBlobConverter {

    @SneakyThrows
    public static byte[] toBytes(@NonNull PublicKeyBlob blob) {
        try (var baos = new ByteArrayOutputStream()) {
            var out = new JBBPBitOutputStream(baos);
            blob.write(out);
            out.flush();

            return baos.toByteArray();
        }
    }

    @SneakyThrows
    public static byte[] toBytes(@NonNull PrivateKeyBlob blob) {
        try (var baos = new ByteArrayOutputStream()) {
            var out = new JBBPBitOutputStream(baos);
            blob.write(out);
            out.flush();

            return baos.toByteArray();
        }
    }
}
