package io.wincrypto.export;

import io.wincrypto.blob.KeyBlobEncoder;
import io.wincrypto.exception.KeyBlobException;
import io.wincrypto.parser.KeyParser;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.util.Objects.isNull;

/**
 * Runs the exports of a {@link KeyBlobConfig}, reading every input key and writing its blob.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class KeyBlobExporter {

    private final Path baseDir;

    public static KeyBlobExporter forConfig(@NonNull Path configPath) {
        var parent = configPath.toAbsolutePath().getParent();

        return new KeyBlobExporter(parent);
    }

    /**
     * Exports every entry, a failed entry does not stop the following ones.
     *
     * @return number of failed exports
     */
    public int exportAll(@NonNull KeyBlobConfig config) {
        var failed = 0;
        for (ExportEntry entry : config.getExports()) {
            if (isNull(entry)) {
                log.warn("Export skipped. Empty export entry");
                failed++;
                continue;
            }
            try {
                var target = export(entry);
                log.info("Exported {} key {} to {}", entry.getKeyType(), entry.getInput(), target);
            } catch (KeyBlobException e) {
                log.warn("Export of {} rejected. {}: {}", entry.getInput(), e.getType(), e.getMessage());
                failed++;
            } catch (IllegalArgumentException e) {
                log.warn("Export skipped. {}", e.getMessage());
                failed++;
            } catch (IOException e) {
                log.error("Export of {} failed.", entry.getInput(), e);
                failed++;
            }
        }

        return failed;
    }

    /**
     * Export one key.
     *
     * @param entry what to export and where
     * @return path of the written blob
     */
    public Path export(@NonNull ExportEntry entry) throws KeyBlobException, IOException {
        if (isNull(entry.getKeyType()) || StringUtils.isAnyBlank(entry.getInput(), entry.getOutput())) {
            throw new IllegalArgumentException("Export entry needs key_type, input and output: " + entry);
        }

        var source = baseDir.resolve(entry.getInput());
        var target = baseDir.resolve(entry.getOutput());
        var blob = toBlob(entry, Files.readAllBytes(source));

        var targetDir = target.toAbsolutePath().getParent();
        if (Files.notExists(targetDir)) {
            Files.createDirectories(targetDir);
        }
        Files.write(target, blob);

        return target;
    }

    private static byte[] toBlob(ExportEntry entry, byte[] data) throws KeyBlobException {
        var pem = entry.getFormat() != KeyFormat.DER;
        switch (entry.getKeyType()) {
            case PUBLIC:
                var publicKey = pem ? KeyParser.parsePublicKeyPem(data) : KeyParser.parsePublicKey(data);
                return KeyBlobEncoder.exportPublicKeyBlob(publicKey, entry.getUsage());
            case PRIVATE:
                var privateKey = pem ? KeyParser.parsePrivateKeyPem(data) : KeyParser.parsePrivateKey(data);
                return KeyBlobEncoder.exportPrivateKeyBlob(privateKey, entry.getUsage());
            default:
                throw new IllegalArgumentException("Unknown key type " + entry.getKeyType());
        }
    }
}
