package io.wincrypto;

import io.wincrypto.export.KeyBlobConfig;
import io.wincrypto.export.KeyBlobExporter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line entry point: {@code KeyBlobTool <config.yml>}.
 */
@Slf4j
public class KeyBlobTool {

    static final String DEFAULT_CONFIG = "keyblob.yml";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        var configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        if (Files.notExists(configPath)) {
            log.error("Config file {} not found", configPath.toAbsolutePath());
            return 1;
        }

        KeyBlobConfig config;
        try {
            config = KeyBlobConfig.initConfig(configPath);
        } catch (IOException e) {
            log.error("Unable to read config {}", configPath, e);
            return 1;
        }

        var failed = KeyBlobExporter.forConfig(configPath).exportAll(config);
        if (failed > 0) {
            log.error("{} of {} exports failed", failed, config.getExports().size());
            return 1;
        }

        return 0;
    }
}
