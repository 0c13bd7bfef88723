package io.wincrypto.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.wincrypto.key.KeyUsage;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One key to export. Paths are resolved against the directory of the configuration file.
 */
@ToString
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ExportEntry {

    @JsonProperty("key_type")
    private KeyType keyType;

    private KeyUsage usage;

    private KeyFormat format = KeyFormat.PEM;

    private String input;

    private String output;
}
