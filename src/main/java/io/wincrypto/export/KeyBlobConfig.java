package io.wincrypto.export;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;

@ToString
@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class KeyBlobConfig {

    private static final YAMLMapper mapper = YAMLMapper.builder()
            .configure(FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    public static KeyBlobConfig initConfig(Path configPath) throws IOException {
        return mapper.readValue(configPath.toFile(), KeyBlobConfig.class);
    }

    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<ExportEntry> exports = new ArrayList<>();
}
