package com.voterimport.voterimport.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads and writes {@code <state>_config.json} files in one config directory.
 */
public class StateConfigStore {

    private static final Logger log = LoggerFactory.getLogger(StateConfigStore.class);

    private final Path configDir;
    private final ObjectMapper objectMapper;

    public StateConfigStore(Path configDir) {
        this.configDir = configDir;
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    public Path pathFor(String stateCode) {
        return configDir.resolve(stateCode.trim().toLowerCase(Locale.ROOT) + VoterImportConstants.CONFIG_FILE_SUFFIX);
    }

    public Optional<StateConfig> load(String stateCode) {
        Path path = pathFor(stateCode);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), StateConfig.class));
        } catch (IOException ex) {
            throw new IllegalStateException(VoterImportConstants.MSG_CONFIG_READ_FAILED.formatted(path), ex);
        }
    }

    /**
     * Loads the config for a state or throws {@link ConfigMissingException}.
     */
    public StateConfig require(String stateCode) {
        return load(stateCode).orElseThrow(() -> new ConfigMissingException(stateCode, pathFor(stateCode).toString()));
    }

    public Path save(StateConfig config) {
        Path path = pathFor(config.stateCode());
        try {
            Files.createDirectories(configDir);
            Path temp = Files.createTempFile(configDir, config.stateCode().toLowerCase(Locale.ROOT), ".tmp");
            objectMapper.writeValue(temp.toFile(), config);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new IllegalStateException(VoterImportConstants.MSG_CONFIG_WRITE_FAILED.formatted(path), ex);
        }
        log.info("Saved configuration for state {} version {} to {}", config.stateCode(), config.version(), path);
        return path;
    }
}
