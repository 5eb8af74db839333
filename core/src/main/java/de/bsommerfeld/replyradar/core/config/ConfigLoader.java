package de.bsommerfeld.replyradar.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code config.toml} into a {@link GlobalConfig}. A missing file is
 * created with the defaults so the user has something to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = createMapper();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration from the given file.
     *
     * @param file path to {@code config.toml}; parent directories are created
     *             when the defaults have to be written
     * @return the parsed configuration, or the defaults if the file did not
     *         exist
     * @throws IOException if the file exists but cannot be read or parsed, or
     *                     the defaults cannot be written
     */
    public static GlobalConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            GlobalConfig defaults = new GlobalConfig();
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), defaults);
            LOG.info("No configuration found, wrote defaults to {}", file);
            return defaults;
        }

        GlobalConfig config = MAPPER.readValue(file.toFile(), GlobalConfig.class);
        LOG.info("Configuration loaded from {}", file);
        return config;
    }

    // Fields only: derived getters such as getInterChunkDelay() must not leak into the file
    private static TomlMapper createMapper() {
        TomlMapper mapper = new TomlMapper();
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
