package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file yields the
 * built-in defaults; a present but malformed file is a setup error.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * @param configPath path of {@code config.toml}, may be {@code null}
     * @throws IllegalStateException if the file exists but cannot be parsed
     */
    public static GlobalConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            LOG.info("No configuration at {}, using defaults", configPath);
            return new GlobalConfig();
        }

        LOG.info("Loading configuration from {}", configPath.toAbsolutePath());
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration " + configPath, e);
        }
    }

    static GlobalConfig parse(Reader reader) throws IOException {
        GlobalConfig config = MAPPER.readValue(reader, GlobalConfig.class);
        return config != null ? config : new GlobalConfig();
    }
}
