package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import de.bsommerfeld.rentalprice.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link PipelineConfig} from TOML. Keys missing from the file keep
 * their defaults; unknown keys and malformed values are rejected. Every
 * loaded configuration is validated before it is returned.
 */
public final class PipelineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfigLoader.class);

    private static final ObjectMapper MAPPER = TomlMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();

    private PipelineConfigLoader() {
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig().validate();
    }

    public static PipelineConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path.toAbsolutePath());
        }
        LOG.info("Loading configuration from {}", path.toAbsolutePath());
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path, e);
        }
    }

    public static PipelineConfig loadResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PipelineConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            LOG.info("Loading configuration from classpath resource {}", resource);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource " + resource, e);
        }
    }

    public static PipelineConfig parse(String toml) {
        if (toml == null || toml.isBlank()) {
            return defaults();
        }
        try {
            PipelineConfig config = MAPPER.readValue(toml, PipelineConfig.class);
            return config.validate();
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
    }
}
