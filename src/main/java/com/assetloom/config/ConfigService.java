package com.assetloom.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Loads and validates the loader configuration.
 *
 * Reads a flat JSON object, checks it against {@link #SCHEMA}, applies
 * defaults and resolves relative paths against the file's directory.
 */
public class ConfigService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final ConfigSchema SCHEMA = ConfigSchema.builder()
        .field("loadTimeoutMs", ConfigSchema.FieldDefinition.of(ConfigSchema.FieldType.INTEGER)
            .defaultValue(LoaderConfig.DEFAULT_TIMEOUT_MS).min(0).build())
        .field("unloadTimeoutMs", ConfigSchema.FieldDefinition.of(ConfigSchema.FieldType.INTEGER)
            .defaultValue(LoaderConfig.DEFAULT_TIMEOUT_MS).min(0).build())
        .field("dispatcher", ConfigSchema.FieldDefinition.of(ConfigSchema.FieldType.STRING)
            .defaultValue("inline").pattern("(?i)inline|thread").build())
        .field("ioThreads", ConfigSchema.FieldDefinition.of(ConfigSchema.FieldType.INTEGER)
            .defaultValue(LoaderConfig.DEFAULT_IO_THREADS).range(1, 64).build())
        .field("manifest", ConfigSchema.FieldDefinition.of(ConfigSchema.FieldType.STRING)
            .defaultValue(LoaderConfig.DEFAULT_MANIFEST).pattern(".+").build())
        .field("assetRoot", ConfigSchema.FieldDefinition.of(ConfigSchema.FieldType.STRING)
            .defaultValue(".").pattern(".+").build())
        .build();

    /**
     * Loads the configuration file, or the defaults if it does not exist.
     *
     * @param configFile path of the JSON configuration
     * @return validated settings
     * @throws ConfigLoadException if the file cannot be read or is not a JSON object
     * @throws ConfigValidationException if a value is invalid
     */
    public LoaderConfig load(Path configFile) throws ConfigLoadException, ConfigValidationException {
        Map<String, Object> config = new HashMap<>();

        if (Files.exists(configFile)) {
            JsonNode root;
            try {
                root = MAPPER.readTree(Files.readString(configFile));
            } catch (IOException e) {
                throw new ConfigLoadException(
                    String.format("Failed to load loader config from '%s'", configFile), e
                );
            }

            if (root == null || !root.isObject()) {
                throw new ConfigLoadException(
                    String.format("Loader config '%s' must contain a JSON object", configFile)
                );
            }

            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!SCHEMA.isKnownField(field.getKey())) {
                    LOGGER.warn("Ignoring unknown config field '{}' in {}", field.getKey(), configFile);
                    continue;
                }
                config.put(field.getKey(), convertJsonNode(field.getValue()));
            }

            LOGGER.debug("Loaded loader config from {}", configFile);
        } else {
            LOGGER.debug("No loader config at {}, using defaults", configFile);
        }

        Map<String, Object> settings = SCHEMA.resolve(config);

        Path baseDir = configFile.toAbsolutePath().getParent();
        LoaderConfig loaded = new LoaderConfig(
            Duration.ofMillis(((Number) settings.get("loadTimeoutMs")).longValue()),
            Duration.ofMillis(((Number) settings.get("unloadTimeoutMs")).longValue()),
            LoaderConfig.DispatcherMode.valueOf(((String) settings.get("dispatcher")).toUpperCase(Locale.ROOT)),
            ((Number) settings.get("ioThreads")).intValue(),
            resolve(baseDir, (String) settings.get("manifest")),
            resolve(baseDir, (String) settings.get("assetRoot"))
        );

        LOGGER.info("Loader config: dispatcher={}, loadTimeout={}, unloadTimeout={}, ioThreads={}",
            loaded.dispatcher(), loaded.loadTimeout(), loaded.unloadTimeout(), loaded.ioThreads());
        return loaded;
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
    }

    /**
     * Converts a scalar JsonNode to a Java object. Arrays and objects are
     * returned unchanged and fail the schema's type check.
     */
    private static Object convertJsonNode(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        } else if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.asInt() : (Object) node.asLong();
        } else if (node.isNumber()) {
            return node.asDouble();
        } else if (node.isBoolean()) {
            return node.asBoolean();
        } else if (node.isNull()) {
            return null;
        }
        return node;
    }
}
