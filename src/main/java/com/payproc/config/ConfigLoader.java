package com.payproc.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * Loads {@code application.yml} from the classpath into a {@link JsonObject}.
 * <p>
 * System properties named after a dotted key ({@code processor.partitions}) override the file.
 */
@Slf4j
public class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final YAMLMapper YAML_MAPPER = new YAMLMapper();
    private static final String[] OVERRIDABLE_KEYS = {"processor.partitions", "output.silent"};

    private final String resource;
    private final Properties overrides;

    public ConfigLoader() {
        this(DEFAULT_RESOURCE, System.getProperties());
    }

    public ConfigLoader(String resource, Properties overrides) {
        this.resource = resource;
        this.overrides = overrides;
    }

    public LedgerConfig load() {
        return LedgerConfig.fromJson(loadJson());
    }

    JsonObject loadJson() {
        JsonObject config = readResource();
        applyOverrides(config);
        log.debug("Loaded configuration: {}", config.encode());
        return config;
    }

    private JsonObject readResource() {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("{} not found in classpath, using defaults", resource);
                return new JsonObject();
            }
            Map<String, Object> values = YAML_MAPPER.readValue(is, new TypeReference<Map<String, Object>>() {
            });
            return values == null ? new JsonObject() : new JsonObject(values);
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: unable to parse " + resource, e);
        }
    }

    private void applyOverrides(JsonObject config) {
        for (String key : OVERRIDABLE_KEYS) {
            String value = overrides.getProperty(key);
            if (value == null) {
                continue;
            }
            String[] path = key.split("\\.");
            JsonObject section = config.getJsonObject(path[0]);
            if (section == null) {
                section = new JsonObject();
                config.put(path[0], section);
            }
            section.put(path[1], coerce(key, value));
            log.info("Configuration override {}={}", key, value);
        }
    }

    private Object coerce(String key, String value) {
        if (key.equals("output.silent")) {
            return Boolean.parseBoolean(value.trim());
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration error: " + key + " must be an integer, got " + value, e);
        }
    }
}
