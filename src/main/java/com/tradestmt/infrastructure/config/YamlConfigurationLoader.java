package com.tradestmt.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads application.yml into a {@link JsonObject}.
 * An explicit file wins over the classpath copy: {@code -Dconfig.file=/path/application.yml}.
 */
@Slf4j
public class YamlConfigurationLoader {

    public static final String CONFIG_FILE_PROPERTY = "config.file";
    private static final String CLASSPATH_RESOURCE = "application.yml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public JsonObject load() {
        String explicitFile = System.getProperty(CONFIG_FILE_PROPERTY);
        if (explicitFile != null && !explicitFile.isBlank()) {
            return loadFile(Paths.get(explicitFile));
        }
        return loadResource(CLASSPATH_RESOURCE);
    }

    public JsonObject loadFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Configuration file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            JsonObject config = parse(is);
            log.info("Loaded configuration from {}", file);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: cannot read " + file, e);
        }
    }

    public JsonObject loadResource(String resource) {
        try (InputStream is = YamlConfigurationLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            JsonObject config = parse(is);
            log.info("Loaded configuration from classpath:{}", resource);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Configuration error: cannot read " + resource, e);
        }
    }

    private JsonObject parse(InputStream is) throws IOException {
        Map<String, Object> tree = yamlMapper.readValue(is, new TypeReference<Map<String, Object>>() {});
        return tree == null ? new JsonObject() : new JsonObject(tree);
    }
}
