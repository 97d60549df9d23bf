package com.qubi.sentinel.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Carga la configuración YAML una sola vez al arrancar. Las claves ausentes toman los
 * defaults de {@link AppConfig}.
 */
public final class ConfigLoader {
    private ConfigLoader(){}

    public static final String DEFAULT_RESOURCE = "sentinel.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static AppConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading configuration from " + file, e);
        }
    }

    public static AppConfig loadResource(String name) {
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(name);
        if (in == null) throw new IllegalArgumentException("configuration resource not found: " + name);
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading configuration resource " + name, e);
        }
    }

    public static AppConfig load(InputStream yaml) throws IOException {
        JsonNode root = YAML.readTree(yaml);
        // documento vacío = todos los defaults
        AppConfig cfg = root == null || root.isMissingNode() || root.isNull()
                ? new AppConfig()
                : YAML.treeToValue(root, AppConfig.class);
        return cfg.validate();
    }
}
