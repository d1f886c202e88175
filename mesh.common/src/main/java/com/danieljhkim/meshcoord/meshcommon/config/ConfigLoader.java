package com.danieljhkim.meshcoord.meshcommon.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

public class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "mesh-config.yml";

    /**
     * Gets the config file path from MESH_CONFIG_PATH environment variable,
     * defaulting to "mesh-config.yml" if not set.
     */
    public static String getConfigFilePath() {
        String configPath = System.getenv("MESH_CONFIG_PATH");
        if (configPath == null || configPath.isEmpty()) {
            configPath = DEFAULT_CONFIG_FILE;
        }
        return configPath;
    }

    /**
     * Loads the application configuration using the path from MESH_CONFIG_PATH
     * environment variable, defaulting to "mesh-config.yml" if not set.
     */
    public static AppConfig load() throws IOException {
        return load(getConfigFilePath());
    }

    /**
     * Loads the application configuration from a filesystem path if one exists there, otherwise from the classpath.
     */
    public static AppConfig load(String yamlPath) throws IOException {
        Path path = Paths.get(yamlPath);
        if (Files.isRegularFile(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                return parse(in, yamlPath);
            }
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(yamlPath)) {
            if (in == null) {
                throw new IOException("Config file not found on filesystem or classpath: " + yamlPath);
            }
            return parse(in, yamlPath);
        }
    }

    private static AppConfig parse(InputStream in, String source) throws IOException {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(AppConfig.class, loaderOptions);
        Yaml yaml = new Yaml(constructor);
        AppConfig config;
        try {
            config = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("Malformed config file: " + source, e);
        }
        if (config == null) {
            // empty document
            return new AppConfig();
        }
        return config;
    }
}
