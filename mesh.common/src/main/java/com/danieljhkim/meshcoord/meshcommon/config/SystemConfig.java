package com.danieljhkim.meshcoord.meshcommon.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-level settings for a mesh process.
 *
 * <p>
 * Layers, lowest precedence first:
 * <ol>
 * <li>{@code application.properties}, read from {@code <resourcePath>/} on disk or else from the classpath</li>
 * <li>{@code application-<env>.properties} when {@code -Dmesh.env=<env>} is set</li>
 * <li>{@code MESH_<KEY>} environment variables (dots become underscores)</li>
 * <li>{@code -Dmesh.<key>} system properties</li>
 * </ol>
 */
public class SystemConfig {

    private static final Logger logger = LoggerFactory.getLogger(SystemConfig.class);

    private static final String BASE_FILE = "application.properties";
    private static final String PROPERTY_PREFIX = "mesh.";
    private static final String ENV_PREFIX = "MESH_";

    private static SystemConfig INSTANCE;

    private final String resourcePath;
    private final Properties properties = new Properties();

    private SystemConfig(String resourcePath) {
        this.resourcePath = resourcePath == null ? "" : resourcePath;
        loadLayer(BASE_FILE);
        String env = System.getProperty(PROPERTY_PREFIX + "env");
        if (env != null && !env.isBlank()) {
            loadLayer("application-" + env + ".properties");
        }
    }

    public static synchronized SystemConfig getInstance() {
        return getInstance("");
    }

    /**
     * The first call fixes the resource path for the lifetime of the process.
     */
    public static synchronized SystemConfig getInstance(String resourcePath) {
        if (INSTANCE == null) {
            INSTANCE = new SystemConfig(resourcePath);
        }
        return INSTANCE;
    }

    private void loadLayer(String fileName) {
        String location = resourcePath.isEmpty() ? fileName : resourcePath + "/" + fileName;
        Path onDisk = Path.of(location);
        if (Files.isRegularFile(onDisk)) {
            try (InputStream input = Files.newInputStream(onDisk)) {
                properties.load(input);
                logger.info("Loaded {} from filesystem", onDisk.toAbsolutePath());
                return;
            } catch (IOException e) {
                logger.warn("Could not read {}, trying classpath", onDisk, e);
            }
        }
        try (InputStream input = SystemConfig.class.getClassLoader().getResourceAsStream(location)) {
            if (input == null) {
                logger.warn("No {} on filesystem or classpath", location);
                return;
            }
            properties.load(input);
            logger.info("Loaded {} from classpath", location);
        } catch (IOException e) {
            logger.warn("Could not read classpath resource {}", location, e);
        }
    }

    public String getProperty(String key, String defaultValue) {
        String fromSystem = System.getProperty(PROPERTY_PREFIX + key);
        if (fromSystem != null && !fromSystem.isEmpty()) {
            return fromSystem;
        }
        String fromEnv = System.getenv(ENV_PREFIX + key.toUpperCase().replace('.', '_'));
        if (fromEnv != null && !fromEnv.isEmpty()) {
            return fromEnv;
        }
        return properties.getProperty(key, defaultValue);
    }

    public String getProperty(String key) {
        return getProperty(key, null);
    }

    public int getIntProperty(String key, int defaultValue) {
        String raw = getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Property {}='{}' is not an integer, falling back to {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Names of the file-backed properties starting with {@code prefix}; overrides are not listed.
     */
    public Set<String> getAllPropertyNames(String prefix) {
        String wanted = prefix == null ? "" : prefix;
        return properties.stringPropertyNames().stream()
                .filter(name -> name.startsWith(wanted))
                .collect(Collectors.toUnmodifiableSet());
    }

    public Set<String> getAllPropertyNames() {
        return getAllPropertyNames(null);
    }
}
