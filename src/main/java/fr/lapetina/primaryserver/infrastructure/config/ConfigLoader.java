package fr.lapetina.primaryserver.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link PrimaryServerConfig} from YAML.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Environment variable overrides on the loaded tree
 * - Loading additional files named by reconfiguration commands
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Map<String, String> environment;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
    }

    /**
     * Loads the configuration and applies environment overrides.
     *
     * @throws ConfigurationException if loading fails
     */
    public PrimaryServerConfig load() {
        PrimaryServerConfig config = loadFromPath();
        EnvironmentOverrides.apply(config, environment);
        return config;
    }

    private PrimaryServerConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads a configuration file without environment overrides.
     * Used for files named in reconfiguration commands.
     */
    public static PrimaryServerConfig loadFile(Path path) {
        if (!Files.isReadable(path)) {
            throw new ConfigurationException("Configuration file not readable: " + path);
        }
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public static PrimaryServerConfig loadFromStream(InputStream inputStream) {
        return parse(inputStream, "stream");
    }

    private static PrimaryServerConfig parse(InputStream inputStream, String source) {
        Yaml yaml = new Yaml(new Constructor(PrimaryServerConfig.class, new LoaderOptions()));
        try {
            PrimaryServerConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static PrimaryServerConfig createDefault() {
        return new PrimaryServerConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
