package fr.lapetina.primaryserver.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies {@code PRIMSERVER_*} environment variables on top of a loaded configuration.
 */
public final class EnvironmentOverrides {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentOverrides.class);

    public static final String GENERATOR = "PRIMSERVER_GENERATOR";
    public static final String CHUNK_SIZE = "PRIMSERVER_CHUNK_SIZE";
    public static final String SEED = "PRIMSERVER_SEED";
    public static final String NEVENTS = "PRIMSERVER_NEVENTS";
    public static final String AS_SERVICE = "PRIMSERVER_AS_SERVICE";
    public static final String DRIVER_PIPE = "PRIMSERVER_DRIVER_PIPE";
    public static final String CONTROL_TIMEOUT_MS = "PRIMSERVER_CONTROL_TIMEOUT_MS";

    private EnvironmentOverrides() {
        // Utility class
    }

    /**
     * Overrides configuration values with the variables present in the environment.
     *
     * @throws ConfigLoader.ConfigurationException if a variable holds an invalid value
     */
    public static void apply(PrimaryServerConfig config, Map<String, String> env) {
        PrimaryServerConfig.RunSection run = config.getRun();
        PrimaryServerConfig.ServiceConfig service = config.getService();

        String value = get(env, GENERATOR);
        if (value != null) {
            run.setGenerator(value);
        }
        value = get(env, CHUNK_SIZE);
        if (value != null) {
            run.setChunkSize((int) parseLong(CHUNK_SIZE, value));
        }
        value = get(env, SEED);
        if (value != null) {
            run.setSeed(parseLong(SEED, value));
        }
        value = get(env, NEVENTS);
        if (value != null) {
            run.setNumberOfEvents((int) parseLong(NEVENTS, value));
        }
        value = get(env, AS_SERVICE);
        if (value != null) {
            service.setAsService(value.equalsIgnoreCase("true") || value.equals("1"));
        }
        value = get(env, DRIVER_PIPE);
        if (value != null) {
            service.setDriverPipe(value);
        }
        value = get(env, CONTROL_TIMEOUT_MS);
        if (value != null) {
            service.setControlTimeoutMs(parseLong(CONTROL_TIMEOUT_MS, value));
        }
    }

    private static String get(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        log.info("Configuration override from environment: {}={}", name, value);
        return value.trim();
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoader.ConfigurationException("Invalid value for " + name + ": " + value, e);
        }
    }
}
