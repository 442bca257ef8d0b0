package fr.lapetina.primaryserver.infrastructure.http;

/**
 * The worker could not obtain the run configuration from the server.
 */
public final class ConfigurationUnavailableException extends RuntimeException {

    public ConfigurationUnavailableException(String message) {
        super(message);
    }

    public ConfigurationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
