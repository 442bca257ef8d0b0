package fr.lapetina.primaryserver.domain.generator;

/**
 * Thrown when a generator cannot be constructed or cannot produce an event.
 * Fatal to the primary server.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
