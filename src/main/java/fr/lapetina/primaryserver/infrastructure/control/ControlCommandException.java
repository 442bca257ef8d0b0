package fr.lapetina.primaryserver.infrastructure.control;

/**
 * Raised for a control command that cannot be parsed.
 */
public final class ControlCommandException extends RuntimeException {

    public ControlCommandException(String message) {
        super(message);
    }

    public ControlCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
