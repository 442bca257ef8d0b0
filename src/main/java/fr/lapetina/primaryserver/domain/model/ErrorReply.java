package fr.lapetina.primaryserver.domain.model;

import java.util.Objects;

/**
 * Error carried back on the work channel instead of a chunk or a configuration.
 */
public record ErrorReply(ErrorType type, String message) {

    public ErrorReply {
        Objects.requireNonNull(type, "Error type is required");
        if (message == null) {
            message = type.name();
        }
    }
}
