package fr.lapetina.primaryserver.server;

import fr.lapetina.primaryserver.domain.model.ErrorReply;
import fr.lapetina.primaryserver.domain.model.ErrorType;
import fr.lapetina.primaryserver.domain.model.PrimaryChunk;
import fr.lapetina.primaryserver.domain.model.RunConfig;

/**
 * Reply to one work-channel request. Exactly one of config, chunk or error is set.
 */
public record ServeResult(RunConfig config, PrimaryChunk chunk, ErrorReply error) {

    public static ServeResult ofConfig(RunConfig config) {
        return new ServeResult(config, null, null);
    }

    public static ServeResult ofChunk(PrimaryChunk chunk) {
        return new ServeResult(null, chunk, null);
    }

    public static ServeResult ofError(ErrorType type, String message) {
        return new ServeResult(null, null, new ErrorReply(type, message));
    }

    public boolean isConfig() {
        return config != null;
    }

    public boolean isChunk() {
        return chunk != null;
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isExhaustionSignal() {
        return chunk != null && chunk.isExhaustionSignal();
    }
}
