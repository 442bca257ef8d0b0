package fr.lapetina.primaryserver.infrastructure.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.primaryserver.domain.model.ErrorReply;
import fr.lapetina.primaryserver.domain.model.PrimaryChunk;
import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.io.IOException;

/**
 * JSON encoding of work channel messages.
 *
 * Map entries are written in key order so that encoding the same value twice
 * yields identical bytes.
 */
public final class WireCodec {

    private final ObjectMapper objectMapper;

    public WireCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(Object message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (IOException e) {
            throw new CodecException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    public RunConfig decodeRunConfig(byte[] bytes) {
        return decode(bytes, RunConfig.class);
    }

    public PrimaryChunk decodeChunk(byte[] bytes) {
        return decode(bytes, PrimaryChunk.class);
    }

    public ErrorReply decodeErrorReply(byte[] bytes) {
        return decode(bytes, ErrorReply.class);
    }

    private <T> T decode(byte[] bytes, Class<T> type) {
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CodecException("Failed to decode " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Raised for messages that cannot be encoded or decoded.
     */
    public static class CodecException extends RuntimeException {
        public CodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
