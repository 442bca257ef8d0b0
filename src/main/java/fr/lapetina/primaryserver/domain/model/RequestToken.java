package fr.lapetina.primaryserver.domain.model;

import java.util.Optional;

/**
 * Closed set of requests accepted on the work channel.
 */
public enum RequestToken {
    CONFIG_REQUEST("config-request"),
    WORK_REQUEST("work-request");

    private final String wireValue;

    RequestToken(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Decodes a request payload. Surrounding whitespace is ignored.
     */
    public static Optional<RequestToken> fromWire(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        String trimmed = payload.trim();
        for (RequestToken token : values()) {
            if (token.wireValue.equals(trimmed)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
