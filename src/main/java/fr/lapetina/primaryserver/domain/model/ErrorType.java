package fr.lapetina.primaryserver.domain.model;

/**
 * Error taxonomy of work channel replies.
 */
public enum ErrorType {
    /** Request payload is not one of the known tokens */
    PROTOCOL_VIOLATION(400),

    /** Event generation failed, the server stops */
    GENERATION_FAILED(500),

    /** Server not serving or under backpressure */
    UNAVAILABLE(503),

    /** No reply within the reply timeout */
    TIMEOUT(504);

    private final int httpStatus;

    ErrorType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
