package fr.lapetina.primaryserver.disruptor.exception;

/**
 * Thrown when a work request cannot be queued for the serving thread.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ring buffer is full"),
        NOT_SERVING("Serving loop is not running");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
