package fr.lapetina.primaryserver.worker;

/**
 * Outcome of one worker kernel cycle.
 */
public enum KernelResult {
    /** A chunk was processed */
    PROCESSED,

    /** The server sent the exhaustion signal, the loop ends */
    NO_MORE_WORK,

    /** The server is idle, back off and try again */
    SERVER_IDLE,

    /** No usable reply, back off and try again */
    UNAVAILABLE
}
