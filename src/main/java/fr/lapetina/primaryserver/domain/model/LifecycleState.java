package fr.lapetina.primaryserver.domain.model;

import java.util.Optional;

/**
 * Top-level lifecycle state of the primary server.
 *
 * The wire code is what the status channel replies with.
 */
public enum LifecycleState {
    /** Generator being set up, no event produced yet */
    INITIALIZING(0),

    /** First event of a generation cycle in production */
    WAITING_EVENT(1),

    /** Events available, work requests are being served */
    READY_TO_SERVE(2),

    /** Event budget exhausted, nothing left to serve */
    IDLE(3),

    /** Terminal, the serving loop has ceased */
    STOPPED(4);

    private final int code;

    LifecycleState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Whether a worker polling the status channel should go on and request work.
     */
    public boolean acceptsWorkRequests() {
        return this == INITIALIZING || this == WAITING_EVENT || this == READY_TO_SERVE;
    }

    public static Optional<LifecycleState> fromCode(int code) {
        for (LifecycleState state : values()) {
            if (state.code == code) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
