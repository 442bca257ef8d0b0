package fr.lapetina.primaryserver.domain.event;

import fr.lapetina.primaryserver.server.ServeResult;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot carrying one work-channel request to the serving thread.
 *
 * Mutable and reused by the Disruptor; only touched by the publishing HTTP
 * thread before publication and by the serving handler afterwards.
 */
public final class WorkRequestEvent {

    private String requestId;
    private String payload;
    private Instant acceptedAt;
    private CompletableFuture<ServeResult> replyFuture;
    private long sequence;

    public void clear() {
        this.requestId = null;
        this.payload = null;
        this.acceptedAt = null;
        this.replyFuture = null;
        this.sequence = -1;
    }

    public void initialize(String requestId, String payload, CompletableFuture<ServeResult> replyFuture) {
        clear();
        this.requestId = requestId;
        this.payload = payload;
        this.replyFuture = replyFuture;
        this.acceptedAt = Instant.now();
    }

    public String getRequestId() {
        return requestId;
    }

    public String getPayload() {
        return payload;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public CompletableFuture<ServeResult> getReplyFuture() {
        return replyFuture;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    /**
     * True when the requester already gave up on this request.
     */
    public boolean isAbandoned() {
        return replyFuture == null || replyFuture.isDone();
    }

    @Override
    public String toString() {
        return "WorkRequestEvent{" +
                "requestId=" + requestId +
                ", payload=" + payload +
                ", seq=" + sequence +
                '}';
    }
}
