package fr.lapetina.primaryserver.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.primaryserver.domain.event.WorkRequestEvent;
import fr.lapetina.primaryserver.domain.model.RequestToken;
import fr.lapetina.primaryserver.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.primaryserver.server.JobServer;
import fr.lapetina.primaryserver.server.ServeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;

/**
 * The serving loop body, run on the single serving thread.
 *
 * Responsibilities:
 * - Skips requests whose requester already gave up, without touching the cursor
 * - Serves the request through the {@link JobServer}
 * - Completes the requester's future, then applies the post-reply transitions
 * - Puts back a chunk the requester gave up on while it was being produced
 * - Reports the end of the serving loop
 */
public final class ServingHandler implements EventHandler<WorkRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ServingHandler.class);

    private final JobServer jobServer;
    private final MetricsRegistry metrics;
    private final Runnable servingFinished;

    public ServingHandler(JobServer jobServer, MetricsRegistry metrics, Runnable servingFinished) {
        this.jobServer = jobServer;
        this.metrics = metrics;
        this.servingFinished = servingFinished;
    }

    @Override
    public void onEvent(WorkRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.isAbandoned()) {
                log.debug("Skipping abandoned request: requestId={}, seq={}", event.getRequestId(), sequence);
                return;
            }
            MDC.put("requestId", event.getRequestId());

            ServeResult result = jobServer.handleRequest(event.getPayload());
            recordLatency(event);

            if (!event.getReplyFuture().complete(result)) {
                log.warn("Reply not delivered, requester gave up: requestId={}, result={}",
                        event.getRequestId(), describe(result));
                if (jobServer.rollback(result)) {
                    return;
                }
            }

            if (!jobServer.completeCycle(result)) {
                log.info("Serving loop has no more work: state={}", jobServer.getState());
                servingFinished.run();
            }
        } finally {
            MDC.remove("requestId");
            event.clear();
        }
    }

    private void recordLatency(WorkRequestEvent event) {
        if (event.getAcceptedAt() == null) {
            return;
        }
        String token = RequestToken.fromWire(event.getPayload())
                .map(RequestToken::getWireValue)
                .orElse("unknown");
        metrics.recordRequestLatency(token, Duration.between(event.getAcceptedAt(), Instant.now()));
    }

    private static String describe(ServeResult result) {
        if (result.isChunk()) {
            return result.chunk().toString();
        }
        if (result.isError()) {
            return result.error().type().name();
        }
        return "config";
    }
}
